package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Section;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class MoveRequest {

    @NotNull(message = "Destination section is required.")
    private Section section;

    @Min(value = 0, message = "Target index cannot be negative.")
    private Integer targetIndex; // end of the section when absent
}
