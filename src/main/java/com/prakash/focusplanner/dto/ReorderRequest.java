package com.prakash.focusplanner.dto;

import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ReorderRequest {

    // Either a drop target or an index; the target wins when both are given
    private String targetCommitmentId;

    @Min(value = 0, message = "Target index cannot be negative.")
    private Integer targetIndex;
}
