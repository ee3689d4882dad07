package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class CommitRequest {

    @NotBlank(message = "Task id is required.")
    private String taskId;

    @NotNull(message = "Timeframe is required.")
    private Timeframe timeframe;

    @NotNull(message = "Section is required.")
    private Section section;

    @NotNull(message = "Date is required.")
    private LocalDate date;
}
