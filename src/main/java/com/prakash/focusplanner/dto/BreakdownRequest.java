package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Timeframe;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class BreakdownRequest {

    @NotNull(message = "Target timeframe is required.")
    private Timeframe targetTimeframe;

    @NotNull(message = "Target date is required.")
    private LocalDate targetDate;

    // Commit this subtask of the parent's task instead of the parent's task itself
    private String subtaskId;
}
