package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Timeframe;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class RescheduleRequest {

    @NotNull(message = "New date is required.")
    private LocalDate date;

    private Timeframe timeframe; // keeps the current timeframe when absent
}
