package com.prakash.focusplanner.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class ScheduleTimeRequest {

    @NotNull(message = "Scheduled time is required.")
    private LocalDateTime scheduledTime;

    @Min(value = 1, message = "Duration must be at least one minute.")
    private Integer durationMinutes; // 30 minutes when absent
}
