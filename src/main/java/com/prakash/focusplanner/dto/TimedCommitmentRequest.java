package com.prakash.focusplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class TimedCommitmentRequest {

    @NotBlank(message = "Task id is required.")
    private String taskId;

    @NotNull(message = "Scheduled time is required.")
    private LocalDateTime scheduledTime;
}
