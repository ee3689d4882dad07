package com.prakash.focusplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CreateSubtaskRequest {

    @NotBlank(message = "Subtask title cannot be blank.")
    @Size(max = 200, message = "Subtask title cannot exceed 200 characters.")
    private String title;

    // When set, the subtask is also committed alongside this commitment
    private String commitmentId;
}
