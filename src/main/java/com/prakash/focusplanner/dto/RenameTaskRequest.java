package com.prakash.focusplanner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RenameTaskRequest {

    @NotBlank(message = "Task title cannot be blank.")
    @Size(max = 200, message = "Task title cannot exceed 200 characters.")
    private String title;
}
