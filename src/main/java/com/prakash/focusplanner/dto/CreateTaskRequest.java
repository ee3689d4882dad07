package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.TaskType;
import com.prakash.focusplanner.model.Timeframe;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "Task title cannot be blank.")
    @Size(max = 200, message = "Task title cannot exceed 200 characters.")
    private String title;

    private TaskType type;

    // Commit right away when all three are given
    private Timeframe timeframe;
    private Section section;
    private LocalDate date;

    public boolean hasCommitment() {
        return timeframe != null && section != null && date != null;
    }
}
