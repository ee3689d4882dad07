package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResponse {

    private String id;
    private String title;
    private String description;
    private TaskType type;
    private boolean completed;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private int sortOrder;
    private String parentTaskId;

    public static TaskResponse fromEntity(Task task) {
        if (task == null) {
            return null;
        }
        return TaskResponse.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .type(task.getType())
                .completed(task.isCompleted())
                .completedAt(task.getCompletedAt())
                .createdAt(task.getCreatedAt())
                .sortOrder(task.getSortOrder())
                .parentTaskId(task.getParentTaskId())
                .build();
    }
}
