package com.prakash.focusplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "tasks")
public class Task {

    @Id
    private String id;

    @Indexed
    private String ownerId;

    private String title;
    private String description;

    @Builder.Default
    private TaskType type = TaskType.TASK;

    private boolean completed;
    private LocalDateTime completedAt; // Set iff completed

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime modifiedAt;

    private int sortOrder; // Position among siblings

    @Indexed
    private String parentTaskId; // Null for top-level tasks

    // Subtask completion states captured right before this task was last completed as a whole
    private List<Boolean> previousCompletionSnapshot;

    public boolean isSubtask() {
        return parentTaskId != null;
    }

    public void markCompleted(LocalDateTime at) {
        this.completed = true;
        this.completedAt = at;
    }

    public void markIncomplete() {
        this.completed = false;
        this.completedAt = null;
    }

    /**
     * Copy that does not share the snapshot list with this instance.
     */
    public Task copy() {
        Task copy = toBuilder().build();
        if (previousCompletionSnapshot != null) {
            copy.setPreviousCompletionSnapshot(new ArrayList<>(previousCompletionSnapshot));
        }
        return copy;
    }
}
