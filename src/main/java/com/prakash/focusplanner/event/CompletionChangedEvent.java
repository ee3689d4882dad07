package com.prakash.focusplanner.event;

import java.time.LocalDateTime;

/**
 * A task's completion state changed.
 *
 * @param taskId          the task whose state changed
 * @param completed       the new state
 * @param completedAt     completion time, null when not completed
 * @param subtasksChanged true if the task's subtasks were completed or restored along with it
 * @param source          identifier of the view that made the change, used to drop echoes
 */
public record CompletionChangedEvent(
        String taskId,
        boolean completed,
        LocalDateTime completedAt,
        boolean subtasksChanged,
        String source
) {
}
