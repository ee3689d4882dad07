package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;

import java.util.Collection;
import java.util.List;

/**
 * Persistent store for tasks. Every method may throw
 * {@link com.prakash.focusplanner.exception.StoreFailureException}.
 */
public interface TaskStore {

    Task create(Task task);

    Task update(Task task);

    void delete(String id);

    List<Task> fetchByIds(Collection<String> ids);

    /**
     * Subtasks of a parent, ordered by sort order.
     */
    List<Task> fetchByParent(String parentTaskId);

    List<Task> fetchByType(String ownerId, TaskType type);
}
