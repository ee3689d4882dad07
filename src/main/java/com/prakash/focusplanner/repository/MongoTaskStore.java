package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link TaskStore} backed by the MongoDB {@code tasks} collection.
 */
@Component
public class MongoTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(MongoTaskStore.class);

    private final TaskRepository taskRepository;

    @Autowired
    public MongoTaskStore(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    public Task create(Task task) {
        return call("create task", () -> taskRepository.insert(task));
    }

    @Override
    public Task update(Task task) {
        return call("update task " + task.getId(), () -> taskRepository.save(task));
    }

    @Override
    public void delete(String id) {
        call("delete task " + id, () -> {
            taskRepository.deleteById(id);
            return null;
        });
    }

    @Override
    public List<Task> fetchByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return call("fetch tasks by id", () -> taskRepository.findAllById(ids));
    }

    @Override
    public List<Task> fetchByParent(String parentTaskId) {
        return call("fetch subtasks of " + parentTaskId,
                () -> taskRepository.findByParentTaskIdOrderBySortOrderAsc(parentTaskId));
    }

    @Override
    public List<Task> fetchByType(String ownerId, TaskType type) {
        return call("fetch " + type + " tasks", () -> taskRepository.findByOwnerIdAndTypeOrderBySortOrderAsc(ownerId, type));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Task store failed to {}: {}", operation, e.getMessage(), e);
            throw new StoreFailureException("Failed to " + operation, e);
        }
    }
}
