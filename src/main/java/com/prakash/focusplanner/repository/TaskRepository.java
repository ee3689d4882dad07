package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskRepository extends MongoRepository<Task, String> {

    // Subtasks of a parent in display order
    List<Task> findByParentTaskIdOrderBySortOrderAsc(String parentTaskId);

    // Top-level tasks, projects or lists of one user
    List<Task> findByOwnerIdAndTypeOrderBySortOrderAsc(String ownerId, TaskType type);
}
