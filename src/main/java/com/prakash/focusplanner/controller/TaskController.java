package com.prakash.focusplanner.controller;

import com.prakash.focusplanner.dto.CreateSubtaskRequest;
import com.prakash.focusplanner.dto.CreateTaskRequest;
import com.prakash.focusplanner.dto.RenameTaskRequest;
import com.prakash.focusplanner.dto.TaskResponse;
import com.prakash.focusplanner.exception.CapacityExceededException;
import com.prakash.focusplanner.exception.CommitmentNotFoundException;
import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.exception.TaskNotFoundException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.orchestrator.SchedulingFacade;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/tasks") // Base path for task-related endpoints
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final SchedulingFacade schedulingFacade;

    @Autowired
    public TaskController(SchedulingFacade schedulingFacade) {
        this.schedulingFacade = schedulingFacade;
    }

    /**
     * Endpoint to create a new task, optionally committing it right away.
     * A commitment is created when timeframe, section and date are all present.
     *
     * @param request The request body containing the title and the optional commitment.
     * @return The created task.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("Received request to create task: {}", request.getTitle());
        try {
            Task created;
            if (request.hasCommitment()) {
                Commitment commitment = schedulingFacade.createTaskWithCommitment(request.getTitle(), request.getType(),
                        request.getTimeframe(), request.getSection(), request.getDate());
                created = schedulingFacade.getTask(commitment.getTaskId());
            } else {
                created = schedulingFacade.createTask(request.getTitle(), request.getType());
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.fromEntity(created));
        } catch (ValidationException | CapacityExceededException | StoreFailureException e) {
            // These have @ResponseStatus, so re-throwing allows default handling (400, 409, 503)
            log.warn("Failed to create task '{}': {}", request.getTitle(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error creating task '{}': {}", request.getTitle(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    /**
     * Endpoint to list the signed-in user's top-level tasks of one type.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> getTasks(@RequestParam(defaultValue = "TASK") TaskType type) {
        log.debug("Received request to get tasks of type {}", type);
        List<TaskResponse> responseDtos = schedulingFacade.listTasks(type).stream()
                .map(TaskResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responseDtos);
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTaskById(@PathVariable String id) {
        log.debug("Received request to get task by ID: {}", id);
        // TaskNotFoundException will be handled by default Spring Boot exception handling (404)
        return ResponseEntity.ok(TaskResponse.fromEntity(schedulingFacade.getTask(id)));
    }

    @GetMapping("/{id}/subtasks")
    public ResponseEntity<List<TaskResponse>> getSubtasks(@PathVariable String id) {
        log.debug("Received request to get subtasks of task {}", id);
        schedulingFacade.getTask(id);
        List<TaskResponse> responseDtos = schedulingFacade.subtasksOf(id).stream()
                .map(TaskResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responseDtos);
    }

    @PatchMapping("/{id}/title")
    public ResponseEntity<TaskResponse> renameTask(@PathVariable String id,
                                                   @Valid @RequestBody RenameTaskRequest request) {
        log.info("Received request to rename task {}", id);
        schedulingFacade.getTask(id);
        return ResponseEntity.ok(TaskResponse.fromEntity(schedulingFacade.renameTask(id, request.getTitle())));
    }

    /**
     * Endpoint to delete a task along with its subtasks and every commitment bound to them.
     *
     * @param id The ID of the task to delete.
     * @return No content (204) on successful deletion or 404 if not found.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTask(@PathVariable String id) {
        log.info("Received request to delete task by ID: {}", id);
        try {
            Task task = schedulingFacade.getTask(id);
            if (task.isSubtask()) {
                schedulingFacade.deleteSubtask(id);
            } else {
                schedulingFacade.deleteTask(id);
            }
            return ResponseEntity.noContent().build(); // 204
        } catch (TaskNotFoundException | StoreFailureException e) {
            log.warn("Cannot delete task: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error deleting task {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    /**
     * Endpoint to add a subtask. With a commitment id in the body the subtask is also committed
     * to that commitment's timeframe, section and period.
     */
    @PostMapping("/{id}/subtasks")
    public ResponseEntity<TaskResponse> createSubtask(@PathVariable String id,
                                                      @Valid @RequestBody CreateSubtaskRequest request) {
        log.info("Received request to add subtask '{}' to task {}", request.getTitle(), id);
        try {
            schedulingFacade.getTask(id);
            Task created;
            if (request.getCommitmentId() != null) {
                Commitment commitment = schedulingFacade.createSubtaskUnderCommitment(request.getTitle(),
                        request.getCommitmentId());
                created = schedulingFacade.getTask(commitment.getTaskId());
            } else {
                created = schedulingFacade.createSubtask(request.getTitle(), id);
            }
            return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.fromEntity(created));
        } catch (TaskNotFoundException | CommitmentNotFoundException | ValidationException
                 | CapacityExceededException | StoreFailureException e) {
            log.warn("Failed to add subtask to task {}: {}", id, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error adding subtask to task {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    /**
     * Endpoint to flip a task's completion. Completing cascades to its subtasks; uncompleting restores them.
     */
    @PostMapping("/{id}/toggle")
    public ResponseEntity<TaskResponse> toggleCompletion(@PathVariable String id) {
        log.info("Received request to toggle completion of task {}", id);
        schedulingFacade.getTask(id);
        return ResponseEntity.ok(TaskResponse.fromEntity(schedulingFacade.toggleCompletion(id)));
    }

    /**
     * Endpoint to flip a subtask's completion. The parent auto-completes or auto-uncompletes as a result.
     *
     * @param timeframe Optional timeframe the parent is viewed at; restricts which subtasks count.
     */
    @PostMapping("/{id}/subtasks/{subtaskId}/toggle")
    public ResponseEntity<TaskResponse> toggleSubtaskCompletion(@PathVariable String id,
                                                                @PathVariable String subtaskId,
                                                                @RequestParam(required = false) Timeframe timeframe) {
        log.info("Received request to toggle subtask {} of task {}", subtaskId, id);
        schedulingFacade.getTask(id);
        Task toggled = schedulingFacade.toggleSubtaskCompletion(subtaskId, id, timeframe);
        return ResponseEntity.ok(TaskResponse.fromEntity(toggled));
    }

    /**
     * Endpoint to ask the AI for subtask suggestions. Nothing is saved; the client adds the ones it keeps.
     */
    @PostMapping("/{id}/suggest-subtasks")
    public ResponseEntity<List<String>> suggestSubtasks(@PathVariable String id) {
        log.info("Received request to suggest subtasks for task {}", id);
        try {
            return ResponseEntity.ok(schedulingFacade.suggestSubtasks(id));
        } catch (TaskNotFoundException | ValidationException e) {
            log.warn("Cannot suggest subtasks for task {}: {}", id, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            // AI generation/parsing failures
            log.error("Error suggesting subtasks for task {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }
}
