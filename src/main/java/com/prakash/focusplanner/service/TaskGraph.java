package com.prakash.focusplanner.service;

import com.prakash.focusplanner.config.FocusProperties;
import com.prakash.focusplanner.event.CompletionChangedEvent;
import com.prakash.focusplanner.event.CompletionEventBus;
import com.prakash.focusplanner.exception.TaskNotFoundException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import com.prakash.focusplanner.repository.TaskStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory mirror of tasks and their subtasks, owner of the completion cascade rules. Reads and lookups by id
 * only see the signed-in user's tasks.
 * <p>
 * Mutations go to the {@link TaskStore} first and are applied to the mirror only after the round trip
 * succeeded. A failure in the middle of a cascade leaves the already-persisted steps in place; the next
 * refresh reconciles.
 */
@Service
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final TaskStore taskStore;
    private final CompletionEventBus eventBus;
    private final CurrentUser currentUser;
    private final Clock clock;
    private final String source;

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private CompletionEventBus.Subscription subscription;

    @Autowired
    public TaskGraph(TaskStore taskStore,
                     CompletionEventBus eventBus,
                     CurrentUser currentUser,
                     Clock clock,
                     FocusProperties properties) {
        this.taskStore = taskStore;
        this.eventBus = eventBus;
        this.currentUser = currentUser;
        this.clock = clock;
        this.source = properties.getEvents().getSource();
    }

    /**
     * Starts applying completion changes published by other sources to this mirror.
     */
    @PostConstruct
    public void listen() {
        if (subscription == null) {
            subscription = eventBus.subscribeAll(this::onCompletionChanged);
        }
    }

    @PreDestroy
    public void stopListening() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    // --- Mirror access ---

    /**
     * Replaces the signed-in user's part of the mirror. Other users' tasks are left alone.
     */
    public void replaceAll(Collection<Task> loaded) {
        String userId = currentUser.currentUserId().orElse(null);
        tasks.values().removeIf(task -> Objects.equals(userId, task.getOwnerId()));
        absorb(loaded);
    }

    public void absorb(Collection<Task> loaded) {
        for (Task task : loaded) {
            tasks.put(task.getId(), task);
        }
    }

    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).filter(this::isOwned);
    }

    public Task require(String taskId) {
        Task task = find(taskId).orElse(null);
        if (task == null) {
            throw new TaskNotFoundException("Task not found with ID: " + taskId);
        }
        return task;
    }

    public boolean isCompleted(String taskId) {
        return find(taskId).map(Task::isCompleted).orElse(false);
    }

    /**
     * Subtasks of a parent in sibling order. The position in this list is what completion snapshots map onto.
     */
    public List<Task> subtasksOf(String parentId) {
        return tasks.values().stream()
                .filter(this::isOwned)
                .filter(task -> parentId.equals(task.getParentTaskId()))
                .sorted(Comparator.comparingInt(Task::getSortOrder).thenComparing(Task::getId))
                .toList();
    }

    public List<Task> loadSubtasks(String parentId) {
        List<Task> subtasks = taskStore.fetchByParent(parentId);
        tasks.values().removeIf(task -> parentId.equals(task.getParentTaskId()));
        absorb(subtasks);
        log.debug("Loaded {} subtasks for Task ID: {}", subtasks.size(), parentId);
        return subtasksOf(parentId);
    }

    // --- Creation and editing ---

    public Task createTask(String title, TaskType type) {
        String trimmed = requireTitle(title);
        String userId = currentUser.requireUserId();
        Task task = Task.builder()
                .ownerId(userId)
                .title(trimmed)
                .type(type)
                .build();
        Task created = taskStore.create(task);
        tasks.put(created.getId(), created);
        log.info("Created task {} ({})", created.getId(), type);
        return created;
    }

    /**
     * Creates a subtask at the end of its parent's subtask list.
     *
     * @throws ValidationException if the title is blank or no user is signed in
     * @throws TaskNotFoundException if the parent is not one of the signed-in user's tasks
     */
    public Task createSubtask(String title, String parentId) {
        String trimmed = requireTitle(title);
        String userId = currentUser.requireUserId();
        require(parentId);
        int nextSortOrder = subtasksOf(parentId).stream()
                .mapToInt(Task::getSortOrder)
                .max()
                .orElse(-1) + 1;
        Task subtask = Task.builder()
                .ownerId(userId)
                .title(trimmed)
                .type(TaskType.TASK)
                .sortOrder(nextSortOrder)
                .parentTaskId(parentId)
                .build();
        Task created = taskStore.create(subtask);
        tasks.put(created.getId(), created);
        log.info("Created subtask {} under Task ID: {}", created.getId(), parentId);
        return created;
    }

    public Task rename(String taskId, String newTitle) {
        String trimmed = requireTitle(newTitle);
        Task updated = require(taskId).copy();
        updated.setTitle(trimmed);
        return persist(updated);
    }

    /**
     * Deletes a task from the store; the mirror drops it along with its subtasks.
     */
    public void deleteTask(String taskId) {
        require(taskId);
        log.warn("Deleting task with ID: {}", taskId);
        taskStore.delete(taskId);
        tasks.remove(taskId);
        tasks.values().removeIf(task -> taskId.equals(task.getParentTaskId()));
    }

    public void deleteSubtask(String subtaskId) {
        require(subtaskId);
        log.warn("Deleting subtask with ID: {}", subtaskId);
        taskStore.delete(subtaskId);
        tasks.remove(subtaskId);
    }

    // --- Completion cascade ---

    /**
     * Flips a task's completion.
     * <p>
     * Completing snapshots the subtasks' states, then completes every subtask along with the task.
     * Uncompleting restores the subtasks from the snapshot by position, when one exists.
     */
    public Task toggleCompletion(String taskId) {
        Task task = require(taskId);
        List<Task> subtasks = subtasksOf(taskId);
        boolean subtasksChanged;
        Task updated;

        if (task.isCompleted()) {
            log.info("Uncompleting Task ID: {}", taskId);
            updated = task.copy();
            updated.markIncomplete();
            updated = persist(updated);

            List<Boolean> snapshot = task.getPreviousCompletionSnapshot();
            subtasksChanged = snapshot != null;
            if (snapshot != null) {
                restoreSubtasks(subtasks, snapshot);
            }
        } else {
            log.info("Completing Task ID: {} with {} subtasks", taskId, subtasks.size());
            LocalDateTime now = LocalDateTime.now(clock);
            updated = task.copy();
            updated.setPreviousCompletionSnapshot(snapshotOf(subtasks));
            updated.markCompleted(now);
            updated = persist(updated);

            for (Task subtask : subtasks) {
                if (!subtask.isCompleted()) {
                    Task completedSubtask = subtask.copy();
                    completedSubtask.markCompleted(now);
                    persist(completedSubtask);
                }
            }
            subtasksChanged = !subtasks.isEmpty();
        }

        publish(updated, subtasksChanged);
        return updated;
    }

    /**
     * Flips a subtask counting every subtask toward the parent's auto-completion.
     */
    public Task toggleSubtaskCompletion(String subtaskId, String parentId) {
        return toggleSubtaskCompletion(subtaskId, parentId, AutoCompleteRule.EVERY_SUBTASK);
    }

    /**
     * Flips a subtask, then re-evaluates the parent: it auto-completes when every counted subtask is done
     * (and at least one counts), and auto-uncompletes otherwise if it was complete. Auto-uncompletion never
     * restores subtask states.
     */
    public Task toggleSubtaskCompletion(String subtaskId, String parentId, AutoCompleteRule rule) {
        Task subtask = require(subtaskId);
        if (!parentId.equals(subtask.getParentTaskId())) {
            throw new ValidationException("Task " + subtaskId + " is not a subtask of " + parentId);
        }

        Task toggled = subtask.copy();
        if (toggled.isCompleted()) {
            toggled.markIncomplete();
        } else {
            toggled.markCompleted(LocalDateTime.now(clock));
        }
        toggled = persist(toggled);
        publish(toggled, false);

        Task parent = find(parentId).orElse(null);
        if (parent == null) {
            log.debug("Parent Task ID: {} not in mirror, skipping auto-completion check", parentId);
            return toggled;
        }

        List<Task> siblings = subtasksOf(parentId);
        List<Task> counted = siblings.stream().filter(rule::counts).toList();
        boolean allCountedDone = !counted.isEmpty() && counted.stream().allMatch(Task::isCompleted);

        if (allCountedDone && !parent.isCompleted()) {
            log.info("All {} counted subtasks done, auto-completing Task ID: {}", counted.size(), parentId);
            Task completedParent = parent.copy();
            completedParent.setPreviousCompletionSnapshot(snapshotOf(siblings));
            completedParent.markCompleted(LocalDateTime.now(clock));
            publish(persist(completedParent), false);
        } else if (!allCountedDone && parent.isCompleted()) {
            log.info("Counted subtasks no longer all done, auto-uncompleting Task ID: {}", parentId);
            Task reopenedParent = parent.copy();
            reopenedParent.markIncomplete();
            publish(persist(reopenedParent), false);
        }
        return toggled;
    }

    /**
     * Applies a completion change made elsewhere. Changes from this mirror's own source are echoes and ignored.
     */
    void onCompletionChanged(CompletionChangedEvent event) {
        if (source.equals(event.source())) {
            return;
        }
        Task task = tasks.get(event.taskId());
        if (task == null) {
            return;
        }
        log.debug("Applying completion change of Task ID: {} from {}", event.taskId(), event.source());
        task.setCompleted(event.completed());
        task.setCompletedAt(event.completedAt());
        if (event.subtasksChanged()) {
            loadSubtasks(event.taskId());
        }
    }

    public String getSource() {
        return source;
    }

    private boolean isOwned(Task task) {
        return Objects.equals(currentUser.currentUserId().orElse(null), task.getOwnerId());
    }

    private void restoreSubtasks(List<Task> subtasks, List<Boolean> snapshot) {
        LocalDateTime now = LocalDateTime.now(clock);
        int restorable = Math.min(subtasks.size(), snapshot.size());
        for (int i = 0; i < restorable; i++) {
            Task subtask = subtasks.get(i);
            boolean shouldBeCompleted = Boolean.TRUE.equals(snapshot.get(i));
            if (subtask.isCompleted() == shouldBeCompleted) {
                continue;
            }
            Task restored = subtask.copy();
            if (shouldBeCompleted) {
                restored.markCompleted(now);
            } else {
                restored.markIncomplete();
            }
            persist(restored);
        }
        log.debug("Restored {} subtask states from snapshot", restorable);
    }

    private List<Boolean> snapshotOf(List<Task> subtasks) {
        List<Boolean> snapshot = new ArrayList<>(subtasks.size());
        for (Task subtask : subtasks) {
            snapshot.add(subtask.isCompleted());
        }
        return snapshot;
    }

    private Task persist(Task task) {
        Task saved = taskStore.update(task);
        tasks.put(saved.getId(), saved);
        return saved;
    }

    private void publish(Task task, boolean subtasksChanged) {
        eventBus.publish(new CompletionChangedEvent(
                task.getId(), task.isCompleted(), task.getCompletedAt(), subtasksChanged, source));
    }

    private static String requireTitle(String title) {
        if (title == null || title.trim().isEmpty()) {
            throw new ValidationException("Task title cannot be empty");
        }
        return title.trim();
    }
}
