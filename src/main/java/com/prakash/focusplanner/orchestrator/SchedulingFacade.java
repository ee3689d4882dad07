package com.prakash.focusplanner.orchestrator;

import com.prakash.focusplanner.dto.CommitmentResponse;
import com.prakash.focusplanner.dto.SectionSnapshot;
import com.prakash.focusplanner.event.CompletionChangedEvent;
import com.prakash.focusplanner.event.CompletionEventBus;
import com.prakash.focusplanner.exception.TaskNotFoundException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.repository.CommitmentQuery;
import com.prakash.focusplanner.repository.CommitmentStore;
import com.prakash.focusplanner.repository.SortOrderUpdate;
import com.prakash.focusplanner.repository.TaskStore;
import com.prakash.focusplanner.service.AutoCompleteRule;
import com.prakash.focusplanner.service.BreakdownEngine;
import com.prakash.focusplanner.service.BreakdownNode;
import com.prakash.focusplanner.service.CommitmentLedger;
import com.prakash.focusplanner.service.CurrentUser;
import com.prakash.focusplanner.service.PeriodBounds;
import com.prakash.focusplanner.service.PeriodCalculator;
import com.prakash.focusplanner.service.ReorderEngine;
import com.prakash.focusplanner.service.RescheduleEngine;
import com.prakash.focusplanner.service.TaskGraph;
import com.prakash.focusplanner.service.TimelineEngine;
import com.prakash.focusplanner.service.agent.SubtaskSuggestionAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Entry point for every planning operation. Wires the task graph, the commitment ledger and the engines together
 * and holds no state of its own.
 * <p>
 * Every call blocks until its store round trips are done and returns or fails on its own.
 */
@Service
public class SchedulingFacade {

    private static final Logger log = LoggerFactory.getLogger(SchedulingFacade.class);

    private final TaskGraph taskGraph;
    private final CommitmentLedger ledger;
    private final BreakdownEngine breakdownEngine;
    private final ReorderEngine reorderEngine;
    private final RescheduleEngine rescheduleEngine;
    private final TimelineEngine timelineEngine;
    private final SubtaskSuggestionAgent subtaskSuggestionAgent;
    private final PeriodCalculator periodCalculator;
    private final TaskStore taskStore;
    private final CommitmentStore commitmentStore;
    private final CompletionEventBus eventBus;
    private final CurrentUser currentUser;

    @Autowired
    public SchedulingFacade(TaskGraph taskGraph,
                            CommitmentLedger ledger,
                            BreakdownEngine breakdownEngine,
                            ReorderEngine reorderEngine,
                            RescheduleEngine rescheduleEngine,
                            TimelineEngine timelineEngine,
                            SubtaskSuggestionAgent subtaskSuggestionAgent,
                            PeriodCalculator periodCalculator,
                            TaskStore taskStore,
                            CommitmentStore commitmentStore,
                            CompletionEventBus eventBus,
                            CurrentUser currentUser) {
        this.taskGraph = taskGraph;
        this.ledger = ledger;
        this.breakdownEngine = breakdownEngine;
        this.reorderEngine = reorderEngine;
        this.rescheduleEngine = rescheduleEngine;
        this.timelineEngine = timelineEngine;
        this.subtaskSuggestionAgent = subtaskSuggestionAgent;
        this.periodCalculator = periodCalculator;
        this.taskStore = taskStore;
        this.commitmentStore = commitmentStore;
        this.eventBus = eventBus;
        this.currentUser = currentUser;
    }

    // --- Loading and views ---

    /**
     * Reloads both mirrors for one period: the user's commitments of that timeframe, the breakdown subtree below
     * each of them, the tasks they reference and those tasks' subtasks.
     *
     * @return the sections of the period as displayed
     */
    public List<SectionSnapshot> refresh(Timeframe timeframe, LocalDate date) {
        String userId = currentUser.requireUserId();
        PeriodBounds bounds = periodCalculator.periodBounds(timeframe, date);
        log.info("Refreshing {} view starting {} for user {}", timeframe, bounds.start(), userId);

        List<Commitment> commitments = commitmentStore.fetch(CommitmentQuery.builder()
                .ownerId(userId)
                .timeframe(timeframe)
                .anchorFrom(bounds.start())
                .anchorUntil(bounds.endExclusive())
                .build());
        ledger.replaceAll(commitments);
        for (Commitment commitment : commitments) {
            if (commitment.canBreakdown()) {
                breakdownEngine.fetchDescendantsRecursively(commitment);
            }
        }

        Set<String> taskIds = new LinkedHashSet<>();
        for (Commitment commitment : ledger.all()) {
            taskIds.add(commitment.getTaskId());
        }
        List<Task> tasks = taskIds.isEmpty() ? List.of() : taskStore.fetchByIds(taskIds);
        taskGraph.replaceAll(tasks);
        for (Task task : tasks) {
            taskGraph.loadSubtasks(task.getId());
        }
        log.debug("Loaded {} commitments and {} tasks", ledger.all().size(), tasks.size());
        return view(timeframe, date);
    }

    /**
     * Sections of a period as currently mirrored, without a store round trip.
     */
    public List<SectionSnapshot> view(Timeframe timeframe, LocalDate date) {
        List<SectionSnapshot> sections = new ArrayList<>();
        for (Section section : Section.values()) {
            sections.add(sectionSnapshot(section, timeframe, date));
        }
        return sections;
    }

    public SectionSnapshot sectionSnapshot(Section section, Timeframe timeframe, LocalDate date) {
        List<CommitmentResponse> commitments = ledger.commitmentsFor(section, timeframe, date).stream()
                .map(c -> CommitmentResponse.fromEntity(c, ledger.childCount(c.getId())))
                .toList();
        OptionalInt remaining = ledger.capacityRemaining(section, timeframe, date);
        int count = ledger.taskCount(section, timeframe, date);
        return SectionSnapshot.builder()
                .section(section)
                .displayName(section.displayName())
                .timeframe(timeframe)
                .periodStart(periodCalculator.periodStart(timeframe, date))
                .maxTasks(remaining.isPresent() ? count + remaining.getAsInt() : null)
                .taskCount(count)
                .full(remaining.isPresent() && remaining.getAsInt() == 0)
                .commitments(commitments)
                .build();
    }

    /**
     * Top-level tasks of a type for the signed-in user, from the store. The result is mirrored.
     */
    public List<Task> listTasks(TaskType type) {
        List<Task> tasks = taskStore.fetchByType(currentUser.requireUserId(), type).stream()
                .filter(task -> !task.isSubtask())
                .toList();
        taskGraph.absorb(tasks);
        return tasks;
    }

    /**
     * A task from the mirror, falling back to the store when it has not been loaded yet.
     */
    public Task getTask(String taskId) {
        return taskGraph.find(taskId).orElseGet(() -> {
            taskGraph.absorb(taskStore.fetchByIds(List.of(taskId)));
            // another user's task stays invisible once mirrored
            Task fetched = taskGraph.find(taskId)
                    .orElseThrow(() -> new TaskNotFoundException("Task not found with ID: " + taskId));
            taskGraph.loadSubtasks(taskId);
            return fetched;
        });
    }

    public List<Task> subtasksOf(String taskId) {
        return taskGraph.subtasksOf(taskId);
    }

    public Commitment getCommitment(String commitmentId) {
        return ledger.require(commitmentId);
    }

    public int childCount(String commitmentId) {
        return breakdownEngine.childCount(commitmentId);
    }

    // --- Tasks ---

    public Task createTask(String title, TaskType type) {
        return taskGraph.createTask(title, type == null ? TaskType.TASK : type);
    }

    /**
     * Creates a task and commits it in one go. Title and capacity are checked before the task is stored, so a full
     * section leaves no orphan task behind.
     */
    public Commitment createTaskWithCommitment(String title, TaskType type, Timeframe timeframe, Section section,
                                               LocalDate date) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Task title cannot be empty");
        }
        ledger.requireCapacity(section, timeframe, date, null);
        Task task = createTask(title, type);
        return ledger.create(task, timeframe, section, date);
    }

    public Commitment commit(String taskId, Timeframe timeframe, Section section, LocalDate date) {
        return ledger.create(getTask(taskId), timeframe, section, date);
    }

    public Task createSubtask(String title, String parentTaskId) {
        return taskGraph.createSubtask(title, parentTaskId);
    }

    /**
     * Creates a subtask of the commitment's task and commits it to the same timeframe, section and period.
     * No breakdown link is set since the timeframe is not lower than the parent's.
     */
    public Commitment createSubtaskUnderCommitment(String title, String commitmentId) {
        Commitment parent = ledger.require(commitmentId);
        ledger.requireCapacity(parent.getSection(), parent.getTimeframe(), parent.getPeriodAnchorDate(), null);
        Task subtask = taskGraph.createSubtask(title, parent.getTaskId());
        return ledger.create(subtask.getId(), parent.getTimeframe(), parent.getSection(),
                parent.getPeriodAnchorDate(), null);
    }

    public Commitment commitSubtask(String subtaskId, String parentCommitmentId, Timeframe targetTimeframe,
                                    LocalDate date) {
        return breakdownEngine.commitSubtask(taskGraph.require(subtaskId), ledger.require(parentCommitmentId),
                date, targetTimeframe);
    }

    public Task renameTask(String taskId, String title) {
        return taskGraph.rename(taskId, title);
    }

    /**
     * Deletes a subtask together with every commitment bound to it.
     */
    public void deleteSubtask(String subtaskId) {
        taskGraph.require(subtaskId);
        deleteCommitmentsOf(subtaskId);
        taskGraph.deleteSubtask(subtaskId);
    }

    /**
     * Deletes a task: first every commitment bound to it or to one of its subtasks (with their breakdown
     * descendants), then the subtasks, then the task itself. Stops at the first store failure.
     */
    public void deleteTask(String taskId) {
        taskGraph.require(taskId);
        log.warn("Deleting Task ID: {} with its subtasks and commitments", taskId);
        for (Task subtask : taskGraph.subtasksOf(taskId)) {
            deleteSubtask(subtask.getId());
        }
        deleteCommitmentsOf(taskId);
        taskGraph.deleteTask(taskId);
    }

    // --- Commitments ---

    /**
     * Removes a commitment and its whole breakdown subtree. The task is kept.
     */
    public List<String> removeCommitment(String commitmentId) {
        ledger.require(commitmentId);
        return ledger.deleteWithDescendants(commitmentId);
    }

    public List<Timeframe> availableBreakdownTimeframes(String commitmentId) {
        return breakdownEngine.availableBreakdownTimeframes(ledger.require(commitmentId).getTimeframe());
    }

    public List<LocalDate> availableSlots(String commitmentId, Timeframe targetTimeframe) {
        return breakdownEngine.availableSlots(ledger.require(commitmentId), targetTimeframe);
    }

    public Commitment breakdown(String commitmentId, Timeframe targetTimeframe, LocalDate targetDate) {
        return breakdownEngine.createChild(ledger.require(commitmentId), targetTimeframe, targetDate);
    }

    public BreakdownNode breakdownTree(String commitmentId) {
        return breakdownEngine.fetchDescendantsRecursively(ledger.require(commitmentId));
    }

    public List<SortOrderUpdate> reorder(String commitmentId, int targetIndex) {
        return reorderEngine.reorder(commitmentId, targetIndex);
    }

    public List<SortOrderUpdate> reorderOnto(String droppedId, String targetId) {
        return reorderEngine.reorder(droppedId, targetId);
    }

    public boolean canMove(String commitmentId, Section destination) {
        Commitment commitment = ledger.require(commitmentId);
        return commitment.getSection() == destination
                || ledger.canAdd(destination, commitment.getTimeframe(), commitment.getPeriodAnchorDate(), commitmentId);
    }

    public boolean moveToSection(String commitmentId, Section destination, Integer targetIndex) {
        return targetIndex == null
                ? reorderEngine.moveToSection(commitmentId, destination)
                : reorderEngine.moveToSection(commitmentId, destination, targetIndex);
    }

    public Commitment reschedule(String commitmentId, LocalDate newDate, Timeframe newTimeframe) {
        Timeframe timeframe = newTimeframe != null ? newTimeframe : ledger.require(commitmentId).getTimeframe();
        return rescheduleEngine.reschedule(commitmentId, newDate, timeframe);
    }

    public Commitment pushToNext(String commitmentId) {
        return rescheduleEngine.pushToNext(commitmentId);
    }

    // --- Timeline ---

    public Commitment scheduleTime(String commitmentId, LocalDateTime time, Integer durationMinutes) {
        return timelineEngine.scheduleTime(commitmentId, time, durationMinutes);
    }

    public Commitment unscheduleTime(String commitmentId) {
        return timelineEngine.unscheduleTime(commitmentId);
    }

    public Commitment createTimedCommitment(String taskId, LocalDateTime time) {
        return timelineEngine.createTimedCommitment(getTask(taskId).getId(), time);
    }

    /**
     * Timeline of one day. Tasks of the placed commitments that are not mirrored yet are loaded.
     */
    public List<Commitment> timedCommitments(LocalDate day) {
        List<Commitment> timed = timelineEngine.timedCommitments(day);
        Set<String> missing = new LinkedHashSet<>();
        for (Commitment commitment : timed) {
            if (taskGraph.find(commitment.getTaskId()).isEmpty()) {
                missing.add(commitment.getTaskId());
            }
        }
        if (!missing.isEmpty()) {
            taskGraph.absorb(taskStore.fetchByIds(missing));
        }
        return timed;
    }

    // --- Completion ---

    public Task toggleCompletion(String taskId) {
        return taskGraph.toggleCompletion(taskId);
    }

    /**
     * Flips a subtask. When {@code viewedTimeframe} is given, only subtasks committed at the parent commitment's
     * timeframe (or not committed at all) count toward the parent's auto-completion.
     */
    public Task toggleSubtaskCompletion(String subtaskId, String parentTaskId, Timeframe viewedTimeframe) {
        AutoCompleteRule rule = viewedTimeframe == null
                ? AutoCompleteRule.EVERY_SUBTASK
                : ledger.autoCompleteRule(parentTaskId, viewedTimeframe);
        return taskGraph.toggleSubtaskCompletion(subtaskId, parentTaskId, rule);
    }

    public CompletionEventBus.Subscription subscribe(String taskId, Consumer<CompletionChangedEvent> consumer) {
        return eventBus.subscribe(taskId, consumer);
    }

    // --- Suggestions ---

    public List<String> suggestSubtasks(String taskId) {
        Task task = getTask(taskId);
        List<String> existing = taskGraph.subtasksOf(taskId).stream()
                .map(Task::getTitle)
                .toList();
        return subtaskSuggestionAgent.suggestSubtasks(task.getTitle(), task.getDescription(), existing);
    }

    private void deleteCommitmentsOf(String taskId) {
        List<Commitment> bound = commitmentStore.fetch(CommitmentQuery.forTask(taskId));
        ledger.absorb(bound);
        for (Commitment commitment : bound) {
            breakdownEngine.fetchDescendantsRecursively(commitment);
        }
        Set<String> deleted = new LinkedHashSet<>();
        for (Commitment commitment : ledger.findForTask(taskId)) {
            if (!deleted.contains(commitment.getId())) {
                deleted.addAll(ledger.deleteWithDescendants(commitment.getId()));
            }
        }
    }
}
