package com.prakash.focusplanner.orchestrator;

import com.prakash.focusplanner.dto.SectionSnapshot;
import com.prakash.focusplanner.exception.CapacityExceededException;
import com.prakash.focusplanner.exception.CommitmentNotFoundException;
import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.exception.TaskNotFoundException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.TaskType;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.service.agent.SubtaskSuggestionAgent;
import com.prakash.focusplanner.support.PlannerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.prakash.focusplanner.support.PlannerFixture.TODAY;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SchedulingFacadeTest {

    private PlannerFixture fixture;
    private SubtaskSuggestionAgent agent;
    private SchedulingFacade facade;

    @BeforeEach
    void setUp() {
        fixture = new PlannerFixture();
        agent = mock(SubtaskSuggestionAgent.class);
        facade = new SchedulingFacade(fixture.taskGraph, fixture.ledger, fixture.breakdownEngine,
                fixture.reorderEngine, fixture.rescheduleEngine, fixture.timelineEngine, agent, fixture.periodCalculator,
                fixture.taskStore, fixture.commitmentStore, fixture.eventBus, fixture.currentUser);
    }

    @Nested
    @DisplayName("refresh")
    class RefreshTests {

        @Test
        @DisplayName("reloads commitments, their subtrees, tasks and subtasks from the stores")
        void reloads() {
            Commitment yearly = facade.createTaskWithCommitment("Learn Spanish", TaskType.TASK, Timeframe.YEARLY,
                    Section.PRIMARY, TODAY);
            Commitment march = facade.breakdown(yearly.getId(), Timeframe.MONTHLY, TODAY);
            Task sub = facade.createSubtask("Buy textbook", yearly.getTaskId());
            fixture.ledger.replaceAll(List.of());
            fixture.taskGraph.replaceAll(List.of());

            List<SectionSnapshot> sections = facade.refresh(Timeframe.YEARLY, TODAY);

            assertEquals(2, sections.size());
            SectionSnapshot primary = sections.get(0);
            assertEquals(Section.PRIMARY, primary.getSection());
            assertEquals(1, primary.getTaskCount());
            assertEquals(10, primary.getMaxTasks());
            assertEquals(1, primary.getCommitments().get(0).getChildCount());
            assertNull(sections.get(1).getMaxTasks());
            assertTrue(fixture.ledger.find(march.getId()).isPresent());
            assertTrue(fixture.taskGraph.find(sub.getId()).isPresent());
        }

        @Test
        @DisplayName("only loads the signed-in user's commitments of the viewed period")
        void scopedToPeriod() {
            facade.createTaskWithCommitment("Today", TaskType.TASK, Timeframe.DAILY, Section.PRIMARY, TODAY);
            facade.createTaskWithCommitment("Tomorrow", TaskType.TASK, Timeframe.DAILY, Section.PRIMARY, TODAY.plusDays(1));
            fixture.commitmentStore.seed(Commitment.builder().ownerId("someone-else").taskId("x")
                    .timeframe(Timeframe.DAILY).section(Section.PRIMARY).periodAnchorDate(TODAY).build());

            facade.refresh(Timeframe.DAILY, TODAY);

            assertEquals(1, fixture.ledger.all().size());
        }

        @Test
        @DisplayName("marks a full section")
        void fullSection() {
            for (String title : List.of("A", "B", "C")) {
                facade.createTaskWithCommitment(title, TaskType.TASK, Timeframe.DAILY, Section.PRIMARY, TODAY);
            }

            SectionSnapshot primary = facade.sectionSnapshot(Section.PRIMARY, Timeframe.DAILY, TODAY);

            assertTrue(primary.isFull());
            assertEquals(3, primary.getMaxTasks());
        }
    }

    @Nested
    @DisplayName("creating")
    class CreateTests {

        @Test
        @DisplayName("a full section leaves no orphan task behind")
        void noOrphanTask() {
            for (String title : List.of("A", "B", "C")) {
                facade.createTaskWithCommitment(title, TaskType.TASK, Timeframe.DAILY, Section.PRIMARY, TODAY);
            }
            int tasksBefore = fixture.taskStore.size();

            assertThrows(CapacityExceededException.class, () -> facade.createTaskWithCommitment("D", TaskType.TASK,
                    Timeframe.DAILY, Section.PRIMARY, TODAY));
            assertEquals(tasksBefore, fixture.taskStore.size());
        }

        @Test
        @DisplayName("blank titles are rejected before anything is stored")
        void blankTitle() {
            assertThrows(ValidationException.class, () -> facade.createTaskWithCommitment(" ", TaskType.TASK,
                    Timeframe.DAILY, Section.PRIMARY, TODAY));
            assertEquals(0, fixture.taskStore.size());
            assertEquals(0, fixture.commitmentStore.size());
        }

        @Test
        @DisplayName("a subtask under a commitment is committed alongside it without a breakdown link")
        void subtaskUnderCommitment() {
            Commitment weekly = facade.createTaskWithCommitment("Trip", TaskType.PROJECT, Timeframe.WEEKLY,
                    Section.PRIMARY, TODAY);

            Commitment created = facade.createSubtaskUnderCommitment("Book flights", weekly.getId());

            Task subtask = fixture.taskGraph.require(created.getTaskId());
            assertEquals(weekly.getTaskId(), subtask.getParentTaskId());
            assertEquals(Timeframe.WEEKLY, created.getTimeframe());
            assertEquals(weekly.getPeriodAnchorDate(), created.getPeriodAnchorDate());
            assertNull(created.getParentCommitmentId());
        }

        @Test
        @DisplayName("commitSubtask at a lower timeframe creates a breakdown child")
        void commitSubtask() {
            Commitment weekly = facade.createTaskWithCommitment("Trip", TaskType.PROJECT, Timeframe.WEEKLY,
                    Section.PRIMARY, TODAY);
            Task sub = facade.createSubtask("Book flights", weekly.getTaskId());

            Commitment child = facade.commitSubtask(sub.getId(), weekly.getId(), Timeframe.DAILY, TODAY);

            assertEquals(weekly.getId(), child.getParentCommitmentId());
            assertEquals(1, facade.childCount(weekly.getId()));
        }
    }

    @Nested
    @DisplayName("deleting")
    class DeleteTests {

        @Test
        @DisplayName("deleting a task cascades through its commitments, their subtrees and its subtasks")
        void deleteTaskCascades() {
            Commitment yearly = facade.createTaskWithCommitment("Learn Spanish", TaskType.TASK, Timeframe.YEARLY,
                    Section.PRIMARY, TODAY);
            Commitment monthly = facade.breakdown(yearly.getId(), Timeframe.MONTHLY, TODAY);
            facade.breakdown(monthly.getId(), Timeframe.WEEKLY, TODAY);
            Task sub = facade.createSubtask("Buy textbook", yearly.getTaskId());
            facade.commit(sub.getId(), Timeframe.DAILY, Section.OVERFLOW, TODAY);

            facade.deleteTask(yearly.getTaskId());

            assertEquals(0, fixture.commitmentStore.size());
            assertEquals(0, fixture.taskStore.size());
            assertTrue(fixture.ledger.all().isEmpty());
        }

        @Test
        @DisplayName("removing a commitment keeps the task")
        void removeCommitmentKeepsTask() {
            Commitment daily = facade.createTaskWithCommitment("Call mom", TaskType.TASK, Timeframe.DAILY,
                    Section.PRIMARY, TODAY);

            facade.removeCommitment(daily.getId());

            assertTrue(fixture.taskStore.stored(daily.getTaskId()).isPresent());
            assertTrue(fixture.ledger.findForTask(daily.getTaskId()).isEmpty());
        }

        @Test
        @DisplayName("a store failure mid-cascade leaves the task in place")
        void failureMidCascade() {
            Commitment yearly = facade.createTaskWithCommitment("Learn Spanish", TaskType.TASK, Timeframe.YEARLY,
                    Section.PRIMARY, TODAY);
            facade.breakdown(yearly.getId(), Timeframe.MONTHLY, TODAY);
            // four fetches load the subtree, the first delete fails
            fixture.commitmentStore.failAfter(4);

            assertThrows(StoreFailureException.class, () -> facade.deleteTask(yearly.getTaskId()));

            assertTrue(fixture.taskStore.stored(yearly.getTaskId()).isPresent());
            assertTrue(fixture.commitmentStore.stored(yearly.getId()).isPresent());
        }
    }

    @Nested
    @DisplayName("completion")
    class CompletionTests {

        @Test
        @DisplayName("two subtasks at the parent's timeframe auto-complete and auto-uncomplete the parent")
        void cascadeAtTimeframe() {
            Commitment parent = facade.createTaskWithCommitment("Trip", TaskType.PROJECT, Timeframe.WEEKLY,
                    Section.PRIMARY, TODAY);
            Commitment a = facade.createSubtaskUnderCommitment("Book flights", parent.getId());
            Commitment b = facade.createSubtaskUnderCommitment("Book hotel", parent.getId());

            facade.toggleSubtaskCompletion(a.getTaskId(), parent.getTaskId(), Timeframe.WEEKLY);
            facade.toggleSubtaskCompletion(b.getTaskId(), parent.getTaskId(), Timeframe.WEEKLY);
            assertTrue(fixture.taskGraph.isCompleted(parent.getTaskId()));

            facade.toggleSubtaskCompletion(a.getTaskId(), parent.getTaskId(), Timeframe.WEEKLY);
            assertFalse(fixture.taskGraph.isCompleted(parent.getTaskId()));
            assertTrue(fixture.taskGraph.isCompleted(b.getTaskId()));
        }

        @Test
        @DisplayName("subtasks committed to a lower timeframe do not count")
        void lowerTimeframeIgnored() {
            Commitment parent = facade.createTaskWithCommitment("Trip", TaskType.PROJECT, Timeframe.WEEKLY,
                    Section.PRIMARY, TODAY);
            Commitment same = facade.createSubtaskUnderCommitment("Book flights", parent.getId());
            Task lower = facade.createSubtask("Pack", parent.getTaskId());
            facade.commitSubtask(lower.getId(), parent.getId(), Timeframe.DAILY, TODAY);

            facade.toggleSubtaskCompletion(same.getTaskId(), parent.getTaskId(), Timeframe.WEEKLY);

            assertTrue(fixture.taskGraph.isCompleted(parent.getTaskId()));
            assertFalse(fixture.taskGraph.isCompleted(lower.getId()));
        }

        @Test
        @DisplayName("subscribers are told about completion changes")
        void subscribe() {
            Task task = facade.createTask("Read", TaskType.TASK);
            List<Boolean> seen = new ArrayList<>();
            facade.subscribe(task.getId(), event -> seen.add(event.completed()));

            facade.toggleCompletion(task.getId());
            facade.toggleCompletion(task.getId());

            assertEquals(List.of(true, false), seen);
        }
    }

    @Nested
    @DisplayName("moving")
    class MoveTests {

        @Test
        @DisplayName("canMove reports a full destination")
        void canMove() {
            for (String title : List.of("A", "B", "C")) {
                facade.createTaskWithCommitment(title, TaskType.TASK, Timeframe.DAILY, Section.PRIMARY, TODAY);
            }
            Commitment extra = facade.createTaskWithCommitment("Extra", TaskType.TASK, Timeframe.DAILY,
                    Section.OVERFLOW, TODAY);

            assertFalse(facade.canMove(extra.getId(), Section.PRIMARY));
            assertTrue(facade.canMove(extra.getId(), Section.OVERFLOW));
        }

        @Test
        @DisplayName("reschedule keeps the timeframe when none is given")
        void rescheduleKeepsTimeframe() {
            Commitment weekly = facade.createTaskWithCommitment("Gym", TaskType.TASK, Timeframe.WEEKLY,
                    Section.PRIMARY, TODAY);

            Commitment moved = facade.reschedule(weekly.getId(), LocalDate.of(2026, 3, 18), null);

            assertEquals(Timeframe.WEEKLY, moved.getTimeframe());
            assertEquals(LocalDate.of(2026, 3, 15), moved.getPeriodAnchorDate());
        }
    }

    @Nested
    @DisplayName("users")
    class UserTests {

        @Test
        @DisplayName("one user's refresh keeps another user's loaded commitments")
        void refreshKeepsOtherUsers() {
            Commitment alices = facade.createTaskWithCommitment("Alice's task", TaskType.TASK, Timeframe.DAILY,
                    Section.PRIMARY, TODAY);
            fixture.signIn("bob");

            facade.refresh(Timeframe.DAILY, TODAY);
            fixture.signIn(PlannerFixture.USER);

            assertEquals(alices.getId(), facade.getCommitment(alices.getId()).getId());
            assertEquals("Alice's task", facade.getTask(alices.getTaskId()).getTitle());
        }

        @Test
        @DisplayName("another user's task and commitment are not found, even from the store")
        void otherUsersRecords() {
            Commitment alices = facade.createTaskWithCommitment("Alice's task", TaskType.TASK, Timeframe.DAILY,
                    Section.PRIMARY, TODAY);
            fixture.signIn("bob");

            assertThrows(TaskNotFoundException.class, () -> facade.getTask(alices.getTaskId()));
            assertThrows(CommitmentNotFoundException.class, () -> facade.removeCommitment(alices.getId()));
            assertThrows(TaskNotFoundException.class, () -> facade.deleteTask(alices.getTaskId()));
            assertThrows(TaskNotFoundException.class,
                    () -> facade.commit(alices.getTaskId(), Timeframe.WEEKLY, Section.PRIMARY, TODAY));
            assertEquals(1, fixture.commitmentStore.size());
            assertEquals(1, fixture.taskStore.size());
        }
    }

    @Nested
    @DisplayName("timeline")
    class TimelineTests {

        @Test
        @DisplayName("loading a day's timeline also loads the tasks of the placed commitments")
        void loadsTasks() {
            Commitment daily = facade.createTaskWithCommitment("Write", TaskType.TASK, Timeframe.DAILY,
                    Section.PRIMARY, TODAY);
            facade.scheduleTime(daily.getId(), TODAY.atTime(9, 0), null);
            fixture.ledger.replaceAll(List.of());
            fixture.taskGraph.replaceAll(List.of());

            List<Commitment> timed = facade.timedCommitments(TODAY);

            assertEquals(1, timed.size());
            assertEquals(30, timed.get(0).getDurationMinutes());
            assertTrue(fixture.taskGraph.find(daily.getTaskId()).isPresent());
        }

        @Test
        @DisplayName("dropping another user's task on the timeline is refused")
        void otherUsersTask() {
            Task alices = facade.createTask("Alice's task", TaskType.TASK);
            fixture.signIn("bob");

            assertThrows(TaskNotFoundException.class,
                    () -> facade.createTimedCommitment(alices.getId(), TODAY.atTime(9, 0)));
            assertEquals(0, fixture.commitmentStore.size());
        }
    }

    @Test
    @DisplayName("suggestSubtasks passes the task and its existing subtasks to the agent")
    void suggestSubtasks() {
        Task task = facade.createTask("Plan trip", TaskType.PROJECT);
        facade.createSubtask("Book flights", task.getId());
        when(agent.suggestSubtasks(eq("Plan trip"), any(), eq(List.of("Book flights"))))
                .thenReturn(List.of("Reserve hotel"));

        assertEquals(List.of("Reserve hotel"), facade.suggestSubtasks(task.getId()));
    }
}
