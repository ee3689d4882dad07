package com.prakash.focusplanner.controller;

import com.prakash.focusplanner.dto.SectionSnapshot;
import com.prakash.focusplanner.exception.BreakdownNotAllowedException;
import com.prakash.focusplanner.exception.CommitmentNotFoundException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.orchestrator.SchedulingFacade;
import com.prakash.focusplanner.repository.SortOrderUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CommitmentControllerTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 11);

    private SchedulingFacade facade;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        facade = mock(SchedulingFacade.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new CommitmentController(facade)).build();
    }

    private static Commitment commitment(String id, Timeframe timeframe, Section section) {
        return Commitment.builder().id(id).ownerId("user-1").taskId("task-" + id)
                .timeframe(timeframe).section(section).periodAnchorDate(TODAY).build();
    }

    @Test
    @DisplayName("GET loads the period of the requested timeframe")
    void loadsPeriod() throws Exception {
        SectionSnapshot primary = SectionSnapshot.builder()
                .section(Section.PRIMARY).displayName("Primary").timeframe(Timeframe.DAILY)
                .maxTasks(3).taskCount(3).full(true).commitments(List.of()).build();
        when(facade.refresh(Timeframe.DAILY, TODAY)).thenReturn(List.of(primary));

        mockMvc.perform(get("/api/v1/commitments").param("timeframe", "DAILY").param("date", "2026-03-11"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].section").value("PRIMARY"))
                .andExpect(jsonPath("$[0].maxTasks").value(3))
                .andExpect(jsonPath("$[0].full").value(true));
    }

    @Test
    @DisplayName("POST commits an existing task")
    void commits() throws Exception {
        when(facade.commit("task-1", Timeframe.WEEKLY, Section.OVERFLOW, TODAY))
                .thenReturn(commitment("c-1", Timeframe.WEEKLY, Section.OVERFLOW));

        mockMvc.perform(post("/api/v1/commitments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"taskId\":\"task-1\",\"timeframe\":\"WEEKLY\",\"section\":\"OVERFLOW\","
                                + "\"date\":\"2026-03-11\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("c-1"))
                .andExpect(jsonPath("$.section").value("OVERFLOW"));
    }

    @Test
    @DisplayName("an unknown commitment answers 404")
    void unknownCommitment() throws Exception {
        when(facade.getCommitment("nope")).thenThrow(new CommitmentNotFoundException("Commitment not found: nope"));

        mockMvc.perform(get("/api/v1/commitments/nope"))
                .andExpect(status().isNotFound());
    }

    @Nested
    @DisplayName("POST /api/v1/commitments/{id}/breakdown")
    class BreakdownTests {

        @Test
        @DisplayName("creates a child commitment")
        void createsChild() throws Exception {
            Commitment child = commitment("c-2", Timeframe.WEEKLY, Section.PRIMARY).toBuilder()
                    .parentCommitmentId("c-1").build();
            when(facade.breakdown("c-1", Timeframe.WEEKLY, TODAY)).thenReturn(child);

            mockMvc.perform(post("/api/v1/commitments/c-1/breakdown")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"targetTimeframe\":\"WEEKLY\",\"targetDate\":\"2026-03-11\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.parentCommitmentId").value("c-1"));
        }

        @Test
        @DisplayName("commits a subtask when one is named")
        void commitsSubtask() throws Exception {
            when(facade.commitSubtask("task-9", "c-1", Timeframe.DAILY, TODAY))
                    .thenReturn(commitment("c-3", Timeframe.DAILY, Section.PRIMARY));

            mockMvc.perform(post("/api/v1/commitments/c-1/breakdown")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"targetTimeframe\":\"DAILY\",\"targetDate\":\"2026-03-11\","
                                    + "\"subtaskId\":\"task-9\"}"))
                    .andExpect(status().isCreated());
            verify(facade, never()).breakdown(anyString(), any(), any());
        }

        @Test
        @DisplayName("a refused breakdown answers 422")
        void refused() throws Exception {
            when(facade.breakdown("c-1", Timeframe.DAILY, TODAY))
                    .thenThrow(new BreakdownNotAllowedException("YEARLY commitments cannot be broken down to DAILY"));

            mockMvc.perform(post("/api/v1/commitments/c-1/breakdown")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"targetTimeframe\":\"DAILY\",\"targetDate\":\"2026-03-11\"}"))
                    .andExpect(status().isUnprocessableEntity());
        }
    }

    @Nested
    @DisplayName("reorder and move")
    class OrderingTests {

        @Test
        @DisplayName("reorder needs a target")
        void reorderWithoutTarget() throws Exception {
            mockMvc.perform(post("/api/v1/commitments/c-1/reorder")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(facade);
        }

        @Test
        @DisplayName("reorder by index returns the new sort orders")
        void reorderByIndex() throws Exception {
            when(facade.reorder("c-3", 0)).thenReturn(List.of(
                    new SortOrderUpdate("c-3", 0), new SortOrderUpdate("c-1", 1), new SortOrderUpdate("c-2", 2)));

            mockMvc.perform(post("/api/v1/commitments/c-3/reorder")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"targetIndex\":0}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value("c-3"))
                    .andExpect(jsonPath("$[2].sortOrder").value(2));
        }

        @Test
        @DisplayName("reorder onto another commitment uses its position")
        void reorderOnto() throws Exception {
            when(facade.reorderOnto("c-3", "c-1")).thenReturn(List.of());

            mockMvc.perform(post("/api/v1/commitments/c-3/reorder")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"targetCommitmentId\":\"c-1\"}"))
                    .andExpect(status().isOk());
            verify(facade, never()).reorder(anyString(), anyInt());
        }

        @Test
        @DisplayName("a move into a full section answers 409 and changes nothing")
        void moveIntoFullSection() throws Exception {
            when(facade.canMove("c-4", Section.PRIMARY)).thenReturn(false);

            mockMvc.perform(post("/api/v1/commitments/c-4/move")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"section\":\"PRIMARY\"}"))
                    .andExpect(status().isConflict());
            verify(facade, never()).moveToSection(anyString(), any(), any());
        }

        @Test
        @DisplayName("a move returns the commitment in its new section")
        void move() throws Exception {
            when(facade.canMove("c-4", Section.PRIMARY)).thenReturn(true);
            when(facade.moveToSection("c-4", Section.PRIMARY, 1)).thenReturn(true);
            when(facade.getCommitment("c-4")).thenReturn(commitment("c-4", Timeframe.DAILY, Section.PRIMARY));

            mockMvc.perform(post("/api/v1/commitments/c-4/move")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"section\":\"PRIMARY\",\"targetIndex\":1}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.section").value("PRIMARY"));
        }
    }

    @Nested
    @DisplayName("timeline")
    class TimelineTests {

        @Test
        @DisplayName("places a commitment at a time with the given duration")
        void schedules() throws Exception {
            Commitment placed = commitment("c-1", Timeframe.DAILY, Section.PRIMARY).toBuilder()
                    .scheduledTime(TODAY.atTime(9, 0)).durationMinutes(45).build();
            when(facade.scheduleTime("c-1", TODAY.atTime(9, 0), 45)).thenReturn(placed);

            mockMvc.perform(put("/api/v1/commitments/c-1/time")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scheduledTime\":\"2026-03-11T09:00:00\",\"durationMinutes\":45}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.durationMinutes").value(45));
        }

        @Test
        @DisplayName("rejects a zero duration")
        void zeroDuration() throws Exception {
            mockMvc.perform(put("/api/v1/commitments/c-1/time")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"scheduledTime\":\"2026-03-11T09:00:00\",\"durationMinutes\":0}"))
                    .andExpect(status().isBadRequest());
            verifyNoInteractions(facade);
        }

        @Test
        @DisplayName("unscheduling a timeline-only commitment answers 204")
        void unscheduleRemoved() throws Exception {
            when(facade.unscheduleTime("c-1")).thenReturn(null);

            mockMvc.perform(delete("/api/v1/commitments/c-1/time"))
                    .andExpect(status().isNoContent());
        }

        @Test
        @DisplayName("dropping a task on the timeline creates a commitment")
        void createsTimed() throws Exception {
            when(facade.createTimedCommitment("task-1", TODAY.atTime(14, 15)))
                    .thenReturn(commitment("c-5", Timeframe.DAILY, Section.PRIMARY));

            mockMvc.perform(post("/api/v1/commitments/timeline")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"taskId\":\"task-1\",\"scheduledTime\":\"2026-03-11T14:15:00\"}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value("c-5"));
        }

        @Test
        @DisplayName("lists a day's timeline")
        void lists() throws Exception {
            when(facade.timedCommitments(TODAY)).thenReturn(List.of(commitment("c-1", Timeframe.DAILY, Section.PRIMARY)));

            mockMvc.perform(get("/api/v1/commitments/timeline").param("date", "2026-03-11"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value("c-1"));
            verify(facade, never()).getCommitment(anyString());
        }
    }

    @Test
    @DisplayName("DELETE removes the commitment subtree")
    void removes() throws Exception {
        when(facade.removeCommitment("c-1")).thenReturn(List.of("c-2", "c-1"));

        mockMvc.perform(delete("/api/v1/commitments/c-1"))
                .andExpect(status().isNoContent());
        verify(facade).removeCommitment("c-1");
    }
}
