package com.prakash.focusplanner.controller;

import com.prakash.focusplanner.dto.BreakdownRequest;
import com.prakash.focusplanner.dto.CommitRequest;
import com.prakash.focusplanner.dto.CommitmentResponse;
import com.prakash.focusplanner.dto.MoveRequest;
import com.prakash.focusplanner.dto.ReorderRequest;
import com.prakash.focusplanner.dto.RescheduleRequest;
import com.prakash.focusplanner.dto.ScheduleTimeRequest;
import com.prakash.focusplanner.dto.SectionSnapshot;
import com.prakash.focusplanner.dto.TimedCommitmentRequest;
import com.prakash.focusplanner.exception.BreakdownNotAllowedException;
import com.prakash.focusplanner.exception.CapacityExceededException;
import com.prakash.focusplanner.exception.CommitmentNotFoundException;
import com.prakash.focusplanner.exception.StoreFailureException;
import com.prakash.focusplanner.exception.TaskNotFoundException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.orchestrator.SchedulingFacade;
import com.prakash.focusplanner.repository.SortOrderUpdate;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Commitments of the signed-in user. Operations on a commitment act on the loaded period, so clients
 * load the period with {@code GET /api/v1/commitments} first.
 */
@RestController
@RequestMapping("/api/v1/commitments")
public class CommitmentController {

    private static final Logger log = LoggerFactory.getLogger(CommitmentController.class);

    private final SchedulingFacade schedulingFacade;

    @Autowired
    public CommitmentController(SchedulingFacade schedulingFacade) {
        this.schedulingFacade = schedulingFacade;
    }

    /**
     * Endpoint to load a period: both sections with their commitments, limits and breakdown counts.
     */
    @GetMapping
    public ResponseEntity<List<SectionSnapshot>> getPeriod(
            @RequestParam Timeframe timeframe,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("Received request to load {} period containing {}", timeframe, date);
        return ResponseEntity.ok(schedulingFacade.refresh(timeframe, date));
    }

    /**
     * Endpoint to commit an existing task to a period and section.
     *
     * @return The created commitment, or 409 when the section is full.
     */
    @PostMapping
    public ResponseEntity<CommitmentResponse> commit(@Valid @RequestBody CommitRequest request) {
        log.info("Received request to commit task {} to {} {} on {}", request.getTaskId(), request.getSection(),
                request.getTimeframe(), request.getDate());
        try {
            Commitment created = schedulingFacade.commit(request.getTaskId(), request.getTimeframe(),
                    request.getSection(), request.getDate());
            return ResponseEntity.status(HttpStatus.CREATED).body(CommitmentResponse.fromEntity(created));
        } catch (ValidationException | CapacityExceededException | StoreFailureException e) {
            log.warn("Failed to commit task {}: {}", request.getTaskId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error committing task {}: {}", request.getTaskId(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<CommitmentResponse> getCommitment(@PathVariable String id) {
        log.debug("Received request to get commitment by ID: {}", id);
        Commitment commitment = schedulingFacade.getCommitment(id);
        return ResponseEntity.ok(CommitmentResponse.fromEntity(commitment, schedulingFacade.childCount(id)));
    }

    /**
     * Endpoint to remove a commitment and its breakdown subtree. The task itself is kept.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeCommitment(@PathVariable String id) {
        log.info("Received request to remove commitment {}", id);
        try {
            schedulingFacade.removeCommitment(id);
            return ResponseEntity.noContent().build();
        } catch (CommitmentNotFoundException | StoreFailureException e) {
            log.warn("Cannot remove commitment {}: {}", id, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error removing commitment {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }

    @GetMapping("/{id}/breakdown-timeframes")
    public ResponseEntity<List<Timeframe>> getBreakdownTimeframes(@PathVariable String id) {
        return ResponseEntity.ok(schedulingFacade.availableBreakdownTimeframes(id));
    }

    @GetMapping("/{id}/slots")
    public ResponseEntity<List<LocalDate>> getAvailableSlots(@PathVariable String id,
                                                             @RequestParam Timeframe timeframe) {
        log.debug("Received request for free {} slots of commitment {}", timeframe, id);
        return ResponseEntity.ok(schedulingFacade.availableSlots(id, timeframe));
    }

    /**
     * Endpoint to break a commitment down into a lower timeframe. With a subtask id in the body, that subtask
     * is committed under the commitment instead of the commitment's own task.
     */
    @PostMapping("/{id}/breakdown")
    public ResponseEntity<CommitmentResponse> breakdown(@PathVariable String id,
                                                        @Valid @RequestBody BreakdownRequest request) {
        log.info("Received request to break down commitment {} to {} on {}", id, request.getTargetTimeframe(),
                request.getTargetDate());
        try {
            Commitment created = request.getSubtaskId() != null
                    ? schedulingFacade.commitSubtask(request.getSubtaskId(), id, request.getTargetTimeframe(),
                    request.getTargetDate())
                    : schedulingFacade.breakdown(id, request.getTargetTimeframe(), request.getTargetDate());
            return ResponseEntity.status(HttpStatus.CREATED).body(CommitmentResponse.fromEntity(created));
        } catch (CommitmentNotFoundException | TaskNotFoundException | ValidationException
                 | BreakdownNotAllowedException | CapacityExceededException | StoreFailureException e) {
            log.warn("Cannot break down commitment {}: {}", id, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error breaking down commitment {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    /**
     * Endpoint to load the whole breakdown subtree of a commitment, parents before children.
     */
    @GetMapping("/{id}/descendants")
    public ResponseEntity<List<CommitmentResponse>> getDescendants(@PathVariable String id) {
        log.debug("Received request for descendants of commitment {}", id);
        List<CommitmentResponse> responseDtos = schedulingFacade.breakdownTree(id).descendants().stream()
                .map(c -> CommitmentResponse.fromEntity(c, schedulingFacade.childCount(c.getId())))
                .collect(Collectors.toList());
        return ResponseEntity.ok(responseDtos);
    }

    @PostMapping("/{id}/reorder")
    public ResponseEntity<List<SortOrderUpdate>> reorder(@PathVariable String id,
                                                         @Valid @RequestBody ReorderRequest request) {
        if (request.getTargetCommitmentId() == null && request.getTargetIndex() == null) {
            return ResponseEntity.badRequest().build();
        }
        log.info("Received request to reorder commitment {}", id);
        List<SortOrderUpdate> updates = request.getTargetCommitmentId() != null
                ? schedulingFacade.reorderOnto(id, request.getTargetCommitmentId())
                : schedulingFacade.reorder(id, request.getTargetIndex());
        return ResponseEntity.ok(updates);
    }

    /**
     * Endpoint to move a commitment to the other section of its period.
     *
     * @return The moved commitment, or 409 when the destination section is full.
     */
    @PostMapping("/{id}/move")
    public ResponseEntity<CommitmentResponse> moveToSection(@PathVariable String id,
                                                            @Valid @RequestBody MoveRequest request) {
        log.info("Received request to move commitment {} to {}", id, request.getSection());
        if (!schedulingFacade.canMove(id, request.getSection())) {
            log.warn("Cannot move commitment {}: {} section is full", id, request.getSection());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        schedulingFacade.moveToSection(id, request.getSection(), request.getTargetIndex());
        return ResponseEntity.ok(CommitmentResponse.fromEntity(schedulingFacade.getCommitment(id)));
    }

    @PostMapping("/{id}/reschedule")
    public ResponseEntity<CommitmentResponse> reschedule(@PathVariable String id,
                                                         @Valid @RequestBody RescheduleRequest request) {
        log.info("Received request to reschedule commitment {} to {} {}", id, request.getTimeframe(), request.getDate());
        Commitment rescheduled = schedulingFacade.reschedule(id, request.getDate(), request.getTimeframe());
        return ResponseEntity.ok(CommitmentResponse.fromEntity(rescheduled));
    }

    @PostMapping("/{id}/push")
    public ResponseEntity<CommitmentResponse> pushToNext(@PathVariable String id) {
        log.info("Received request to push commitment {} to the next period", id);
        return ResponseEntity.ok(CommitmentResponse.fromEntity(schedulingFacade.pushToNext(id)));
    }

    /**
     * Endpoint to load the timeline of one day: the commitments placed on it, earliest first.
     */
    @GetMapping("/timeline")
    public ResponseEntity<List<CommitmentResponse>> getTimeline(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("Received request to load the timeline of {}", date);
        List<CommitmentResponse> responseDtos = schedulingFacade.timedCommitments(date).stream()
                .map(CommitmentResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(responseDtos);
    }

    /**
     * Endpoint to drop a task on the timeline: commits it to that day and places it at the given time.
     */
    @PostMapping("/timeline")
    public ResponseEntity<CommitmentResponse> createTimedCommitment(@Valid @RequestBody TimedCommitmentRequest request) {
        log.info("Received request to place task {} on the timeline at {}", request.getTaskId(), request.getScheduledTime());
        try {
            Commitment created = schedulingFacade.createTimedCommitment(request.getTaskId(), request.getScheduledTime());
            return ResponseEntity.status(HttpStatus.CREATED).body(CommitmentResponse.fromEntity(created));
        } catch (TaskNotFoundException | ValidationException | CapacityExceededException | StoreFailureException e) {
            log.warn("Failed to place task {} on the timeline: {}", request.getTaskId(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error placing task {} on the timeline: {}", request.getTaskId(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    @PutMapping("/{id}/time")
    public ResponseEntity<CommitmentResponse> scheduleTime(@PathVariable String id,
                                                           @Valid @RequestBody ScheduleTimeRequest request) {
        log.info("Received request to schedule commitment {} at {}", id, request.getScheduledTime());
        Commitment scheduled = schedulingFacade.scheduleTime(id, request.getScheduledTime(), request.getDurationMinutes());
        return ResponseEntity.ok(CommitmentResponse.fromEntity(scheduled));
    }

    /**
     * Endpoint to take a commitment off the timeline.
     *
     * @return The commitment without a time, or 204 when it only existed on the timeline and was removed.
     */
    @DeleteMapping("/{id}/time")
    public ResponseEntity<CommitmentResponse> unscheduleTime(@PathVariable String id) {
        log.info("Received request to unschedule commitment {}", id);
        Commitment unscheduled = schedulingFacade.unscheduleTime(id);
        if (unscheduled == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(CommitmentResponse.fromEntity(unscheduled));
    }
}
