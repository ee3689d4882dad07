package com.prakash.focusplanner.service;

import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.repository.CommitmentQuery;
import com.prakash.focusplanner.repository.CommitmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Calendar timeline placement of commitments: a start time and a duration on one day, independent of
 * the commitment's timeframe and section.
 * <p>
 * Writes go to the store first; the mirror takes the stored version afterwards.
 */
@Service
public class TimelineEngine {

    private static final Logger log = LoggerFactory.getLogger(TimelineEngine.class);

    public static final int DEFAULT_DURATION_MINUTES = 30;

    private final CommitmentLedger ledger;
    private final CommitmentStore commitmentStore;
    private final CurrentUser currentUser;

    // Commitments that exist only because a task was dropped on the timeline
    private final Set<String> createdOnTimeline = ConcurrentHashMap.newKeySet();

    @Autowired
    public TimelineEngine(CommitmentLedger ledger, CommitmentStore commitmentStore, CurrentUser currentUser) {
        this.ledger = ledger;
        this.commitmentStore = commitmentStore;
        this.currentUser = currentUser;
    }

    /**
     * Places a commitment on the timeline, or moves it there if it already has a time.
     *
     * @param durationMinutes length of the block, {@value #DEFAULT_DURATION_MINUTES} minutes when null
     */
    public Commitment scheduleTime(String commitmentId, LocalDateTime time, Integer durationMinutes) {
        if (time == null) {
            throw new ValidationException("Scheduled time is required");
        }
        int duration = durationMinutes == null ? DEFAULT_DURATION_MINUTES : durationMinutes;
        if (duration < 1) {
            throw new ValidationException("Duration must be at least one minute");
        }
        Commitment placed = ledger.require(commitmentId).copy();
        placed.setScheduledTime(time);
        placed.setDurationMinutes(duration);
        log.info("Scheduling commitment {} at {} for {} minutes", commitmentId, time, duration);
        return ledger.save(placed);
    }

    /**
     * Takes a commitment off the timeline. A commitment that was created by dropping its task on the timeline
     * is removed together with its breakdown subtree; any other keeps its period and only loses the time.
     *
     * @return the commitment without a time, or null when it was removed
     */
    public Commitment unscheduleTime(String commitmentId) {
        Commitment commitment = ledger.require(commitmentId);
        if (createdOnTimeline.remove(commitmentId)) {
            log.info("Removing timeline-created commitment {}", commitmentId);
            ledger.deleteWithDescendants(commitmentId);
            return null;
        }
        Commitment cleared = commitment.copy();
        cleared.setScheduledTime(null);
        cleared.setDurationMinutes(null);
        log.info("Unscheduling commitment {}", commitmentId);
        return ledger.save(cleared);
    }

    /**
     * Commits a task to the day of {@code time} in the primary section, already placed on the timeline.
     */
    public Commitment createTimedCommitment(String taskId, LocalDateTime time) {
        if (time == null) {
            throw new ValidationException("Scheduled time is required");
        }
        Commitment created = ledger.createTimed(taskId, Section.PRIMARY, time, DEFAULT_DURATION_MINUTES);
        createdOnTimeline.add(created.getId());
        return created;
    }

    /**
     * The signed-in user's commitments placed on the timeline of {@code day}, earliest first.
     * The result is mirrored.
     */
    public List<Commitment> timedCommitments(LocalDate day) {
        List<Commitment> timed = commitmentStore.fetch(CommitmentQuery.scheduledOn(currentUser.requireUserId(), day));
        ledger.absorb(timed);
        log.debug("Loaded {} timed commitments for {}", timed.size(), day);
        return timed.stream()
                .sorted(Comparator.comparing(Commitment::getScheduledTime))
                .toList();
    }
}
