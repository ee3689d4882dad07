package com.prakash.focusplanner.repository;

import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Typed commitment filter. Null fields do not constrain the result.
 * Store implementations translate it to their own query language.
 */
@Value
@Builder
public class CommitmentQuery {

    String ownerId;
    Timeframe timeframe;
    Section section;
    LocalDate anchorFrom;  // inclusive
    LocalDate anchorUntil; // exclusive
    String taskId;
    String parentCommitmentId;
    LocalDateTime scheduledFrom;  // inclusive; set only on timeline placements
    LocalDateTime scheduledUntil; // exclusive

    public static CommitmentQuery childrenOf(String parentCommitmentId) {
        return CommitmentQuery.builder().parentCommitmentId(parentCommitmentId).build();
    }

    public static CommitmentQuery forTask(String taskId) {
        return CommitmentQuery.builder().taskId(taskId).build();
    }

    /**
     * The user's commitments placed on the timeline of one day.
     */
    public static CommitmentQuery scheduledOn(String ownerId, LocalDate day) {
        return CommitmentQuery.builder()
                .ownerId(ownerId)
                .scheduledFrom(day.atStartOfDay())
                .scheduledUntil(day.plusDays(1).atStartOfDay())
                .build();
    }

    /**
     * In-memory evaluation of the filter, used by stores that cannot push it down.
     */
    public boolean matches(Commitment commitment) {
        if (ownerId != null && !ownerId.equals(commitment.getOwnerId())) return false;
        if (timeframe != null && timeframe != commitment.getTimeframe()) return false;
        if (section != null && section != commitment.getSection()) return false;
        if (taskId != null && !taskId.equals(commitment.getTaskId())) return false;
        if (parentCommitmentId != null && !parentCommitmentId.equals(commitment.getParentCommitmentId())) return false;
        LocalDate anchor = commitment.getPeriodAnchorDate();
        if (anchorFrom != null && (anchor == null || anchor.isBefore(anchorFrom))) return false;
        if (anchorUntil != null && (anchor == null || !anchor.isBefore(anchorUntil))) return false;
        LocalDateTime scheduled = commitment.getScheduledTime();
        if (scheduledFrom != null && (scheduled == null || scheduled.isBefore(scheduledFrom))) return false;
        if (scheduledUntil != null && (scheduled == null || !scheduled.isBefore(scheduledUntil))) return false;
        return true;
    }
}
