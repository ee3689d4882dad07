package com.prakash.focusplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Binding of a task to a period, a section and a position inside that section.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "commitments")
@CompoundIndex(name = "bucket_idx", def = "{'ownerId': 1, 'timeframe': 1, 'section': 1, 'periodAnchorDate': 1}")
public class Commitment {

    @Id
    private String id;

    private String ownerId;

    @Indexed
    private String taskId;

    private Timeframe timeframe;
    private Section section;

    // Start of the bound period for the timeframe (Sunday for weeks, the 1st for months, Jan 1 for years)
    private LocalDate periodAnchorDate;

    private int sortOrder;

    // Set when produced by breaking down a commitment of a strictly higher timeframe
    @Indexed
    private String parentCommitmentId;

    // Optional calendar timeline placement, independent of the timeframe
    private LocalDateTime scheduledTime;
    private Integer durationMinutes;

    @CreatedDate
    private LocalDateTime createdAt;

    public boolean isChildCommitment() {
        return parentCommitmentId != null;
    }

    public boolean canBreakdown() {
        return timeframe != Timeframe.DAILY;
    }

    public Commitment copy() {
        return toBuilder().build();
    }
}
