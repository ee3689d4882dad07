package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * One section of a period as displayed: incomplete commitments in sort order, then completed ones.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SectionSnapshot {

    private Section section;
    private String displayName;
    private Timeframe timeframe;
    private LocalDate periodStart;
    private Integer maxTasks; // null when unlimited
    private int taskCount;
    private boolean full;
    private List<CommitmentResponse> commitments;
}
