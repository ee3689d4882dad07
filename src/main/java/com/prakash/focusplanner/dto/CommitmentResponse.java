package com.prakash.focusplanner.dto;

import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Timeframe;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommitmentResponse {

    private String id;
    private String taskId;
    private Timeframe timeframe;
    private Section section;
    private LocalDate periodAnchorDate;
    private int sortOrder;
    private String parentCommitmentId;
    private LocalDateTime scheduledTime;
    private Integer durationMinutes;
    private int childCount; // "N broken down"

    public static CommitmentResponse fromEntity(Commitment commitment) {
        return fromEntity(commitment, 0);
    }

    public static CommitmentResponse fromEntity(Commitment commitment, int childCount) {
        if (commitment == null) {
            return null;
        }
        return CommitmentResponse.builder()
                .id(commitment.getId())
                .taskId(commitment.getTaskId())
                .timeframe(commitment.getTimeframe())
                .section(commitment.getSection())
                .periodAnchorDate(commitment.getPeriodAnchorDate())
                .sortOrder(commitment.getSortOrder())
                .parentCommitmentId(commitment.getParentCommitmentId())
                .scheduledTime(commitment.getScheduledTime())
                .durationMinutes(commitment.getDurationMinutes())
                .childCount(childCount)
                .build();
    }
}
