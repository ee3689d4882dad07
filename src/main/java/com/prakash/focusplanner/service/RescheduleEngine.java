package com.prakash.focusplanner.service;

import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.repository.CommitmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Moves a commitment to another period, optionally at another timeframe. Breakdown children stay where they are.
 */
@Service
public class RescheduleEngine {

    private static final Logger log = LoggerFactory.getLogger(RescheduleEngine.class);

    private final CommitmentLedger ledger;
    private final CommitmentStore commitmentStore;
    private final PeriodCalculator periodCalculator;

    @Autowired
    public RescheduleEngine(CommitmentLedger ledger,
                            CommitmentStore commitmentStore,
                            PeriodCalculator periodCalculator) {
        this.ledger = ledger;
        this.commitmentStore = commitmentStore;
        this.periodCalculator = periodCalculator;
    }

    /**
     * Relocates the commitment to the {@code newTimeframe} period containing {@code newDate}, keeping its section.
     * The mirror is updated before the store write.
     *
     * @throws com.prakash.focusplanner.exception.CapacityExceededException if the destination bucket is full,
     *                                                                      not counting the commitment itself
     */
    public Commitment reschedule(String commitmentId, LocalDate newDate, Timeframe newTimeframe) {
        Commitment commitment = ledger.require(commitmentId);
        LocalDate newAnchor = periodCalculator.periodStart(newTimeframe, newDate);
        boolean bucketChanged = commitment.getTimeframe() != newTimeframe
                || !newAnchor.equals(commitment.getPeriodAnchorDate());
        if (!bucketChanged) {
            return commitment;
        }
        ledger.requireCapacity(commitment.getSection(), newTimeframe, newAnchor, commitmentId);

        int sortOrder = ledger.nextSortOrder(commitment.getSection(), newTimeframe, newAnchor);
        Timeframe oldTimeframe = commitment.getTimeframe();
        LocalDate oldAnchor = commitment.getPeriodAnchorDate();

        commitment.setTimeframe(newTimeframe);
        commitment.setPeriodAnchorDate(newAnchor);
        commitment.setSortOrder(sortOrder);
        detachInvalidLinks(commitment);

        log.info("Rescheduling commitment {} from {} {} to {} {}",
                commitmentId, oldTimeframe, oldAnchor, newTimeframe, newAnchor);
        commitmentStore.update(commitment);
        return commitment;
    }

    /**
     * Reschedules the commitment to the period right after its current one, same timeframe.
     */
    public Commitment pushToNext(String commitmentId) {
        Commitment commitment = ledger.require(commitmentId);
        LocalDate next = periodCalculator.nextPeriodAnchor(commitment.getTimeframe(), commitment.getPeriodAnchorDate());
        log.debug("Pushing commitment {} to {}", commitmentId, next);
        return reschedule(commitmentId, next, commitment.getTimeframe());
    }

    // A breakdown link needs the parent strictly higher than the child
    private void detachInvalidLinks(Commitment commitment) {
        if (commitment.isChildCommitment()) {
            ledger.find(commitment.getParentCommitmentId())
                    .filter(parent -> !parent.getTimeframe().isHigherThan(commitment.getTimeframe()))
                    .ifPresent(parent -> {
                        log.info("Detaching commitment {} from parent {}", commitment.getId(), parent.getId());
                        commitment.setParentCommitmentId(null);
                    });
        }
        for (Commitment child : ledger.childrenOf(commitment.getId())) {
            if (!commitment.getTimeframe().isHigherThan(child.getTimeframe())) {
                log.info("Detaching child commitment {} from {}", child.getId(), commitment.getId());
                child.setParentCommitmentId(null);
                commitmentStore.update(child);
            }
        }
    }
}
