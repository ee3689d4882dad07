package com.prakash.focusplanner.service;

import com.prakash.focusplanner.exception.BreakdownNotAllowedException;
import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.repository.CommitmentQuery;
import com.prakash.focusplanner.repository.CommitmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trickle-down breakdown: commits a higher-timeframe commitment's task to lower-timeframe periods
 * inside the parent period, keeping the parent commitment where it is.
 */
@Service
public class BreakdownEngine {

    private static final Logger log = LoggerFactory.getLogger(BreakdownEngine.class);

    private final CommitmentLedger ledger;
    private final CommitmentStore commitmentStore;
    private final PeriodCalculator periodCalculator;

    @Autowired
    public BreakdownEngine(CommitmentLedger ledger,
                           CommitmentStore commitmentStore,
                           PeriodCalculator periodCalculator) {
        this.ledger = ledger;
        this.commitmentStore = commitmentStore;
        this.periodCalculator = periodCalculator;
    }

    public List<Timeframe> availableBreakdownTimeframes(Timeframe timeframe) {
        return timeframe.breakdownTargets();
    }

    /**
     * Creates a child commitment of the same task and section at {@code targetTimeframe}.
     *
     * @throws BreakdownNotAllowedException if the target timeframe is not a breakdown target of the parent,
     *                                      the target period lies outside the parent period, or the slot is taken
     */
    public Commitment createChild(Commitment parent, Timeframe targetTimeframe, LocalDate targetDate) {
        LocalDate slot = validateSlot(parent, parent.getTaskId(), targetTimeframe, targetDate);
        Commitment child = ledger.create(parent.getTaskId(), targetTimeframe, parent.getSection(), slot, parent.getId());
        log.info("Broke down commitment {} ({}) into {} commitment {} starting {}",
                parent.getId(), parent.getTimeframe(), targetTimeframe, child.getId(), slot);
        return child;
    }

    /**
     * Commits a subtask that has no commitment of its own relative to its parent's commitment.
     * At the parent's timeframe it becomes a plain commitment in the parent's period; at a lower timeframe it
     * becomes a breakdown child of the parent commitment.
     */
    public Commitment commitSubtask(Task subtask, Commitment parentCommitment, LocalDate date, Timeframe targetTimeframe) {
        if (!parentCommitment.getTaskId().equals(subtask.getParentTaskId())) {
            throw new ValidationException("Task " + subtask.getId() + " is not a subtask of the committed task");
        }
        LocalDate effectiveDate = targetTimeframe == parentCommitment.getTimeframe()
                ? parentCommitment.getPeriodAnchorDate()
                : date;
        boolean alreadyCommitted = ledger.findForTask(subtask.getId()).stream()
                .anyMatch(c -> c.getTimeframe() == targetTimeframe
                        && periodCalculator.samePeriod(c.getPeriodAnchorDate(), targetTimeframe, effectiveDate));
        if (alreadyCommitted) {
            throw new BreakdownNotAllowedException(
                    "Subtask " + subtask.getId() + " is already committed to that " + targetTimeframe + " period");
        }
        if (targetTimeframe == parentCommitment.getTimeframe()) {
            log.info("Committing subtask {} alongside its parent at {}", subtask.getId(), targetTimeframe);
            return ledger.create(subtask.getId(), targetTimeframe, parentCommitment.getSection(), effectiveDate, null);
        }
        LocalDate slot = validateSlot(parentCommitment, subtask.getId(), targetTimeframe, date);
        Commitment created = ledger.create(subtask.getId(), targetTimeframe, parentCommitment.getSection(), slot,
                parentCommitment.getId());
        log.info("Committed subtask {} to {} starting {} under commitment {}",
                subtask.getId(), targetTimeframe, slot, parentCommitment.getId());
        return created;
    }

    /**
     * Start dates of the {@code targetTimeframe} periods inside the parent period that no child of the parent
     * occupies yet. Empty when the parent cannot be broken down to that timeframe.
     */
    public List<LocalDate> availableSlots(Commitment parent, Timeframe targetTimeframe) {
        if (!parent.getTimeframe().canBreakDownTo(targetTimeframe)) {
            return List.of();
        }
        Set<LocalDate> used = usedSlots(parent, targetTimeframe, null);
        return periodCalculator.subPeriodStarts(parent.getTimeframe(), parent.getPeriodAnchorDate(), targetTimeframe)
                .stream()
                .filter(start -> !used.contains(start))
                .toList();
    }

    /**
     * Loads the breakdown subtree of a commitment from the store, children first then grandchildren,
     * and mirrors every fetched commitment in the ledger.
     */
    public BreakdownNode fetchDescendantsRecursively(Commitment commitment) {
        List<BreakdownNode> children = new ArrayList<>();
        if (commitment.canBreakdown()) {
            List<Commitment> fetched = commitmentStore.fetch(CommitmentQuery.childrenOf(commitment.getId()));
            ledger.absorb(fetched);
            for (Commitment child : fetched) {
                children.add(fetchDescendantsRecursively(child));
            }
        }
        return new BreakdownNode(commitment, children);
    }

    public int childCount(String commitmentId) {
        return ledger.childCount(commitmentId);
    }

    // A slot is taken when the same task already has a child of the parent in that period
    private LocalDate validateSlot(Commitment parent, String taskId, Timeframe targetTimeframe, LocalDate targetDate) {
        if (!parent.getTimeframe().canBreakDownTo(targetTimeframe)) {
            log.error("Refused breakdown of {} commitment {} to {}", parent.getTimeframe(), parent.getId(), targetTimeframe);
            throw new BreakdownNotAllowedException(
                    parent.getTimeframe() + " commitments cannot be broken down to " + targetTimeframe);
        }
        PeriodBounds parentPeriod = periodCalculator.periodBounds(parent.getTimeframe(), parent.getPeriodAnchorDate());
        PeriodBounds targetPeriod = periodCalculator.periodBounds(targetTimeframe, targetDate);
        if (!parentPeriod.overlaps(targetPeriod)) {
            throw new BreakdownNotAllowedException(
                    "Target date " + targetDate + " is outside the parent period starting " + parentPeriod.start());
        }
        if (usedSlots(parent, targetTimeframe, taskId).contains(targetPeriod.start())) {
            throw new BreakdownNotAllowedException(
                    "Task " + taskId + " is already broken down under commitment " + parent.getId() + " to the "
                            + targetTimeframe + " period starting " + targetPeriod.start());
        }
        return targetPeriod.start();
    }

    // taskId null counts every child regardless of its task
    private Set<LocalDate> usedSlots(Commitment parent, Timeframe targetTimeframe, String taskId) {
        return ledger.childrenOf(parent.getId()).stream()
                .filter(child -> child.getTimeframe() == targetTimeframe)
                .filter(child -> taskId == null || taskId.equals(child.getTaskId()))
                .map(child -> periodCalculator.periodStart(targetTimeframe, child.getPeriodAnchorDate()))
                .collect(Collectors.toSet());
    }
}
