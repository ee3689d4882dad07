package com.prakash.focusplanner.service;

import com.prakash.focusplanner.exception.ValidationException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.repository.CommitmentStore;
import com.prakash.focusplanner.repository.SectionSortOrderUpdate;
import com.prakash.focusplanner.repository.SortOrderUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drag reordering inside a section and moves between sections.
 * <p>
 * Both operations rewrite the mirror first and persist the new sort orders in one batch afterwards.
 * A failed batch leaves the mirror reordered; the next refresh restores the stored order.
 */
@Service
public class ReorderEngine {

    private static final Logger log = LoggerFactory.getLogger(ReorderEngine.class);

    private final CommitmentLedger ledger;
    private final CommitmentStore commitmentStore;

    @Autowired
    public ReorderEngine(CommitmentLedger ledger, CommitmentStore commitmentStore) {
        this.ledger = ledger;
        this.commitmentStore = commitmentStore;
    }

    /**
     * Moves a commitment to {@code targetIndex} among the incomplete commitments of its bucket and renumbers
     * the bucket 0..n-1.
     *
     * @return the persisted sort order changes; empty when the position did not change
     */
    public List<SortOrderUpdate> reorder(String commitmentId, int targetIndex) {
        Commitment moved = ledger.require(commitmentId);
        List<Commitment> ordering = new ArrayList<>(
                ledger.incompleteBucket(moved.getSection(), moved.getTimeframe(), moved.getPeriodAnchorDate()));

        int from = ordering.indexOf(moved);
        if (from < 0) {
            throw new ValidationException("Commitment " + commitmentId + " is not an incomplete commitment of its section");
        }
        int to = Math.max(0, Math.min(targetIndex, ordering.size() - 1));
        if (from == to) {
            return List.of();
        }

        ordering.remove(from);
        ordering.add(to, moved);

        List<SortOrderUpdate> updates = new ArrayList<>(ordering.size());
        for (int i = 0; i < ordering.size(); i++) {
            Commitment commitment = ordering.get(i);
            commitment.setSortOrder(i);
            updates.add(new SortOrderUpdate(commitment.getId(), i));
        }

        log.info("Reordering commitment {} from {} to {} in {} {}", commitmentId, from, to,
                moved.getSection(), moved.getTimeframe());
        commitmentStore.batchUpdateSortOrders(updates);
        return updates;
    }

    /**
     * Moves the dropped commitment to the position currently held by the target commitment.
     */
    public List<SortOrderUpdate> reorder(String droppedId, String targetId) {
        if (droppedId.equals(targetId)) {
            return List.of();
        }
        Commitment target = ledger.require(targetId);
        int targetIndex = ledger.incompleteBucket(target.getSection(), target.getTimeframe(), target.getPeriodAnchorDate())
                .indexOf(target);
        if (targetIndex < 0) {
            throw new ValidationException("Commitment " + targetId + " is not an incomplete commitment of its section");
        }
        return reorder(droppedId, targetIndex);
    }

    public boolean moveToSection(String commitmentId, Section destination) {
        return moveToSection(commitmentId, destination, Integer.MAX_VALUE);
    }

    /**
     * Moves a commitment into another section of the same timeframe and period, inserting it at
     * {@code targetIndex} (clamped to the end), and renumbers both buckets.
     *
     * @return false without touching anything when the destination is full; callers check
     * {@link CommitmentLedger#canAdd} first to tell the user why
     */
    public boolean moveToSection(String commitmentId, Section destination, int targetIndex) {
        Commitment moved = ledger.require(commitmentId);
        Section source = moved.getSection();
        if (source == destination) {
            return true;
        }
        if (!ledger.canAdd(destination, moved.getTimeframe(), moved.getPeriodAnchorDate(), commitmentId)) {
            log.warn("Cannot move commitment {} to {}: section full for {} starting {}",
                    commitmentId, destination, moved.getTimeframe(), moved.getPeriodAnchorDate());
            return false;
        }

        List<Commitment> sourceOrdering = new ArrayList<>(
                ledger.incompleteBucket(source, moved.getTimeframe(), moved.getPeriodAnchorDate()));
        sourceOrdering.remove(moved);
        List<Commitment> destinationOrdering = new ArrayList<>(
                ledger.incompleteBucket(destination, moved.getTimeframe(), moved.getPeriodAnchorDate()));
        destinationOrdering.add(Math.max(0, Math.min(targetIndex, destinationOrdering.size())), moved);

        moved.setSection(destination);
        List<SectionSortOrderUpdate> updates = new ArrayList<>();
        renumber(sourceOrdering, source, updates);
        renumber(destinationOrdering, destination, updates);

        log.info("Moving commitment {} from {} to {}", commitmentId, source, destination);
        commitmentStore.batchUpdateSortOrdersAndSections(updates);
        return true;
    }

    private static void renumber(List<Commitment> ordering, Section section, List<SectionSortOrderUpdate> updates) {
        for (int i = 0; i < ordering.size(); i++) {
            Commitment commitment = ordering.get(i);
            commitment.setSortOrder(i);
            updates.add(new SectionSortOrderUpdate(commitment.getId(), i, section));
        }
    }
}
