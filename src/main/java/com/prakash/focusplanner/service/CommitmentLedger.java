package com.prakash.focusplanner.service;

import com.prakash.focusplanner.exception.CapacityExceededException;
import com.prakash.focusplanner.exception.CommitmentNotFoundException;
import com.prakash.focusplanner.model.Commitment;
import com.prakash.focusplanner.model.Section;
import com.prakash.focusplanner.model.Task;
import com.prakash.focusplanner.model.Timeframe;
import com.prakash.focusplanner.repository.CommitmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * In-memory mirror of commitments. Every read is scoped to the signed-in user.
 * <p>
 * Owns section capacity, sort order inside a (section, timeframe, period) bucket and the breakdown
 * parent/child links. Capacity is checked against the mirror at call time and is not re-checked
 * atomically with the store write, so two concurrent creates can both pass the check.
 */
@Service
public class CommitmentLedger {

    private static final Logger log = LoggerFactory.getLogger(CommitmentLedger.class);

    private static final Comparator<Commitment> BY_SORT_ORDER =
            Comparator.comparingInt(Commitment::getSortOrder).thenComparing(Commitment::getId);

    private final CommitmentStore commitmentStore;
    private final PeriodCalculator periodCalculator;
    private final CapacityPolicy capacityPolicy;
    private final TaskGraph taskGraph;
    private final CurrentUser currentUser;

    private final Map<String, Commitment> commitments = new ConcurrentHashMap<>();

    @Autowired
    public CommitmentLedger(CommitmentStore commitmentStore,
                            PeriodCalculator periodCalculator,
                            CapacityPolicy capacityPolicy,
                            TaskGraph taskGraph,
                            CurrentUser currentUser) {
        this.commitmentStore = commitmentStore;
        this.periodCalculator = periodCalculator;
        this.capacityPolicy = capacityPolicy;
        this.taskGraph = taskGraph;
        this.currentUser = currentUser;
    }

    // --- Mirror access ---

    /**
     * Replaces the signed-in user's part of the mirror. Other users' commitments are left alone.
     */
    public void replaceAll(Collection<Commitment> loaded) {
        String userId = currentUser.currentUserId().orElse(null);
        commitments.values().removeIf(c -> Objects.equals(userId, c.getOwnerId()));
        absorb(loaded);
    }

    public void absorb(Collection<Commitment> loaded) {
        for (Commitment commitment : loaded) {
            commitments.put(commitment.getId(), commitment);
        }
    }

    public List<Commitment> all() {
        return owned().toList();
    }

    /**
     * A commitment of the signed-in user. Commitments owned by someone else are not found.
     */
    public Optional<Commitment> find(String commitmentId) {
        return Optional.ofNullable(commitments.get(commitmentId)).filter(this::isOwned);
    }

    public Commitment require(String commitmentId) {
        Commitment commitment = find(commitmentId).orElse(null);
        if (commitment == null) {
            throw new CommitmentNotFoundException("Commitment not found with ID: " + commitmentId);
        }
        return commitment;
    }

    public List<Commitment> findForTask(String taskId) {
        return owned()
                .filter(c -> taskId.equals(c.getTaskId()))
                .sorted(BY_SORT_ORDER)
                .toList();
    }

    /**
     * Direct breakdown children of a commitment, chronologically.
     */
    public List<Commitment> childrenOf(String parentCommitmentId) {
        return owned()
                .filter(c -> parentCommitmentId.equals(c.getParentCommitmentId()))
                .sorted(Comparator.comparing(Commitment::getPeriodAnchorDate).thenComparing(BY_SORT_ORDER))
                .toList();
    }

    public int childCount(String commitmentId) {
        return childrenOf(commitmentId).size();
    }

    // --- Buckets ---

    /**
     * Every commitment of the section and timeframe whose period contains {@code date}.
     */
    public List<Commitment> bucket(Section section, Timeframe timeframe, LocalDate date) {
        return owned()
                .filter(c -> c.getSection() == section && c.getTimeframe() == timeframe)
                .filter(c -> periodCalculator.samePeriod(c.getPeriodAnchorDate(), timeframe, date))
                .toList();
    }

    /**
     * Commitments of a bucket for display: incomplete ones by sort order, then completed ones.
     */
    public List<Commitment> commitmentsFor(Section section, Timeframe timeframe, LocalDate date) {
        List<Commitment> result = new ArrayList<>(incompleteBucket(section, timeframe, date));
        bucket(section, timeframe, date).stream()
                .filter(c -> taskGraph.isCompleted(c.getTaskId()))
                .forEach(result::add);
        return result;
    }

    /**
     * Incomplete commitments of a bucket in sort order. This is the ordering drag reorder works on.
     */
    public List<Commitment> incompleteBucket(Section section, Timeframe timeframe, LocalDate date) {
        return bucket(section, timeframe, date).stream()
                .filter(c -> !taskGraph.isCompleted(c.getTaskId()))
                .sorted(BY_SORT_ORDER)
                .toList();
    }

    public int taskCount(Section section, Timeframe timeframe, LocalDate date) {
        return taskCount(section, timeframe, date, null);
    }

    public int taskCount(Section section, Timeframe timeframe, LocalDate date, String excludingCommitmentId) {
        return (int) bucket(section, timeframe, date).stream()
                .filter(c -> !Objects.equals(c.getId(), excludingCommitmentId))
                .count();
    }

    /**
     * Free places left in the bucket; empty when the section is unlimited.
     */
    public OptionalInt capacityRemaining(Section section, Timeframe timeframe, LocalDate date) {
        OptionalInt max = capacityPolicy.maxFor(section, timeframe);
        if (max.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Math.max(0, max.getAsInt() - taskCount(section, timeframe, date)));
    }

    public boolean canAdd(Section section, Timeframe timeframe, LocalDate date) {
        return canAdd(section, timeframe, date, null);
    }

    public boolean canAdd(Section section, Timeframe timeframe, LocalDate date, String excludingCommitmentId) {
        OptionalInt max = capacityPolicy.maxFor(section, timeframe);
        return max.isEmpty() || taskCount(section, timeframe, date, excludingCommitmentId) < max.getAsInt();
    }

    /**
     * @throws CapacityExceededException if the bucket is full, not counting {@code excludingCommitmentId}
     */
    public void requireCapacity(Section section, Timeframe timeframe, LocalDate date, String excludingCommitmentId) {
        OptionalInt max = capacityPolicy.maxFor(section, timeframe);
        if (max.isEmpty()) {
            return;
        }
        int count = taskCount(section, timeframe, date, excludingCommitmentId);
        if (count >= max.getAsInt()) {
            log.warn("{} section full for {} {} ({} of {})", section, timeframe, date, count, max.getAsInt());
            throw new CapacityExceededException(section, timeframe, max.getAsInt(), count);
        }
    }

    public int nextSortOrder(Section section, Timeframe timeframe, LocalDate date) {
        return bucket(section, timeframe, date).stream()
                .mapToInt(Commitment::getSortOrder)
                .max()
                .orElse(-1) + 1;
    }

    // --- Mutations ---

    public Commitment create(Task task, Timeframe timeframe, Section section, LocalDate date) {
        return create(task.getId(), timeframe, section, date, null);
    }

    /**
     * Binds a task to the period containing {@code date}, appended after the bucket's last sort order.
     *
     * @throws CapacityExceededException if the destination bucket is full
     */
    public Commitment create(String taskId, Timeframe timeframe, Section section, LocalDate date,
                             String parentCommitmentId) {
        return insert(taskId, timeframe, section, date, Commitment.builder().parentCommitmentId(parentCommitmentId));
    }

    /**
     * Commits a task to the day of {@code scheduledTime}, already placed on that day's timeline.
     *
     * @throws CapacityExceededException if the day's bucket is full
     */
    public Commitment createTimed(String taskId, Section section, LocalDateTime scheduledTime, int durationMinutes) {
        return insert(taskId, Timeframe.DAILY, section, scheduledTime.toLocalDate(),
                Commitment.builder().scheduledTime(scheduledTime).durationMinutes(durationMinutes));
    }

    private Commitment insert(String taskId, Timeframe timeframe, Section section, LocalDate date,
                              Commitment.CommitmentBuilder draft) {
        String userId = currentUser.requireUserId();
        requireCapacity(section, timeframe, date, null);

        Commitment commitment = draft
                .ownerId(userId)
                .taskId(taskId)
                .timeframe(timeframe)
                .section(section)
                .periodAnchorDate(periodCalculator.periodStart(timeframe, date))
                .sortOrder(nextSortOrder(section, timeframe, date))
                .build();
        Commitment created = commitmentStore.create(commitment);
        commitments.put(created.getId(), created);
        log.info("Committed Task ID: {} to {} {} starting {} (commitment {})",
                taskId, section, timeframe, created.getPeriodAnchorDate(), created.getId());
        return created;
    }

    /**
     * Writes a commitment to the store and mirrors the stored version.
     */
    public Commitment save(Commitment commitment) {
        Commitment saved = commitmentStore.update(commitment);
        commitments.put(saved.getId(), saved);
        return saved;
    }

    public void delete(String commitmentId) {
        log.warn("Deleting commitment with ID: {}", commitmentId);
        commitmentStore.delete(commitmentId);
        commitments.remove(commitmentId);
    }

    /**
     * Deletes a commitment and, depth first, every commitment whose parent chain leads to it.
     * Children go before their parent; the first store failure stops the walk.
     *
     * @return ids of the deleted commitments in deletion order
     */
    public List<String> deleteWithDescendants(String commitmentId) {
        List<String> deleted = new ArrayList<>();
        deleteRecursively(commitmentId, deleted);
        log.info("Deleted commitment {} with {} descendants", commitmentId, deleted.size() - 1);
        return deleted;
    }

    private void deleteRecursively(String commitmentId, List<String> deleted) {
        for (Commitment child : childrenOf(commitmentId)) {
            deleteRecursively(child.getId(), deleted);
        }
        delete(commitmentId);
        deleted.add(commitmentId);
    }

    /**
     * Rule counting a subtask toward its parent's completion while the parent is viewed at
     * {@code viewedTimeframe}: uncommitted subtasks count, committed ones only at the parent commitment's timeframe.
     */
    public AutoCompleteRule autoCompleteRule(String parentTaskId, Timeframe viewedTimeframe) {
        Timeframe parentTimeframe = owned()
                .filter(c -> parentTaskId.equals(c.getTaskId()) && c.getTimeframe() == viewedTimeframe)
                .findFirst()
                .map(Commitment::getTimeframe)
                .orElse(null);

        return subtask -> {
            List<Commitment> own = findForTask(subtask.getId());
            if (own.isEmpty()) {
                return true;
            }
            return parentTimeframe != null && own.stream().anyMatch(c -> c.getTimeframe() == parentTimeframe);
        };
    }

    private Stream<Commitment> owned() {
        String userId = currentUser.currentUserId().orElse(null);
        return commitments.values().stream().filter(c -> Objects.equals(userId, c.getOwnerId()));
    }

    private boolean isOwned(Commitment commitment) {
        return Objects.equals(currentUser.currentUserId().orElse(null), commitment.getOwnerId());
    }
}
