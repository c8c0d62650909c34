package com.ietfdata.client.history;

import com.ietfdata.model.HistoricalRecord;
import com.ietfdata.model.HistoryType;
import com.ietfdata.model.error.InvariantViolationException;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.model.uri.DatatrackerUri;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The ordered sequence of states one entity has gone through.
 *
 * <p>Snapshots are ordered by {@code validFrom}. Built from history records, consecutive states are
 * contiguous: each one ends where the next begins, and a deletion ends the state before it
 * without starting a new one.
 *
 * @param <I> URI type of the identity
 * @param <S> entity type of one state
 */
public final class Timeline<I extends DatatrackerUri<?>, S> {

    private static final Comparator<HistoricalRecord<?>> RECORD_ORDER =
            Comparator.<HistoricalRecord<?>, Instant>comparing(HistoricalRecord::historyDate)
                    .thenComparingLong(HistoricalRecord::historyId);

    private final I identity;
    private final List<Snapshot<I, S>> snapshots;
    private final Instant deletedAt;

    private Timeline(I identity, List<Snapshot<I, S>> snapshots, Instant deletedAt) {
        this.identity = identity;
        this.snapshots = snapshots;
        this.deletedAt = deletedAt;
    }

    /**
     * Builds a timeline from explicit snapshots.
     *
     * @throws IllegalArgumentException if a snapshot belongs to another identity
     */
    public static <I extends DatatrackerUri<?>, S> Timeline<I, S> of(I identity, List<Snapshot<I, S>> snapshots) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        for (Snapshot<I, S> snapshot : snapshots) {
            if (!identity.equals(snapshot.identity())) {
                throw new IllegalArgumentException(
                        "snapshot of " + snapshot.identity() + " does not belong to " + identity);
            }
        }
        List<Snapshot<I, S>> sorted = new ArrayList<>(snapshots);
        sorted.sort(Comparator.comparing(Snapshot<I, S>::validFrom));
        return new Timeline<>(identity, List.copyOf(sorted), null);
    }

    /**
     * Builds a timeline from history records, in any order. Records are ordered by history date,
     * then by history id; each non-deletion record starts a state that lasts until the next record.
     *
     * @throws InvariantViolationException if a record belongs to another identity
     */
    public static <I extends DatatrackerUri<?>, S, R extends HistoricalRecord<I>> Timeline<I, S> fromRecords(
            I identity, Collection<R> records, Function<? super R, ? extends S> stateOf) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        List<R> sorted = new ArrayList<>(records);
        sorted.sort(RECORD_ORDER);

        List<Snapshot<I, S>> snapshots = new ArrayList<>();
        R pending = null;
        Instant deletedAt = null;
        for (R record : sorted) {
            if (!identity.equals(record.identity())) {
                throw new InvariantViolationException(
                        "history record " + record.historyId() + " of " + record.identity()
                                + " returned for " + identity);
            }
            if (pending != null) {
                snapshots.add(snapshot(identity, pending, record.historyDate(), stateOf));
                pending = null;
            }
            if (record.historyType() == HistoryType.DELETED) {
                deletedAt = record.historyDate();
            } else {
                pending = record;
                deletedAt = null;
            }
        }
        if (pending != null) {
            snapshots.add(snapshot(identity, pending, null, stateOf));
        }
        return new Timeline<>(identity, List.copyOf(snapshots), deletedAt);
    }

    private static <I extends DatatrackerUri<?>, S, R extends HistoricalRecord<I>> Snapshot<I, S> snapshot(
            I identity, R record, Instant validUntil, Function<? super R, ? extends S> stateOf) {
        return new Snapshot<>(identity, stateOf.apply(record), record.historyDate(), validUntil,
                record.historyChangeReason());
    }

    public I identity() {
        return identity;
    }

    /** All snapshots, earliest first. */
    public List<Snapshot<I, S>> history() {
        return snapshots;
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    /** True if the most recent history record is a deletion. */
    public boolean isDeleted() {
        return deletedAt != null;
    }

    public Optional<Instant> deletedAt() {
        return Optional.ofNullable(deletedAt);
    }

    /**
     * Returns the snapshot in effect at {@code instant}.
     *
     * @throws NotFoundException           if no snapshot covers the instant
     * @throws InvariantViolationException if more than one does
     */
    public Snapshot<I, S> at(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant must not be null");
        }
        List<Snapshot<I, S>> matches = snapshots.stream()
                .filter(snapshot -> snapshot.contains(instant))
                .toList();
        if (matches.isEmpty()) {
            throw new NotFoundException(identity.path(), "no state recorded at " + instant);
        }
        if (matches.size() > 1) {
            throw new InvariantViolationException(
                    "%d snapshots of %s contain %s".formatted(matches.size(), identity, instant));
        }
        return matches.get(0);
    }

    /**
     * Returns the state that is still in effect.
     *
     * @throws NotFoundException           if there is no history or the entity has been deleted
     * @throws InvariantViolationException if there is not exactly one open-ended snapshot
     */
    public Snapshot<I, S> current() {
        if (snapshots.isEmpty()) {
            throw new NotFoundException(identity.path(), "no history recorded");
        }
        if (deletedAt != null) {
            throw new NotFoundException(identity.path(), "deleted at " + deletedAt);
        }
        List<Snapshot<I, S>> open = snapshots.stream().filter(Snapshot::isOpen).toList();
        if (open.size() != 1) {
            throw new InvariantViolationException(
                    "%s has %d open-ended snapshots, expected exactly one".formatted(identity, open.size()));
        }
        return open.get(0);
    }

    /**
     * Checks that snapshots do not overlap and that at most one is open-ended, reporting every
     * problem at once.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            Snapshot<I, S> previous = snapshots.get(i - 1);
            Snapshot<I, S> next = snapshots.get(i);
            if (previous.overlaps(next)) {
                errors.add("snapshots starting " + previous.validFrom() + " and " + next.validFrom() + " overlap");
            }
        }
        long open = snapshots.stream().filter(Snapshot::isOpen).count();
        if (open > 1) {
            errors.add(open + " open-ended snapshots");
        }
        if (deletedAt != null && open > 0) {
            errors.add("deleted at " + deletedAt + " but still has an open-ended snapshot");
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    @Override
    public String toString() {
        return "Timeline[" + identity + ", " + snapshots.size() + " snapshots"
                + (deletedAt == null ? "" : ", deleted " + deletedAt) + "]";
    }
}
