package com.ietfdata.client.history;

import com.ietfdata.model.uri.DatatrackerUri;

import java.time.Instant;
import java.util.Optional;

/**
 * The state of an entity over the half-open interval {@code [validFrom, validUntil)}.
 *
 * @param identity     the stable identity the state belongs to
 * @param state        the entity as it was during the interval
 * @param validFrom    start of the interval, inclusive
 * @param validUntil   end of the interval, exclusive; null while the state is still current
 * @param changeReason reason recorded with the change that produced this state (nullable)
 */
public record Snapshot<I extends DatatrackerUri<?>, S>(
        I identity,
        S state,
        Instant validFrom,
        Instant validUntil,
        String changeReason
) {

    public Snapshot {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        if (validFrom == null) {
            throw new IllegalArgumentException("validFrom must not be null");
        }
        if (validUntil != null && validUntil.isBefore(validFrom)) {
            throw new IllegalArgumentException("validUntil " + validUntil + " is before validFrom " + validFrom);
        }
    }

    public static <I extends DatatrackerUri<?>, S> Snapshot<I, S> of(I identity, S state, Instant validFrom,
                                                                     Instant validUntil) {
        return new Snapshot<>(identity, state, validFrom, validUntil, null);
    }

    /** True if no later state has replaced this one. */
    public boolean isOpen() {
        return validUntil == null;
    }

    public Optional<Instant> end() {
        return Optional.ofNullable(validUntil);
    }

    /** True if {@code instant} falls inside {@code [validFrom, validUntil)}. */
    public boolean contains(Instant instant) {
        return !instant.isBefore(validFrom) && (validUntil == null || instant.isBefore(validUntil));
    }

    /** True if this snapshot was valid at some instant of the closed window {@code [from, to]}. */
    public boolean overlaps(Instant from, Instant to) {
        return !validFrom.isAfter(to) && (validUntil == null || validUntil.isAfter(from));
    }

    /** True if the two intervals share at least one instant. */
    public boolean overlaps(Snapshot<?, ?> other) {
        boolean thisEndsFirst = validUntil != null && !validUntil.isAfter(other.validFrom);
        boolean otherEndsFirst = other.validUntil != null && !other.validUntil.isAfter(validFrom);
        return !thisEndsFirst && !otherEndsFirst;
    }
}
