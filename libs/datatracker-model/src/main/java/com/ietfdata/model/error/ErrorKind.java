package com.ietfdata.model.error;

/**
 * Closed set of failure kinds surfaced by every Datatracker client operation.
 *
 * <p>Callers switch on the kind to decide how to react: retry a {@link #FETCH}, treat {@link
 * #NOT_FOUND} as an empty result, report the rest upward as client/service schema bugs.
 */
public enum ErrorKind {

    /** An identifier string does not match the pattern of its resource kind. */
    VALIDATION(false),

    /** Transport failure: timeout, connection error, unexpected HTTP status. */
    FETCH(true),

    /** The service confirmed the requested record does not exist. */
    NOT_FOUND(false),

    /** The returned document does not match the expected schema. */
    DECODE(false),

    /** A locally checked invariant does not hold, e.g. two current snapshots. */
    INVARIANT_VIOLATION(false),

    /** A pagination chain revisited a page or exceeded the configured page bound. */
    PAGINATION_LOOP(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /** Whether repeating the same call may succeed. */
    public boolean isRetryable() {
        return retryable;
    }
}
