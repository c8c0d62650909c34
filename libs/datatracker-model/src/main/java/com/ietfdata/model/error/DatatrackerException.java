package com.ietfdata.model.error;

/**
 * Base of the Datatracker client error taxonomy.
 *
 * <p>The hierarchy is sealed: every failure a client operation can report is one of the permitted
 * subclasses, each carrying a distinct {@link ErrorKind}. Unchecked so failures can cross lazy
 * {@link java.util.Iterator} and {@link java.util.stream.Stream} boundaries.
 */
public abstract sealed class DatatrackerException extends RuntimeException
        permits UriValidationException,
                FetchException,
                NotFoundException,
                DecodeException,
                InvariantViolationException,
                PaginationLoopException {

    protected DatatrackerException(String message) {
        super(message);
    }

    protected DatatrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The failure kind, for callers that discriminate without {@code instanceof}. */
    public abstract ErrorKind kind();

    /** Shorthand for {@code kind().isRetryable()}. */
    public boolean isRetryable() {
        return kind().isRetryable();
    }
}
