package com.ietfdata.model.error;

import java.util.OptionalInt;

/**
 * Transport-level failure: the request timed out, the connection failed, or the service answered
 * with a status other than success or "not found". Always retryable.
 */
public final class FetchException extends DatatrackerException {

    private final String path;
    private final int statusCode;
    private final boolean timeout;

    private FetchException(String message, String path, int statusCode, boolean timeout, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.statusCode = statusCode;
        this.timeout = timeout;
    }

    /** The request to {@code path} did not complete within the configured timeout. */
    public static FetchException timeout(String path, Throwable cause) {
        return new FetchException("Timed out fetching " + path, path, -1, true, cause);
    }

    /** The request to {@code path} failed below HTTP, e.g. connection refused or reset. */
    public static FetchException io(String path, Throwable cause) {
        return new FetchException(
                "I/O failure fetching %s: %s".formatted(path, cause.getMessage()), path, -1, false, cause);
    }

    /** The service answered {@code path} with an unexpected HTTP status. */
    public static FetchException status(String path, int statusCode) {
        return new FetchException(
                "Unexpected HTTP status %d fetching %s".formatted(statusCode, path), path, statusCode, false, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FETCH;
    }

    /** The relative path that was being fetched. */
    public String path() {
        return path;
    }

    /** The HTTP status, when the failure was a status response. */
    public OptionalInt statusCode() {
        return statusCode < 0 ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
