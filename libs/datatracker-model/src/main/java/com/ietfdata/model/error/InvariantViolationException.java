package com.ietfdata.model.error;

/** A locally checked invariant does not hold, e.g. a history with two open-ended snapshots. */
public final class InvariantViolationException extends DatatrackerException {

    public InvariantViolationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVARIANT_VIOLATION;
    }
}
