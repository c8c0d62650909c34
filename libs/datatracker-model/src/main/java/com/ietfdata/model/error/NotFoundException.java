package com.ietfdata.model.error;

/**
 * The requested record does not exist: the service answered "not found", a filtered lookup matched
 * nothing, or a history timeline holds no snapshot for the requested instant.
 */
public final class NotFoundException extends DatatrackerException {

    private final String target;

    public NotFoundException(String target) {
        super("Not found: " + target);
        this.target = target;
    }

    public NotFoundException(String target, String detail) {
        super("Not found: %s (%s)".formatted(target, detail));
        this.target = target;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }

    /** Path, query or identity that was looked up. */
    public String target() {
        return target;
    }
}
