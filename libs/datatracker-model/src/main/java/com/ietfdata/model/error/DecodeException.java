package com.ietfdata.model.error;

/**
 * A document returned by the service does not match the expected schema. Indicates drift between
 * this client and the service; not locally recoverable.
 */
public final class DecodeException extends DatatrackerException {

    private final String source;
    private final Class<?> targetType;

    public DecodeException(String source, Class<?> targetType, Throwable cause) {
        super("Failed to decode %s from %s: %s"
                .formatted(targetType.getSimpleName(), source, cause.getMessage()), cause);
        this.source = source;
        this.targetType = targetType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DECODE;
    }

    /** Where the document came from, usually the fetched path. */
    public String source() {
        return source;
    }

    public Class<?> targetType() {
        return targetType;
    }
}
