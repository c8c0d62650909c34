package com.ietfdata.model.error;

import com.ietfdata.model.uri.ResourceKind;

/** Thrown when a string cannot be parsed as a URI of the requested {@link ResourceKind}. */
public final class UriValidationException extends DatatrackerException {

    private final ResourceKind resourceKind;
    private final String value;

    public UriValidationException(ResourceKind resourceKind, String value) {
        super("Not a valid %s URI: '%s' (expected %s<id>/)"
                .formatted(resourceKind, value, resourceKind.collectionPath()));
        this.resourceKind = resourceKind;
        this.value = value;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }

    /** The kind the value was parsed as. */
    public ResourceKind resourceKind() {
        return resourceKind;
    }

    /** The rejected input, as supplied (may be null). */
    public String value() {
        return value;
    }
}
