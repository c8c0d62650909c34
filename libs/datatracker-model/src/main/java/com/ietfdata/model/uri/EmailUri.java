package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.Email;

/**
 * Reference to an email address record. Email records are keyed by the address itself, e.g.
 * {@code /api/v1/person/email/csp@csperkins.org/}; the address is kept exactly as given.
 */
public record EmailUri(String path) implements DatatrackerUri<Email>, Comparable<EmailUri> {

    public EmailUri {
        path = ResourceKind.EMAIL.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EmailUri parse(String value) {
        return new EmailUri(value);
    }

    public static EmailUri of(String address) {
        return new EmailUri(ResourceKind.EMAIL.pathFor(address));
    }

    public String address() {
        return identifier();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.EMAIL;
    }

    @Override
    public Class<Email> entityType() {
        return Email.class;
    }

    @Override
    public int compareTo(EmailUri other) {
        return path.compareTo(other.path);
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
