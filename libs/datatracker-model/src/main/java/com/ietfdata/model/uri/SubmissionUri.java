package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.Submission;

/** Reference to a draft submission. */
public record SubmissionUri(String path) implements DatatrackerUri<Submission>, Comparable<SubmissionUri> {

    public SubmissionUri {
        path = ResourceKind.SUBMISSION.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SubmissionUri parse(String value) {
        return new SubmissionUri(value);
    }

    public static SubmissionUri of(long id) {
        return new SubmissionUri(ResourceKind.SUBMISSION.pathFor(Long.toString(id)));
    }

    public long id() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.SUBMISSION;
    }

    @Override
    public Class<Submission> entityType() {
        return Submission.class;
    }

    @Override
    public int compareTo(SubmissionUri other) {
        return Long.compare(id(), other.id());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
