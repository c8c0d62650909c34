package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.DocState;

/** Reference to a document state, e.g. {@code /api/v1/doc/state/1/}. */
public record DocStateUri(String path) implements DatatrackerUri<DocState>, Comparable<DocStateUri> {

    public DocStateUri {
        path = ResourceKind.DOC_STATE.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DocStateUri parse(String value) {
        return new DocStateUri(value);
    }

    public static DocStateUri of(long id) {
        return new DocStateUri(ResourceKind.DOC_STATE.pathFor(Long.toString(id)));
    }

    public long id() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DOC_STATE;
    }

    @Override
    public Class<DocState> entityType() {
        return DocState.class;
    }

    @Override
    public int compareTo(DocStateUri other) {
        return Long.compare(id(), other.id());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
