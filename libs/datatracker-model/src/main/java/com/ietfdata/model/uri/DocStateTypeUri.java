package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.DocStateType;

/** Reference to a document state type, e.g. {@code /api/v1/doc/statetype/draft-iesg/}. */
public record DocStateTypeUri(String path) implements DatatrackerUri<DocStateType>, Comparable<DocStateTypeUri> {

    public DocStateTypeUri {
        path = ResourceKind.DOC_STATE_TYPE.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DocStateTypeUri parse(String value) {
        return new DocStateTypeUri(value);
    }

    public static DocStateTypeUri of(String slug) {
        return new DocStateTypeUri(ResourceKind.DOC_STATE_TYPE.pathFor(slug));
    }

    public String slug() {
        return identifier();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DOC_STATE_TYPE;
    }

    @Override
    public Class<DocStateType> entityType() {
        return DocStateType.class;
    }

    @Override
    public int compareTo(DocStateTypeUri other) {
        return path.compareTo(other.path);
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
