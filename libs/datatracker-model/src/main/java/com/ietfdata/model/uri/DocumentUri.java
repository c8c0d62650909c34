package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.Document;

/** Reference to a document by name, e.g. {@code /api/v1/doc/document/draft-ietf-avt-rtp-new/}. */
public record DocumentUri(String path) implements DatatrackerUri<Document>, Comparable<DocumentUri> {

    public DocumentUri {
        path = ResourceKind.DOCUMENT.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DocumentUri parse(String value) {
        return new DocumentUri(value);
    }

    public static DocumentUri of(String name) {
        return new DocumentUri(ResourceKind.DOCUMENT.pathFor(name));
    }

    public String name() {
        return identifier();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.DOCUMENT;
    }

    @Override
    public Class<Document> entityType() {
        return Document.class;
    }

    @Override
    public int compareTo(DocumentUri other) {
        return path.compareTo(other.path);
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
