package com.ietfdata.client.query;

import com.ietfdata.model.Document;
import com.ietfdata.model.uri.GroupUri;

import java.time.Instant;

/** Filters over {@code /api/v1/doc/document/}. */
public record DocumentFilter(QueryParameters parameters) implements QueryFilter<Document> {

    public DocumentFilter {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    public static DocumentFilter all() {
        return new DocumentFilter(QueryParameters.empty());
    }

    /** The document with this draft or RFC name. */
    public static DocumentFilter withName(String name) {
        return new DocumentFilter(QueryParameters.empty().with("name", name));
    }

    public static DocumentFilter withTitleContaining(String fragment) {
        return new DocumentFilter(QueryParameters.empty().with("title__contains", fragment));
    }

    /** Documents owned by a group. */
    public static DocumentFilter inGroup(GroupUri group) {
        return new DocumentFilter(QueryParameters.empty().with("group", group));
    }

    public DocumentFilter since(Instant instant) {
        return new DocumentFilter(parameters.with("time__gte", instant));
    }

    public DocumentFilter until(Instant instant) {
        return new DocumentFilter(parameters.with("time__lt", instant));
    }

    @Override
    public ResourceType<Document> resourceType() {
        return ResourceType.DOCUMENT;
    }
}
