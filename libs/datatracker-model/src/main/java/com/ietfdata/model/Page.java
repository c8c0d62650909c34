package com.ietfdata.model;

import java.util.List;
import java.util.Optional;

/**
 * One batch of a list response: the objects returned by a single fetch plus the link to the next
 * batch. A page with no objects and no next link is a valid terminal page.
 *
 * @param <T> the element type
 */
public record Page<T>(PageMeta meta, List<T> objects) {

    public Page {
        Fields.require(meta, "meta");
        objects = Fields.list(objects);
    }

    public Optional<String> nextPage() {
        return meta.nextPage();
    }

    public boolean hasNextPage() {
        return nextPage().isPresent();
    }
}
