package com.ietfdata.client.query;

import com.ietfdata.model.DatatrackerEntity;

/**
 * Describes one list query: which collection to walk and which filter parameters to send.
 * The query engine is filter-agnostic; it only appends these parameters to the collection path.
 *
 * @param <E> entity type of the walked collection
 */
public interface QueryFilter<E extends DatatrackerEntity<?>> {

    ResourceType<E> resourceType();

    QueryParameters parameters();

    /** Walks a whole collection. */
    static <E extends DatatrackerEntity<?>> QueryFilter<E> all(ResourceType<E> resourceType) {
        return of(resourceType, QueryParameters.empty());
    }

    /** A filter with explicit raw parameters, for options no typed filter covers. */
    static <E extends DatatrackerEntity<?>> QueryFilter<E> of(ResourceType<E> resourceType, QueryParameters parameters) {
        return new CollectionFilter<>(resourceType, parameters);
    }

    /** Human-readable form used in logs and not-found messages, e.g. {@code /api/v1/group/group/?acronym=avt}. */
    default String describe() {
        String path = resourceType().collectionPath();
        return parameters().isEmpty() ? path : path + "?" + parameters().toQueryString();
    }
}
