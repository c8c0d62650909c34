package com.ietfdata.client.query;

import com.ietfdata.model.DatatrackerEntity;

record CollectionFilter<E extends DatatrackerEntity<?>>(ResourceType<E> resourceType, QueryParameters parameters)
        implements QueryFilter<E> {

    CollectionFilter {
        if (resourceType == null) {
            throw new IllegalArgumentException("resourceType must not be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }
}
