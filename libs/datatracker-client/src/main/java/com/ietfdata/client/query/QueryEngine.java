package com.ietfdata.client.query;

import com.ietfdata.client.ClientSettings;
import com.ietfdata.client.transport.Transport;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;

/**
 * Turns {@link QueryFilter}s into lazy {@link PagedQuery} walks over a {@link Transport}.
 */
public final class QueryEngine {

    static final String METRIC_PAGES = "datatracker.pages";

    private final Transport transport;
    private final int pageSize;
    private final int maxPages;
    private final MetricFactory metrics;

    public QueryEngine(Transport transport, ClientSettings settings, MetricFactory metrics) {
        if (transport == null || settings == null || metrics == null) {
            throw new IllegalArgumentException("transport, settings and metrics must not be null");
        }
        this.transport = transport;
        this.pageSize = settings.pageSize();
        this.maxPages = settings.maxPages();
        this.metrics = metrics;
    }

    /** Prepares a walk over every element matching {@code filter}, using the configured page size. */
    public <E extends DatatrackerEntity<?>> PagedQuery<E> query(QueryFilter<E> filter) {
        return query(filter, pageSize);
    }

    /**
     * Prepares a walk with an explicit page size. The {@code limit} only affects the first request;
     * continuation links carry their own.
     */
    public <E extends DatatrackerEntity<?>> PagedQuery<E> query(QueryFilter<E> filter, int limit) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        ResourceType<E> type = filter.resourceType();
        Counter pages = metrics.counter(METRIC_PAGES, "List pages fetched", "kind", type.kind().name());
        return new PagedQuery<>(transport, type.entityType(), initialPath(filter, limit), maxPages, pages,
                type.kind().name());
    }

    static String initialPath(QueryFilter<?> filter, int limit) {
        QueryParameters parameters = filter.parameters();
        if (!parameters.contains("limit")) {
            parameters = parameters.with("limit", limit);
        }
        return filter.resourceType().collectionPath() + "?" + parameters.toQueryString();
    }
}
