package com.ietfdata.client.resolve;

import com.ietfdata.client.query.QueryEngine;
import com.ietfdata.client.query.QueryFilter;
import com.ietfdata.client.transport.Transport;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.DatatrackerJson;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.model.uri.DatatrackerUri;
import com.ietfdata.observability.CorrelationContext;
import com.ietfdata.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns typed URIs and lookup keys into entities.
 *
 * <p>Resolution by URI is a single fetch and a single decode into the entity class bound to the
 * URI's kind. Resolution by any other key goes through one list query and takes its first match.
 */
public final class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final Transport transport;
    private final QueryEngine queryEngine;

    public EntityResolver(Transport transport, QueryEngine queryEngine) {
        if (transport == null || queryEngine == null) {
            throw new IllegalArgumentException("transport and queryEngine must not be null");
        }
        this.transport = transport;
        this.queryEngine = queryEngine;
    }

    /**
     * Fetches and decodes the entity a URI refers to.
     *
     * @throws NotFoundException if the service has no such record
     * @throws com.ietfdata.model.error.FetchException  on transport failure
     * @throws com.ietfdata.model.error.DecodeException if the document does not match the entity schema
     */
    public <E extends DatatrackerEntity<?>> E resolve(DatatrackerUri<E> uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        return CorrelationContextHolder.callWithContext(context("resolve", uri.path()), () -> {
            log.debug("Resolving {}", uri.path());
            E entity = DatatrackerJson.decode(transport.fetch(uri.path()), uri.entityType(), uri.path());
            if (!uri.equals(entity.resourceUri())) {
                log.warn("Resolved {} but the document names itself {}", uri, entity.resourceUri());
            }
            return entity;
        });
    }

    /**
     * Returns the first entity matching {@code filter}.
     *
     * @throws NotFoundException if nothing matches
     */
    public <E extends DatatrackerEntity<?>> E resolveBy(QueryFilter<E> filter) {
        return findFirst(filter).orElseThrow(() -> new NotFoundException(filter.describe(), "no match"));
    }

    /**
     * Returns the first entity matching {@code filter}, or empty if nothing matches. Only the first
     * page is requested, with a page size of one.
     */
    public <E extends DatatrackerEntity<?>> Optional<E> findFirst(QueryFilter<E> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        return CorrelationContextHolder.callWithContext(context("lookup", filter.describe()),
                () -> queryEngine.query(filter, 1).first());
    }

    private static CorrelationContext context(String operation, String target) {
        return CorrelationContextHolder.get()
                .map(outer -> outer.withOperation(operation, target))
                .orElseGet(() -> CorrelationContext.forOperation(operation, target));
    }
}
