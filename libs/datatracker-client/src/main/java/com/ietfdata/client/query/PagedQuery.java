package com.ietfdata.client.query;

import com.ietfdata.client.transport.Transport;
import com.ietfdata.observability.CorrelationContext;
import com.ietfdata.observability.CorrelationContextHolder;
import io.micrometer.core.instrument.Counter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A lazily evaluated, possibly multi-page list result.
 *
 * <p>Nothing is fetched until iteration starts. Every call to {@link #iterator()} or
 * {@link #stream()} begins a fresh traversal from the first page, so a failed walk can be retried
 * by iterating again. Elements come back in service order.
 *
 * @param <T> element type
 */
public final class PagedQuery<T> implements Iterable<T> {

    private final Transport transport;
    private final Class<T> elementType;
    private final String initialPath;
    private final int maxPages;
    private final Counter pagesCounter;
    private final String target;

    PagedQuery(Transport transport, Class<T> elementType, String initialPath, int maxPages,
               Counter pagesCounter, String target) {
        this.transport = transport;
        this.elementType = elementType;
        this.initialPath = initialPath;
        this.maxPages = maxPages;
        this.pagesCounter = pagesCounter;
        this.target = target;
    }

    /**
     * Starts a new traversal. Failures surface from the iterator's {@code hasNext()} or
     * {@code next()} as {@link com.ietfdata.model.error.DatatrackerException}s.
     */
    @Override
    public Iterator<T> iterator() {
        CorrelationContext context = CorrelationContextHolder.get()
                .map(outer -> outer.withOperation("list", target))
                .orElseGet(() -> CorrelationContext.forOperation("list", target));
        return new PageCursor<>(transport, elementType, initialPath, maxPages, pagesCounter, context);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /** Fetches only as many pages as needed to find the first element. */
    public Optional<T> first() {
        Iterator<T> cursor = iterator();
        return cursor.hasNext() ? Optional.of(cursor.next()) : Optional.empty();
    }

    /** Walks every page and collects all elements. */
    public List<T> toList() {
        List<T> result = new ArrayList<>();
        forEach(result::add);
        return result;
    }

    /** The path of the first page request, including {@code limit}. */
    public String initialPath() {
        return initialPath;
    }

    public Class<T> elementType() {
        return elementType;
    }
}
