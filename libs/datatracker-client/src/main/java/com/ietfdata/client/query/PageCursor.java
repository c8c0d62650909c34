package com.ietfdata.client.query;

import com.ietfdata.client.transport.Transport;
import com.ietfdata.model.DatatrackerJson;
import com.ietfdata.model.Page;
import com.ietfdata.model.error.DecodeException;
import com.ietfdata.model.error.PaginationLoopException;
import com.ietfdata.observability.CorrelationContext;
import com.ietfdata.observability.CorrelationContextHolder;
import com.ietfdata.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * One lazy traversal of a paginated list.
 *
 * <p>A page is fetched only when the buffer is empty and more elements are demanded. A fetch or
 * decode failure escapes from {@link #hasNext()} or {@link #next()} after every element of earlier
 * pages has been returned; from then on the cursor is exhausted. Revisiting a page path or fetching
 * more than {@code maxPages} pages fails with {@link PaginationLoopException}.
 */
final class PageCursor<T> implements Iterator<T> {

    private static final Logger log = LoggerFactory.getLogger(PageCursor.class);
    private static final SensitiveDataRedactor REDACTOR = new SensitiveDataRedactor();

    private final Transport transport;
    private final Class<T> elementType;
    private final int maxPages;
    private final Counter pagesCounter;
    private final CorrelationContext context;

    private final Deque<T> buffer = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();
    private String nextPath;
    private int pagesFetched;
    private int elementsReturned;

    PageCursor(Transport transport, Class<T> elementType, String initialPath, int maxPages,
               Counter pagesCounter, CorrelationContext context) {
        this.transport = transport;
        this.elementType = elementType;
        this.nextPath = initialPath;
        this.maxPages = maxPages;
        this.pagesCounter = pagesCounter;
        this.context = context;
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && nextPath != null) {
            fetchNextPage();
        }
        return !buffer.isEmpty();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        elementsReturned++;
        return buffer.removeFirst();
    }

    int pagesFetched() {
        return pagesFetched;
    }

    private void fetchNextPage() {
        String path = nextPath;
        nextPath = null;

        if (!visited.add(path)) {
            log.warn("Pagination loop: {} was already fetched ({} pages so far)", REDACTOR.redactUrl(path), pagesFetched);
            throw PaginationLoopException.revisited(path, pagesFetched);
        }
        if (pagesFetched >= maxPages) {
            log.warn("Pagination stopped after {} pages at {}", maxPages, REDACTOR.redactUrl(path));
            throw PaginationLoopException.tooManyPages(path, maxPages);
        }

        Page<T> page = CorrelationContextHolder.callWithContext(context, () -> {
            log.debug("Fetching page {} of {}: {}", pagesFetched + 1, elementType.getSimpleName(),
                    REDACTOR.redactUrl(path));
            return DatatrackerJson.decodePage(transport.fetch(path), elementType, path);
        });
        pagesFetched++;
        pagesCounter.increment();

        String next = page.nextPage().map(link -> toRelativePath(link, path)).orElse(null);
        buffer.addAll(page.objects());
        nextPath = next;

        if (next == null) {
            log.debug("Reached last page after {} pages, {} elements", pagesFetched,
                    elementsReturned + buffer.size());
        }
    }

    /**
     * Reduces a {@code next} link to a path plus query. The service sends paths, but absolute URLs
     * are accepted too.
     */
    static String toRelativePath(String link, String source) {
        if (link.startsWith("/")) {
            return link;
        }
        if (link.startsWith("http://") || link.startsWith("https://")) {
            URI uri = URI.create(link);
            String query = uri.getRawQuery();
            return query == null ? uri.getRawPath() : uri.getRawPath() + "?" + query;
        }
        throw new DecodeException(source, Page.class,
                new IllegalArgumentException("unsupported next link '" + link + "'"));
    }
}
