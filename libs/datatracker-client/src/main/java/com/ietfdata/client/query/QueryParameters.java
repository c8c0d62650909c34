package com.ietfdata.client.query;

import com.ietfdata.model.DatatrackerTime;
import com.ietfdata.model.uri.DatatrackerUri;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable, ordered list of query parameters for a list endpoint.
 *
 * <p>Order is preserved so that the same filter always produces the same request path.
 */
public final class QueryParameters {

    private static final QueryParameters EMPTY = new QueryParameters(List.of());

    private final List<Map.Entry<String, String>> entries;

    private QueryParameters(List<Map.Entry<String, String>> entries) {
        this.entries = entries;
    }

    public static QueryParameters empty() {
        return EMPTY;
    }

    /**
     * Returns a copy with {@code name=value} appended.
     *
     * @throws IllegalArgumentException if the name is blank or the value is null
     */
    public QueryParameters with(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name must not be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value of parameter '" + name + "' must not be null");
        }
        List<Map.Entry<String, String>> copy = new ArrayList<>(entries);
        copy.add(Map.entry(name, value));
        return new QueryParameters(List.copyOf(copy));
    }

    /** Appends a timestamp in the service's zone-less UTC format. */
    public QueryParameters with(String name, Instant value) {
        if (value == null) {
            throw new IllegalArgumentException("value of parameter '" + name + "' must not be null");
        }
        return with(name, DatatrackerTime.format(value));
    }

    /** Appends a reference filter, which the service matches on the referenced record's identifier. */
    public QueryParameters with(String name, DatatrackerUri<?> value) {
        if (value == null) {
            throw new IllegalArgumentException("value of parameter '" + name + "' must not be null");
        }
        return with(name, value.identifier());
    }

    public QueryParameters with(String name, long value) {
        return with(name, Long.toString(value));
    }

    /** Returns the first value of a parameter. */
    public Optional<String> get(String name) {
        return entries.stream()
                .filter(entry -> entry.getKey().equals(name))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Map.Entry<String, String>> entries() {
        return entries;
    }

    /** URL-encodes the parameters as {@code a=1&b=2}, without a leading {@code ?}. */
    public String toQueryString() {
        return entries.stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof QueryParameters other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return toQueryString();
    }
}
