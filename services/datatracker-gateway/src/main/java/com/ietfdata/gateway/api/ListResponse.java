package com.ietfdata.gateway.api;

import com.ietfdata.client.query.PagedQuery;
import java.util.List;

/**
 * A bounded slice of a list walk.
 *
 * @param items     the first elements in service order
 * @param count     number of elements in {@code items}
 * @param truncated whether the walk had more elements than were returned
 */
public record ListResponse<T>(List<T> items, int count, boolean truncated) {

    /** Pulls at most {@code max} elements; fetching stops once one more than that is seen. */
    static <T> ListResponse<T> take(PagedQuery<T> query, int max) {
        List<T> items = query.stream().limit(max + 1L).toList();
        if (items.size() > max) {
            return new ListResponse<>(items.subList(0, max), max, true);
        }
        return new ListResponse<>(items, items.size(), false);
    }
}
