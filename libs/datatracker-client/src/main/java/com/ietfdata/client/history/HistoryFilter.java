package com.ietfdata.client.history;

import com.ietfdata.client.query.QueryFilter;
import com.ietfdata.client.query.QueryParameters;
import com.ietfdata.client.query.ResourceType;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.HistoricalRecord;
import com.ietfdata.model.uri.DatatrackerUri;

import java.time.Instant;

/** Filters over a history record collection. */
public record HistoryFilter<R extends DatatrackerEntity<?>>(ResourceType<R> resourceType, QueryParameters parameters)
        implements QueryFilter<R> {

    public HistoryFilter {
        if (resourceType == null) {
            throw new IllegalArgumentException("resourceType must not be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    /** Every history record of the kind. */
    public static <I extends DatatrackerUri<?>, R extends DatatrackerEntity<?> & HistoricalRecord<I>>
            HistoryFilter<R> of(HistoryKind<I, ?, R> kind) {
        return new HistoryFilter<>(kind.records(), QueryParameters.empty());
    }

    /** The history records of one identity. */
    public static <I extends DatatrackerUri<?>, R extends DatatrackerEntity<?> & HistoricalRecord<I>>
            HistoryFilter<R> forIdentity(HistoryKind<I, ?, R> kind, I identity) {
        return new HistoryFilter<>(kind.records(),
                QueryParameters.empty().with(kind.identityParameter(), identity));
    }

    /** Records dated at or after {@code instant}. */
    public HistoryFilter<R> changedSince(Instant instant) {
        return new HistoryFilter<>(resourceType, parameters.with("history_date__gte", instant));
    }

    /** Records dated at or before {@code instant}. */
    public HistoryFilter<R> changedBefore(Instant instant) {
        return new HistoryFilter<>(resourceType, parameters.with("history_date__lte", instant));
    }
}
