package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.HistoricalEmail;

/** Reference to one history record of an email address, keyed by history id. */
public record HistoricalEmailUri(String path) implements DatatrackerUri<HistoricalEmail>, Comparable<HistoricalEmailUri> {

    public HistoricalEmailUri {
        path = ResourceKind.HISTORICAL_EMAIL.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static HistoricalEmailUri parse(String value) {
        return new HistoricalEmailUri(value);
    }

    public static HistoricalEmailUri of(long historyId) {
        return new HistoricalEmailUri(ResourceKind.HISTORICAL_EMAIL.pathFor(Long.toString(historyId)));
    }

    public long historyId() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.HISTORICAL_EMAIL;
    }

    @Override
    public Class<HistoricalEmail> entityType() {
        return HistoricalEmail.class;
    }

    @Override
    public int compareTo(HistoricalEmailUri other) {
        return Long.compare(historyId(), other.historyId());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
