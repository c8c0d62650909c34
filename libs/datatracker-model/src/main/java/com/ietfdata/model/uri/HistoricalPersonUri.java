package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.HistoricalPerson;

/** Reference to one history record of a person, keyed by history id. */
public record HistoricalPersonUri(String path) implements DatatrackerUri<HistoricalPerson>, Comparable<HistoricalPersonUri> {

    public HistoricalPersonUri {
        path = ResourceKind.HISTORICAL_PERSON.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static HistoricalPersonUri parse(String value) {
        return new HistoricalPersonUri(value);
    }

    public static HistoricalPersonUri of(long historyId) {
        return new HistoricalPersonUri(ResourceKind.HISTORICAL_PERSON.pathFor(Long.toString(historyId)));
    }

    public long historyId() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.HISTORICAL_PERSON;
    }

    @Override
    public Class<HistoricalPerson> entityType() {
        return HistoricalPerson.class;
    }

    @Override
    public int compareTo(HistoricalPersonUri other) {
        return Long.compare(historyId(), other.historyId());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
