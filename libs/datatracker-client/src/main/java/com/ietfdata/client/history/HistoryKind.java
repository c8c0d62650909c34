package com.ietfdata.client.history;

import com.ietfdata.client.query.ResourceType;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.Email;
import com.ietfdata.model.HistoricalEmail;
import com.ietfdata.model.HistoricalPerson;
import com.ietfdata.model.HistoricalRecord;
import com.ietfdata.model.Person;
import com.ietfdata.model.uri.DatatrackerUri;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.PersonUri;

import java.util.function.Function;

/**
 * An entity kind whose past states the service keeps as history records.
 *
 * @param <I> URI type of the stable identity
 * @param <S> entity type of one state
 * @param <R> history record type
 */
public final class HistoryKind<I extends DatatrackerUri<?>, S, R extends DatatrackerEntity<?> & HistoricalRecord<I>> {

    public static final HistoryKind<PersonUri, Person, HistoricalPerson> PERSON =
            new HistoryKind<>("person", ResourceType.HISTORICAL_PERSON, "id", HistoricalPerson::asPerson);

    public static final HistoryKind<EmailUri, Email, HistoricalEmail> EMAIL =
            new HistoryKind<>("email", ResourceType.HISTORICAL_EMAIL, "address", HistoricalEmail::asEmail);

    private final String name;
    private final ResourceType<R> records;
    private final String identityParameter;
    private final Function<R, S> stateOf;

    private HistoryKind(String name, ResourceType<R> records, String identityParameter, Function<R, S> stateOf) {
        this.name = name;
        this.records = records;
        this.identityParameter = identityParameter;
        this.stateOf = stateOf;
    }

    /** The collection holding the history records. */
    public ResourceType<R> records() {
        return records;
    }

    /** The list filter that selects the records of one identity. */
    public String identityParameter() {
        return identityParameter;
    }

    /** Extracts the entity state a history record describes. */
    public S stateOf(R record) {
        return stateOf.apply(record);
    }

    @Override
    public String toString() {
        return name;
    }
}
