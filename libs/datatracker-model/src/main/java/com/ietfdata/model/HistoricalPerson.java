package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.HistoricalPersonUri;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;

/**
 * The state of a person as of one change. {@code id} is the person's stable id; the record itself
 * is addressed by {@code history_id}.
 */
public record HistoricalPerson(
        long id,
        @JsonProperty("resource_uri") HistoricalPersonUri resourceUri,
        String name,
        @JsonProperty("name_from_draft") String nameFromDraft,
        String biography,
        String ascii,
        @JsonProperty("ascii_short") String asciiShort,
        Instant time,
        String photo,
        @JsonProperty("photo_thumb") String photoThumb,
        String user,
        Boolean consent,
        @JsonProperty("history_change_reason") String historyChangeReason,
        @JsonProperty("history_user") String historyUser,
        @JsonProperty("history_type") HistoryType historyType,
        @JsonProperty("history_id") long historyId,
        @JsonProperty("history_date") Instant historyDate)
        implements DatatrackerEntity<HistoricalPersonUri>, HistoricalRecord<PersonUri> {

    public HistoricalPerson {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(name, "name");
        Fields.require(time, "time");
        Fields.require(historyType, "history_type");
        Fields.require(historyDate, "history_date");
    }

    @Override
    public HistoricalPersonUri deriveUri() {
        return HistoricalPersonUri.of(historyId);
    }

    @Override
    public PersonUri identity() {
        return PersonUri.of(id);
    }

    /** This state as a plain {@link Person}. */
    public Person asPerson() {
        return new Person(id, identity(), name, nameFromDraft, biography, ascii, asciiShort,
                time, photo, photoThumb, user, consent);
    }
}
