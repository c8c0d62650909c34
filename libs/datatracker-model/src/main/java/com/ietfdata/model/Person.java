package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;

/** A person known to the Datatracker. */
public record Person(
        long id,
        @JsonProperty("resource_uri") PersonUri resourceUri,
        String name,
        @JsonProperty("name_from_draft") String nameFromDraft,
        String biography,
        String ascii,
        @JsonProperty("ascii_short") String asciiShort,
        Instant time,
        String photo,
        @JsonProperty("photo_thumb") String photoThumb,
        String user,
        Boolean consent)
        implements DatatrackerEntity<PersonUri> {

    public Person {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(name, "name");
        Fields.require(time, "time");
    }

    @Override
    public PersonUri deriveUri() {
        return PersonUri.of(id);
    }
}
