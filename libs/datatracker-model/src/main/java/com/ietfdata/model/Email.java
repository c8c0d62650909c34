package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;

/** A mapping from an email address to the person using it. */
public record Email(
        @JsonProperty("resource_uri") EmailUri resourceUri,
        String address,
        PersonUri person,
        Instant time,
        String origin,
        boolean primary,
        boolean active)
        implements DatatrackerEntity<EmailUri> {

    public Email {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(address, "address");
        Fields.require(time, "time");
    }

    @Override
    public EmailUri deriveUri() {
        return EmailUri.of(address);
    }
}
