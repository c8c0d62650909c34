package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.HistoricalEmailUri;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;

/** The state of an email address record as of one change, including which person it belonged to. */
public record HistoricalEmail(
        @JsonProperty("resource_uri") HistoricalEmailUri resourceUri,
        String address,
        PersonUri person,
        Instant time,
        String origin,
        boolean primary,
        boolean active,
        @JsonProperty("history_change_reason") String historyChangeReason,
        @JsonProperty("history_user") String historyUser,
        @JsonProperty("history_id") long historyId,
        @JsonProperty("history_type") HistoryType historyType,
        @JsonProperty("history_date") Instant historyDate)
        implements DatatrackerEntity<HistoricalEmailUri>, HistoricalRecord<EmailUri> {

    public HistoricalEmail {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(address, "address");
        Fields.require(time, "time");
        Fields.require(historyType, "history_type");
        Fields.require(historyDate, "history_date");
    }

    @Override
    public HistoricalEmailUri deriveUri() {
        return HistoricalEmailUri.of(historyId);
    }

    @Override
    public EmailUri identity() {
        return EmailUri.of(address);
    }

    /** This state as a plain {@link Email}. */
    public Email asEmail() {
        return new Email(identity(), address, person, time, origin, primary, active);
    }
}
