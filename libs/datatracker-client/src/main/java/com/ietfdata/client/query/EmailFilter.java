package com.ietfdata.client.query;

import com.ietfdata.model.Email;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;

/** Filters over {@code /api/v1/person/email/}. */
public record EmailFilter(QueryParameters parameters) implements QueryFilter<Email> {

    public EmailFilter {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    public static EmailFilter all() {
        return new EmailFilter(QueryParameters.empty());
    }

    public static EmailFilter withAddress(String address) {
        return new EmailFilter(QueryParameters.empty().with("address", address));
    }

    /** Every address belonging to a person. */
    public static EmailFilter forPerson(PersonUri person) {
        return new EmailFilter(QueryParameters.empty().with("person", person));
    }

    public EmailFilter since(Instant instant) {
        return new EmailFilter(parameters.with("time__gte", instant));
    }

    public EmailFilter until(Instant instant) {
        return new EmailFilter(parameters.with("time__lt", instant));
    }

    @Override
    public ResourceType<Email> resourceType() {
        return ResourceType.EMAIL;
    }
}
