package com.ietfdata.client.query;

import com.ietfdata.model.Person;

import java.time.Instant;

/**
 * Filters over {@code /api/v1/person/person/}.
 *
 * <pre>{@code
 * PersonFilter.withNameContaining("Perkins").since(Instant.parse("2015-01-01T00:00:00Z"))
 * }</pre>
 */
public record PersonFilter(QueryParameters parameters) implements QueryFilter<Person> {

    public PersonFilter {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    public static PersonFilter all() {
        return new PersonFilter(QueryParameters.empty());
    }

    /** People whose name is exactly {@code name}. */
    public static PersonFilter withName(String name) {
        return all().and("name", name);
    }

    /** People whose name contains {@code fragment} (case-sensitive on the service side). */
    public static PersonFilter withNameContaining(String fragment) {
        return all().and("name__contains", fragment);
    }

    /** Restricts to records whose {@code time} is at or after {@code instant}. */
    public PersonFilter since(Instant instant) {
        return new PersonFilter(parameters.with("time__gte", instant));
    }

    /** Restricts to records whose {@code time} is before {@code instant}. */
    public PersonFilter until(Instant instant) {
        return new PersonFilter(parameters.with("time__lt", instant));
    }

    @Override
    public ResourceType<Person> resourceType() {
        return ResourceType.PERSON;
    }

    private PersonFilter and(String name, String value) {
        return new PersonFilter(parameters.with(name, value));
    }
}
