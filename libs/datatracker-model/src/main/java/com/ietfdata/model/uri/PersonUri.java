package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.Person;

/** Reference to a person, e.g. {@code /api/v1/person/person/20209/}. */
public record PersonUri(String path) implements DatatrackerUri<Person>, Comparable<PersonUri> {

    public PersonUri {
        path = ResourceKind.PERSON.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PersonUri parse(String value) {
        return new PersonUri(value);
    }

    public static PersonUri of(long id) {
        return new PersonUri(ResourceKind.PERSON.pathFor(Long.toString(id)));
    }

    public long id() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PERSON;
    }

    @Override
    public Class<Person> entityType() {
        return Person.class;
    }

    @Override
    public int compareTo(PersonUri other) {
        return Long.compare(id(), other.id());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
