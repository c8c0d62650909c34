package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.PersonAlias;

/** Reference to an alternative name recorded for a person. */
public record PersonAliasUri(String path) implements DatatrackerUri<PersonAlias>, Comparable<PersonAliasUri> {

    public PersonAliasUri {
        path = ResourceKind.PERSON_ALIAS.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PersonAliasUri parse(String value) {
        return new PersonAliasUri(value);
    }

    public static PersonAliasUri of(long id) {
        return new PersonAliasUri(ResourceKind.PERSON_ALIAS.pathFor(Long.toString(id)));
    }

    public long id() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.PERSON_ALIAS;
    }

    @Override
    public Class<PersonAlias> entityType() {
        return PersonAlias.class;
    }

    @Override
    public int compareTo(PersonAliasUri other) {
        return Long.compare(id(), other.id());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
