package com.ietfdata.client.query;

import com.ietfdata.model.PersonAlias;
import com.ietfdata.model.uri.PersonUri;

/** Filters over {@code /api/v1/person/alias/}. */
public record AliasFilter(QueryParameters parameters) implements QueryFilter<PersonAlias> {

    public AliasFilter {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    public static AliasFilter all() {
        return new AliasFilter(QueryParameters.empty());
    }

    public static AliasFilter withName(String name) {
        return new AliasFilter(QueryParameters.empty().with("name", name));
    }

    public static AliasFilter forPerson(PersonUri person) {
        return new AliasFilter(QueryParameters.empty().with("person", person));
    }

    @Override
    public ResourceType<PersonAlias> resourceType() {
        return ResourceType.PERSON_ALIAS;
    }
}
