package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.PersonAliasUri;
import com.ietfdata.model.uri.PersonUri;

/** An alternative name under which a person is known, e.g. from draft author lists. */
public record PersonAlias(
        long id,
        @JsonProperty("resource_uri") PersonAliasUri resourceUri,
        PersonUri person,
        String name)
        implements DatatrackerEntity<PersonAliasUri> {

    public PersonAlias {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(person, "person");
        Fields.require(name, "name");
    }

    @Override
    public PersonAliasUri deriveUri() {
        return PersonAliasUri.of(id);
    }
}
