package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.GroupStateUri;

public record GroupState(
        @JsonProperty("resource_uri") GroupStateUri resourceUri,
        String desc,
        String name,
        String slug,
        boolean used,
        long order)
        implements DatatrackerEntity<GroupStateUri> {

    public GroupState {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(slug, "slug");
    }

    @Override
    public GroupStateUri deriveUri() {
        return GroupStateUri.of(slug);
    }
}
