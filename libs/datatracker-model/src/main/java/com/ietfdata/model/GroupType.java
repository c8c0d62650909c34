package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.GroupTypeUri;

public record GroupType(
        @JsonProperty("resource_uri") GroupTypeUri resourceUri,
        String name,
        @JsonProperty("verbose_name") String verboseName,
        String slug,
        String desc,
        boolean used,
        long order)
        implements DatatrackerEntity<GroupTypeUri> {

    public GroupType {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(slug, "slug");
    }

    @Override
    public GroupTypeUri deriveUri() {
        return GroupTypeUri.of(slug);
    }
}
