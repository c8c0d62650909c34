package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.DocStateTypeUri;

public record DocStateType(
        @JsonProperty("resource_uri") DocStateTypeUri resourceUri,
        String slug,
        String label)
        implements DatatrackerEntity<DocStateTypeUri> {

    public DocStateType {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(slug, "slug");
    }

    @Override
    public DocStateTypeUri deriveUri() {
        return DocStateTypeUri.of(slug);
    }
}
