package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.DocStateTypeUri;
import com.ietfdata.model.uri.DocStateUri;

import java.util.List;

/** One state of a document state machine, with the states reachable from it. */
public record DocState(
        long id,
        @JsonProperty("resource_uri") DocStateUri resourceUri,
        String name,
        String desc,
        String slug,
        @JsonProperty("next_states") List<DocStateUri> nextStates,
        boolean used,
        long order,
        DocStateTypeUri type)
        implements DatatrackerEntity<DocStateUri> {

    public DocState {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(type, "type");
        nextStates = Fields.list(nextStates);
    }

    @Override
    public DocStateUri deriveUri() {
        return DocStateUri.of(id);
    }
}
