package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.DocStateUri;
import com.ietfdata.model.uri.DocumentUri;
import com.ietfdata.model.uri.GroupStateUri;
import com.ietfdata.model.uri.GroupTypeUri;
import com.ietfdata.model.uri.GroupUri;
import com.ietfdata.model.uri.PersonUri;

import java.time.Instant;
import java.util.List;

/** A working group, research group, area, directorate or other group. */
public record Group(
        long id,
        @JsonProperty("resource_uri") GroupUri resourceUri,
        String acronym,
        String name,
        String description,
        DocumentUri charter,
        PersonUri ad,
        Instant time,
        GroupTypeUri type,
        String comments,
        GroupUri parent,
        GroupStateUri state,
        @JsonProperty("unused_states") List<DocStateUri> unusedStates,
        @JsonProperty("unused_tags") List<String> unusedTags,
        @JsonProperty("list_email") String listEmail,
        @JsonProperty("list_subscribe") String listSubscribe,
        @JsonProperty("list_archive") String listArchive)
        implements DatatrackerEntity<GroupUri> {

    public Group {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(acronym, "acronym");
        Fields.require(type, "type");
        Fields.require(state, "state");
        unusedStates = Fields.list(unusedStates);
        unusedTags = Fields.list(unusedTags);
    }

    @Override
    public GroupUri deriveUri() {
        return GroupUri.of(id);
    }
}
