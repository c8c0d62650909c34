package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.DocStateUri;
import com.ietfdata.model.uri.DocumentUri;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.GroupUri;
import com.ietfdata.model.uri.PersonUri;
import com.ietfdata.model.uri.SubmissionUri;

import java.time.Instant;
import java.util.List;

/**
 * An Internet-Draft, RFC, charter or other document. {@code type}, {@code stream} and the
 * standards-level fields are kept as the raw name URIs the service returns.
 */
public record Document(
        long id,
        @JsonProperty("resource_uri") DocumentUri resourceUri,
        String name,
        String title,
        Long pages,
        Long words,
        Instant time,
        @JsonProperty("notify") String notifyList,
        Instant expires,
        String type,
        Long rfc,
        String rev,
        @JsonProperty("abstract") String documentAbstract,
        @JsonProperty("internal_comments") String internalComments,
        long order,
        String note,
        PersonUri ad,
        EmailUri shepherd,
        GroupUri group,
        String stream,
        @JsonProperty("std_level") String stdLevel,
        @JsonProperty("intended_std_level") String intendedStdLevel,
        List<DocStateUri> states,
        List<SubmissionUri> submissions,
        List<String> tags,
        @JsonProperty("uploaded_filename") String uploadedFilename,
        @JsonProperty("external_url") String externalUrl)
        implements DatatrackerEntity<DocumentUri> {

    public Document {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(name, "name");
        Fields.require(time, "time");
        states = Fields.list(states);
        submissions = Fields.list(submissions);
        tags = Fields.list(tags);
    }

    @Override
    public DocumentUri deriveUri() {
        return DocumentUri.of(name);
    }
}
