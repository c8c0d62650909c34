package com.ietfdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ietfdata.model.uri.GroupUri;
import com.ietfdata.model.uri.SubmissionUri;

import java.time.LocalDate;

/** An Internet-Draft submission. {@code state} is the raw submission-state name URI. */
public record Submission(
        long id,
        @JsonProperty("resource_uri") SubmissionUri resourceUri,
        String name,
        String rev,
        String title,
        @JsonProperty("submission_date") LocalDate submissionDate,
        @JsonProperty("document_date") LocalDate documentDate,
        String state,
        GroupUri group)
        implements DatatrackerEntity<SubmissionUri> {

    public Submission {
        Fields.require(resourceUri, "resource_uri");
        Fields.require(name, "name");
    }

    @Override
    public SubmissionUri deriveUri() {
        return SubmissionUri.of(id);
    }
}
