package com.ietfdata.model.uri;

import com.ietfdata.model.error.UriValidationException;

/** Kind-tagged entry point for turning caller-supplied strings into typed URIs. */
public final class UriParser {

    private UriParser() {
        // utility class
    }

    /**
     * Parses {@code value} as a URI of the given kind.
     *
     * @throws UriValidationException if the value does not match the kind's pattern
     */
    public static DatatrackerUri<?> parse(ResourceKind kind, String value) {
        return switch (kind) {
            case PERSON -> PersonUri.parse(value);
            case HISTORICAL_PERSON -> HistoricalPersonUri.parse(value);
            case PERSON_ALIAS -> PersonAliasUri.parse(value);
            case EMAIL -> EmailUri.parse(value);
            case HISTORICAL_EMAIL -> HistoricalEmailUri.parse(value);
            case GROUP -> GroupUri.parse(value);
            case GROUP_TYPE -> GroupTypeUri.parse(value);
            case GROUP_STATE -> GroupStateUri.parse(value);
            case DOCUMENT -> DocumentUri.parse(value);
            case DOC_STATE -> DocStateUri.parse(value);
            case DOC_STATE_TYPE -> DocStateTypeUri.parse(value);
            case SUBMISSION -> SubmissionUri.parse(value);
        };
    }
}
