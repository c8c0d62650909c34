package com.ietfdata.model.uri;

import com.ietfdata.model.error.UriValidationException;

import java.util.regex.Pattern;

/**
 * Every resource kind the client can address, with the collection path its URIs live under and the
 * shape of the identifier segment that follows it.
 *
 * <p>A URI of kind {@code K} is always {@code K.collectionPath() + identifier + "/"}.
 */
public enum ResourceKind {

    // ---- People ----
    PERSON("/api/v1/person/person/", Identifier.NUMERIC),
    HISTORICAL_PERSON("/api/v1/person/historicalperson/", Identifier.NUMERIC),
    PERSON_ALIAS("/api/v1/person/alias/", Identifier.NUMERIC),
    EMAIL("/api/v1/person/email/", Identifier.EMAIL),
    HISTORICAL_EMAIL("/api/v1/person/historicalemail/", Identifier.NUMERIC),

    // ---- Groups ----
    GROUP("/api/v1/group/group/", Identifier.NUMERIC),
    GROUP_TYPE("/api/v1/name/grouptypename/", Identifier.SLUG),
    GROUP_STATE("/api/v1/name/groupstatename/", Identifier.SLUG),

    // ---- Documents ----
    DOCUMENT("/api/v1/doc/document/", Identifier.SLUG),
    DOC_STATE("/api/v1/doc/state/", Identifier.NUMERIC),
    DOC_STATE_TYPE("/api/v1/doc/statetype/", Identifier.SLUG),
    SUBMISSION("/api/v1/submit/submission/", Identifier.NUMERIC);

    private final String collectionPath;
    private final Pattern pattern;

    ResourceKind(String collectionPath, Identifier identifier) {
        this.collectionPath = collectionPath;
        this.pattern = Pattern.compile(Pattern.quote(collectionPath) + "(" + identifier.regex + ")/");
    }

    /** The list endpoint for this kind, e.g. {@code /api/v1/person/person/}. */
    public String collectionPath() {
        return collectionPath;
    }

    /**
     * Validates {@code value} as a URI of this kind and returns its normalized form.
     *
     * @throws UriValidationException if the value does not match this kind's pattern
     */
    public String normalize(String value) {
        if (value == null || value.isEmpty()) {
            throw new UriValidationException(this, value);
        }
        String candidate = value.endsWith("/") ? value : value + "/";
        if (!pattern.matcher(candidate).matches()) {
            throw new UriValidationException(this, value);
        }
        return candidate;
    }

    /**
     * Builds and validates the URI path for the given identifier segment.
     *
     * @throws UriValidationException if the identifier has the wrong shape for this kind
     */
    public String pathFor(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new UriValidationException(this, identifier);
        }
        return normalize(collectionPath + identifier + "/");
    }

    /** Extracts the identifier segment from a path already normalized by this kind. */
    String identifierOf(String normalizedPath) {
        return normalizedPath.substring(collectionPath.length(), normalizedPath.length() - 1);
    }

    private enum Identifier {
        NUMERIC("0|[1-9][0-9]{0,17}"),
        SLUG("[A-Za-z0-9][A-Za-z0-9._+-]*"),
        EMAIL("[^/@\\s?#]+@[^/@\\s?#]+");

        private final String regex;

        Identifier(String regex) {
            this.regex = regex;
        }
    }
}
