package com.ietfdata.model.uri;

import com.ietfdata.model.DatatrackerEntity;

/**
 * A validated, kind-specific reference to one Datatracker record.
 *
 * <p>The family is sealed and every member is a distinct record type, so a {@link PersonUri} can
 * never be supplied where a {@link GroupUri} is required. Equality is structural within a kind;
 * values of different kinds are never equal. The type parameter names the entity the URI resolves
 * to, which lets a resolver return the right record type without casts at the call site.
 *
 * @param <E> the entity type this URI refers to
 */
public sealed interface DatatrackerUri<E extends DatatrackerEntity<?>>
        permits PersonUri,
                HistoricalPersonUri,
                PersonAliasUri,
                EmailUri,
                HistoricalEmailUri,
                GroupUri,
                GroupTypeUri,
                GroupStateUri,
                DocumentUri,
                DocStateUri,
                DocStateTypeUri,
                SubmissionUri {

    /** The resource kind tag. */
    ResourceKind kind();

    /** The normalized relative path, always ending in {@code /}. */
    String path();

    /** The entity class a document at {@link #path()} decodes into. */
    Class<E> entityType();

    /** The identifier segment: a numeric id, a slug, or an email address depending on the kind. */
    default String identifier() {
        return kind().identifierOf(path());
    }
}
