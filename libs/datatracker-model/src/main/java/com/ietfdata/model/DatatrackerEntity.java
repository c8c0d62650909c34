package com.ietfdata.model;

import com.ietfdata.model.uri.DatatrackerUri;

/**
 * A record decoded from the Datatracker, always carrying its own canonical URI.
 *
 * <p>{@link #deriveUri()} rebuilds the URI from the identifying field(s) of the record. For every
 * well-formed document it equals {@link #resourceUri()}, and parsing its string form yields an equal
 * value again.
 *
 * @param <U> the URI type of this entity
 */
public interface DatatrackerEntity<U extends DatatrackerUri<?>> {

    /** The self-referential {@code resource_uri} field as decoded. */
    U resourceUri();

    /** The canonical URI derived from this entity's identifying fields. */
    U deriveUri();
}
