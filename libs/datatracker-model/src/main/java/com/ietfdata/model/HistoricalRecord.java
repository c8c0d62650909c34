package com.ietfdata.model;

import com.ietfdata.model.uri.DatatrackerUri;

import java.time.Instant;

/**
 * One entry in the change history of an entity whose identity is stable while its attributes change.
 * The record holds the full state of the entity as of {@link #historyDate()}.
 *
 * @param <I> URI type of the stable identity this record is one state of
 */
public interface HistoricalRecord<I extends DatatrackerUri<?>> {

    /** Back-reference to the stable identity. */
    I identity();

    long historyId();

    HistoryType historyType();

    /** When this state came into effect. */
    Instant historyDate();

    /** Free-text reason recorded with the change, may be null. */
    String historyChangeReason();
}
