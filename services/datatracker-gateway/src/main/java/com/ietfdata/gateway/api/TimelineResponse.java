package com.ietfdata.gateway.api;

import com.ietfdata.client.history.Snapshot;
import com.ietfdata.client.history.Timeline;
import java.time.Instant;
import java.util.List;

/** JSON view of a {@link Timeline}. */
public record TimelineResponse<S>(String identity, boolean deleted, Instant deletedAt, List<SnapshotResponse<S>> snapshots) {

    static <S> TimelineResponse<S> of(Timeline<?, S> timeline) {
        return new TimelineResponse<>(
                timeline.identity().path(),
                timeline.isDeleted(),
                timeline.deletedAt().orElse(null),
                timeline.history().stream().map(SnapshotResponse::of).toList());
    }

    public record SnapshotResponse<S>(S state, Instant validFrom, Instant validUntil, String changeReason) {

        static <S> SnapshotResponse<S> of(Snapshot<?, S> snapshot) {
            return new SnapshotResponse<>(
                    snapshot.state(), snapshot.validFrom(), snapshot.validUntil(), snapshot.changeReason());
        }
    }
}
