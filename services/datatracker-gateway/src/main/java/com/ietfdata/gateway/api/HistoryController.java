package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.client.history.HistoryKind;
import com.ietfdata.client.history.Snapshot;
import com.ietfdata.model.uri.DatatrackerUri;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Validity windows across every identity of a historical kind. */
@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private final Datatracker datatracker;

    public HistoryController(Datatracker datatracker) {
        this.datatracker = datatracker;
    }

    /**
     * Identities of {@code kind} ({@code person} or {@code email}) with a version valid at some point
     * of {@code [from, to]}, keyed by URI path in first-appearance order, with those versions.
     */
    @GetMapping("/{kind}")
    public Map<String, List<TimelineResponse.SnapshotResponse<?>>> between(
            @PathVariable String kind,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return switch (kind) {
            case "person" -> byPath(datatracker.between(HistoryKind.PERSON, from, to));
            case "email" -> byPath(datatracker.between(HistoryKind.EMAIL, from, to));
            default -> throw new IllegalArgumentException("unknown history kind: " + kind);
        };
    }

    private static <I extends DatatrackerUri<?>, S> Map<String, List<TimelineResponse.SnapshotResponse<?>>> byPath(
            Map<I, List<Snapshot<I, S>>> versions) {
        Map<String, List<TimelineResponse.SnapshotResponse<?>>> result = new LinkedHashMap<>();
        versions.forEach((identity, snapshots) -> result.put(identity.path(),
                snapshots.stream().<TimelineResponse.SnapshotResponse<?>>map(TimelineResponse.SnapshotResponse::of).toList()));
        return result;
    }
}
