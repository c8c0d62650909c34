package com.ietfdata.client.history;

import com.ietfdata.client.query.QueryEngine;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.Email;
import com.ietfdata.model.HistoricalRecord;
import com.ietfdata.model.Person;
import com.ietfdata.model.uri.DatatrackerUri;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.PersonUri;
import com.ietfdata.observability.CorrelationContext;
import com.ietfdata.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers past states of people and email addresses from the service's history collections.
 */
public final class HistoryIndex {

    private static final Logger log = LoggerFactory.getLogger(HistoryIndex.class);

    private final QueryEngine queryEngine;

    public HistoryIndex(QueryEngine queryEngine) {
        if (queryEngine == null) {
            throw new IllegalArgumentException("queryEngine must not be null");
        }
        this.queryEngine = queryEngine;
    }

    /**
     * Fetches every history record of {@code identity} and builds its timeline. An identity with
     * no records yields an empty timeline.
     */
    public <I extends DatatrackerUri<?>, S, R extends DatatrackerEntity<?> & HistoricalRecord<I>> Timeline<I, S> history(
            HistoryKind<I, S, R> kind, I identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity must not be null");
        }
        return CorrelationContextHolder.callWithContext(context("history", identity.path()), () -> {
            List<R> records = queryEngine.query(HistoryFilter.forIdentity(kind, identity)).toList();
            Timeline<I, S> timeline = Timeline.fromRecords(identity, records, kind::stateOf);

            ValidationResult validation = timeline.validate();
            if (!validation.valid()) {
                log.warn("Inconsistent {} history for {}: {}", kind, identity, validation.errors());
            }
            log.debug("Built {} from {} records", timeline, records.size());
            return timeline;
        });
    }

    public Timeline<PersonUri, Person> personHistory(PersonUri person) {
        return history(HistoryKind.PERSON, person);
    }

    public Timeline<EmailUri, Email> emailHistory(EmailUri email) {
        return history(HistoryKind.EMAIL, email);
    }

    /**
     * Finds every identity of {@code kind} with at least one snapshot overlapping the closed window
     * {@code [from, to]}, including identities whose state was set before {@code from} and still
     * held during it. Each identity maps to its overlapping snapshots in validity order. The map
     * iterates in order of each identity's first record in the service's response.
     *
     * <p>All records dated up to {@code to} are fetched, since a snapshot open at {@code from} may
     * have started arbitrarily early.
     *
     * @throws IllegalArgumentException if {@code from} is after {@code to}
     */
    public <I extends DatatrackerUri<?>, S, R extends DatatrackerEntity<?> & HistoricalRecord<I>>
            Map<I, List<Snapshot<I, S>>> between(HistoryKind<I, S, R> kind, Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to must not be null");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        }
        return CorrelationContextHolder.callWithContext(context("between", kind.toString()), () -> {
            Map<I, List<R>> grouped = new LinkedHashMap<>();
            for (R record : queryEngine.query(HistoryFilter.of(kind).changedBefore(to))) {
                grouped.computeIfAbsent(record.identity(), identity -> new ArrayList<>()).add(record);
            }

            Map<I, List<Snapshot<I, S>>> overlapping = new LinkedHashMap<>();
            grouped.forEach((identity, records) -> {
                List<Snapshot<I, S>> snapshots = Timeline.fromRecords(identity, records, kind::stateOf)
                        .history().stream()
                        .filter(snapshot -> snapshot.overlaps(from, to))
                        .toList();
                if (!snapshots.isEmpty()) {
                    overlapping.put(identity, snapshots);
                }
            });
            log.debug("{} of {} {} identities overlap [{}, {}]", overlapping.size(), grouped.size(), kind, from, to);
            return Collections.unmodifiableMap(overlapping);
        });
    }

    private static CorrelationContext context(String operation, String target) {
        return CorrelationContextHolder.get()
                .map(outer -> outer.withOperation(operation, target))
                .orElseGet(() -> CorrelationContext.forOperation(operation, target));
    }
}
