package com.ietfdata.client;

import com.ietfdata.client.history.HistoryIndex;
import com.ietfdata.client.history.HistoryKind;
import com.ietfdata.client.history.Snapshot;
import com.ietfdata.client.history.Timeline;
import com.ietfdata.client.query.AliasFilter;
import com.ietfdata.client.query.DocumentFilter;
import com.ietfdata.client.query.EmailFilter;
import com.ietfdata.client.query.GroupFilter;
import com.ietfdata.client.query.PagedQuery;
import com.ietfdata.client.query.PersonFilter;
import com.ietfdata.client.query.QueryEngine;
import com.ietfdata.client.query.QueryFilter;
import com.ietfdata.client.query.ResourceType;
import com.ietfdata.client.resolve.EntityResolver;
import com.ietfdata.client.transport.HttpTransport;
import com.ietfdata.client.transport.Transport;
import com.ietfdata.model.DatatrackerEntity;
import com.ietfdata.model.Document;
import com.ietfdata.model.Email;
import com.ietfdata.model.Group;
import com.ietfdata.model.HistoricalRecord;
import com.ietfdata.model.Person;
import com.ietfdata.model.PersonAlias;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.model.uri.DatatrackerUri;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.PersonUri;
import com.ietfdata.model.uri.ResourceKind;
import com.ietfdata.model.uri.UriParser;
import com.ietfdata.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the client: typed lookups, lazy filtered lists and history queries against the
 * IETF Datatracker.
 *
 * <pre>{@code
 * Datatracker dt = Datatracker.create();
 * Person person = dt.resolve(PersonUri.of(20209));
 * for (Email email : dt.emails(EmailFilter.forPerson(person.resourceUri()))) { ... }
 * }</pre>
 *
 * <p>Instances hold no mutable state and are safe to share between threads. Lists are lazy and
 * each iteration issues its own requests.
 */
public final class Datatracker {

    private static final Logger log = LoggerFactory.getLogger(Datatracker.class);

    private final QueryEngine queryEngine;
    private final EntityResolver resolver;
    private final HistoryIndex historyIndex;

    public Datatracker(Transport transport, ClientSettings settings, MetricFactory metrics) {
        if (transport == null || settings == null || metrics == null) {
            throw new IllegalArgumentException("transport, settings and metrics must not be null");
        }
        this.queryEngine = new QueryEngine(transport, settings, metrics);
        this.resolver = new EntityResolver(transport, queryEngine);
        this.historyIndex = new HistoryIndex(queryEngine);
        log.info("Datatracker client ready: {}", settings);
    }

    /** A client for the public service with default settings. */
    public static Datatracker create() {
        return create(ClientSettings.defaults());
    }

    /** A client over HTTP, reporting to Micrometer's global registry. */
    public static Datatracker create(ClientSettings settings) {
        return new Datatracker(new HttpTransport(settings), settings, MetricFactory.global("datatracker"));
    }

    /** A client over any transport with default paging settings, mainly for tests. */
    public static Datatracker over(Transport transport) {
        return new Datatracker(transport, ClientSettings.defaults(), MetricFactory.global("datatracker"));
    }

    // ---- URIs ----

    /**
     * Parses a caller-supplied string into a URI of the given kind.
     *
     * @throws com.ietfdata.model.error.UriValidationException if the string is not such a URI
     */
    public DatatrackerUri<?> parse(ResourceKind kind, String value) {
        return UriParser.parse(kind, value);
    }

    // ---- Resolution ----

    /** Fetches the entity a URI refers to. */
    public <E extends DatatrackerEntity<?>> E resolve(DatatrackerUri<E> uri) {
        return resolver.resolve(uri);
    }

    /** The first entity matching a filter, or {@code NotFoundException}. */
    public <E extends DatatrackerEntity<?>> E resolveBy(QueryFilter<E> filter) {
        return resolver.resolveBy(filter);
    }

    public <E extends DatatrackerEntity<?>> Optional<E> findFirst(QueryFilter<E> filter) {
        return resolver.findFirst(filter);
    }

    public Person person(PersonUri uri) {
        return resolver.resolve(uri);
    }

    /** The email record of an address. */
    public Email email(String address) {
        return resolver.resolve(EmailUri.of(address));
    }

    /** The person whose name is exactly {@code name}. */
    public Person personByName(String name) {
        return resolver.resolveBy(PersonFilter.withName(name));
    }

    /** The person an email address belongs to. */
    public Person personByEmail(String address) {
        Email email = resolver.resolveBy(EmailFilter.withAddress(address));
        if (email.person() == null) {
            throw new NotFoundException(email.resourceUri().path(), "address has no owner");
        }
        return resolver.resolve(email.person());
    }

    public Group group(String acronym) {
        return resolver.resolveBy(GroupFilter.withAcronym(acronym));
    }

    /** A document by draft or RFC name. */
    public Document document(String name) {
        return resolver.resolveBy(DocumentFilter.withName(name));
    }

    // ---- Lists ----

    public <E extends DatatrackerEntity<?>> PagedQuery<E> list(QueryFilter<E> filter) {
        return queryEngine.query(filter);
    }

    /** Every entity of a kind. */
    public <E extends DatatrackerEntity<?>> PagedQuery<E> list(ResourceType<E> type) {
        return queryEngine.query(QueryFilter.all(type));
    }

    public PagedQuery<Person> people(PersonFilter filter) {
        return queryEngine.query(filter);
    }

    public PagedQuery<Email> emails(EmailFilter filter) {
        return queryEngine.query(filter);
    }

    public PagedQuery<Group> groups(GroupFilter filter) {
        return queryEngine.query(filter);
    }

    public PagedQuery<Document> documents(DocumentFilter filter) {
        return queryEngine.query(filter);
    }

    public PagedQuery<PersonAlias> aliases(AliasFilter filter) {
        return queryEngine.query(filter);
    }

    // ---- History ----

    public Timeline<PersonUri, Person> personHistory(PersonUri person) {
        return historyIndex.personHistory(person);
    }

    public Timeline<EmailUri, Email> emailHistory(EmailUri email) {
        return historyIndex.emailHistory(email);
    }

    public <I extends DatatrackerUri<?>, S, R extends DatatrackerEntity<?> & HistoricalRecord<I>> Timeline<I, S> history(
            HistoryKind<I, S, R> kind, I identity) {
        return historyIndex.history(kind, identity);
    }

    /** Identities of a kind with a snapshot overlapping {@code [from, to]}, with those snapshots. */
    public <I extends DatatrackerUri<?>, S, R extends DatatrackerEntity<?> & HistoricalRecord<I>>
            Map<I, List<Snapshot<I, S>>> between(HistoryKind<I, S, R> kind, Instant from, Instant to) {
        return historyIndex.between(kind, from, to);
    }
}
