package com.ietfdata.client;

import com.ietfdata.client.query.ResourceType;
import com.ietfdata.client.transport.testing.InMemoryTransport;
import com.ietfdata.model.Group;
import com.ietfdata.model.error.NotFoundException;
import com.ietfdata.model.error.UriValidationException;
import com.ietfdata.model.uri.PersonUri;
import com.ietfdata.model.uri.ResourceKind;
import com.ietfdata.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.ietfdata.client.TestDocuments.document;
import static com.ietfdata.client.TestDocuments.email;
import static com.ietfdata.client.TestDocuments.group;
import static com.ietfdata.client.TestDocuments.historicalPerson;
import static com.ietfdata.client.TestDocuments.page;
import static com.ietfdata.client.TestDocuments.person;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Datatracker")
class DatatrackerTest {

    private InMemoryTransport transport;
    private Datatracker datatracker;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
        datatracker = new Datatracker(transport, ClientSettings.defaults().withPageSize(2),
                new MetricFactory(new SimpleMeterRegistry(), "test"));
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("personByEmail() resolves the address, then its owner")
        void personByEmail() {
            transport.serve("/api/v1/person/email/?address=csp%40csperkins.org&limit=1",
                            page(null, email("csp@csperkins.org", 20209)))
                    .serve("/api/v1/person/person/20209/", person(20209, "Colin Perkins"));

            assertThat(datatracker.personByEmail("csp@csperkins.org").name()).isEqualTo("Colin Perkins");
            assertThat(transport.fetchCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("personByEmail() of an unknown address is NOT_FOUND")
        void unknownEmail() {
            transport.serve("/api/v1/person/email/?address=nobody%40example.org&limit=1", page(null));

            assertThatThrownBy(() -> datatracker.personByEmail("nobody@example.org"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("group() and document() filter by acronym and name")
        void groupAndDocument() {
            transport.serve("/api/v1/group/group/?acronym=rmcat&limit=1", page(null, group(1962, "rmcat")))
                    .serve("/api/v1/doc/document/?name=draft-ietf-rmcat-cc&limit=1",
                            page(null, document(7, "draft-ietf-rmcat-cc")));

            assertThat(datatracker.group("rmcat").id()).isEqualTo(1962);
            assertThat(datatracker.document("draft-ietf-rmcat-cc").title()).isEqualTo("Title of draft-ietf-rmcat-cc");
        }

        @Test
        @DisplayName("email() resolves the address URI directly")
        void emailByAddress() {
            transport.serve("/api/v1/person/email/csp@csperkins.org/", email("csp@csperkins.org", 20209));

            assertThat(datatracker.email("csp@csperkins.org").person()).isEqualTo(PersonUri.of(20209));
        }
    }

    @Nested
    @DisplayName("Lists and history")
    class ListsAndHistory {

        @Test
        @DisplayName("list(type) walks every page of a collection")
        void listAll() {
            transport.serve("/api/v1/group/group/?limit=2",
                            page("/api/v1/group/group/?limit=2&offset=2", group(1, "a"), group(2, "b")))
                    .serve("/api/v1/group/group/?limit=2&offset=2", page(null, group(3, "c")));

            assertThat(datatracker.list(ResourceType.GROUP).stream().map(Group::acronym))
                    .containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("personHistory() builds the timeline of a person")
        void personHistory() {
            transport.serve("/api/v1/person/historicalperson/?id=42&limit=2", page(null,
                    historicalPerson(42, 1, "+", "2015-01-01T00:00:00", "Jane Roe"),
                    historicalPerson(42, 2, "~", "2018-06-01T00:00:00", "Jane Doe")));

            var timeline = datatracker.personHistory(PersonUri.of(42));

            assertThat(timeline.history()).hasSize(2);
            assertThat(timeline.current().state().name()).isEqualTo("Jane Doe");
        }
    }

    @Test
    @DisplayName("parse() rejects a URI of the wrong kind")
    void parseRejectsWrongKind() {
        assertThat(datatracker.parse(ResourceKind.PERSON, "/api/v1/person/person/20209/"))
                .isEqualTo(PersonUri.of(20209));
        assertThatThrownBy(() -> datatracker.parse(ResourceKind.PERSON, "/api/v1/group/group/1/"))
                .isInstanceOf(UriValidationException.class);
    }
}
