package com.ietfdata.model;

import com.ietfdata.model.error.DecodeException;
import com.ietfdata.model.error.ErrorKind;
import com.ietfdata.model.uri.DocStateUri;
import com.ietfdata.model.uri.EmailUri;
import com.ietfdata.model.uri.GroupStateUri;
import com.ietfdata.model.uri.GroupUri;
import com.ietfdata.model.uri.PersonUri;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DatatrackerJson")
class DatatrackerJsonTest {

    @Nested
    @DisplayName("decode()")
    class Decode {

        @Test
        @DisplayName("decodes a person with all fields")
        void decodesPerson() {
            var person = DatatrackerJson.decode(Fixtures.read("person.json"), Person.class, "person.json");

            assertThat(person.id()).isEqualTo(20209L);
            assertThat(person.resourceUri()).isEqualTo(PersonUri.parse("/api/v1/person/person/20209/"));
            assertThat(person.name()).isEqualTo("Colin Perkins");
            assertThat(person.nameFromDraft()).isEqualTo("Colin Perkins");
            assertThat(person.ascii()).isEqualTo("Colin Perkins");
            assertThat(person.asciiShort()).isNull();
            assertThat(person.time()).isEqualTo(Instant.parse("2012-02-26T00:03:54Z"));
            assertThat(person.photoThumb()).endsWith("Colin-Perkins-sm_PMIAhXi.jpg");
            assertThat(person.user()).isEmpty();
            assertThat(person.consent()).isTrue();
        }

        @Test
        @DisplayName("decodes an email with its person back-reference")
        void decodesEmail() {
            var email = DatatrackerJson.decode(Fixtures.read("email.json"), Email.class, "email.json");

            assertThat(email.resourceUri()).isEqualTo(EmailUri.of("csp@csperkins.org"));
            assertThat(email.address()).isEqualTo("csp@csperkins.org");
            assertThat(email.person()).isEqualTo(PersonUri.of(20209));
            assertThat(email.time()).isEqualTo(Instant.parse("1970-01-01T23:59:59Z"));
            assertThat(email.origin()).isEqualTo("author: draft-ietf-mmusic-rfc4566bis");
            assertThat(email.primary()).isTrue();
            assertThat(email.active()).isTrue();
        }

        @Test
        @DisplayName("decodes typed URI references and lists inside a group")
        void decodesGroup() {
            var group = DatatrackerJson.decode(Fixtures.read("group.json"), Group.class, "group.json");

            assertThat(group.acronym()).isEqualTo("avt");
            assertThat(group.parent()).isEqualTo(GroupUri.of(1683));
            assertThat(group.state()).isEqualTo(GroupStateUri.of("conclude"));
            assertThat(group.ad()).isNull();
            assertThat(group.unusedStates()).isEmpty();
        }

        @Test
        @DisplayName("decodes history markers")
        void decodesHistoryMarkers() {
            var record = DatatrackerJson.decode(
                    Fixtures.read("historicalperson.json"), HistoricalPerson.class, "historicalperson.json");

            assertThat(record.historyType()).isEqualTo(HistoryType.CHANGED);
            assertThat(record.historyId()).isEqualTo(11731L);
            assertThat(record.identity()).isEqualTo(PersonUri.of(20209));
            assertThat(record.asPerson().resourceUri()).isEqualTo(PersonUri.of(20209));
        }

        @Test
        @DisplayName("decodes document state lists and renamed fields")
        void decodesDocument() {
            var document = DatatrackerJson.decode(Fixtures.read("document.json"), Document.class, "document.json");

            assertThat(document.rfc()).isEqualTo(3550L);
            assertThat(document.documentAbstract()).startsWith("This memorandum describes RTP");
            assertThat(document.states()).containsExactly(DocStateUri.of(3), DocStateUri.of(7));
            assertThat(document.shepherd()).isNull();
            assertThat(document.notifyList()).isEqualTo("avt-chairs@ietf.org");
        }

        @Test
        @DisplayName("ignores fields the client does not know")
        void ignoresUnknownFields() {
            var json = Fixtures.read("grouptype.json").replace("\"used\"", "\"added_later\": 1, \"used\"");

            var type = DatatrackerJson.decode(json, GroupType.class, "grouptype.json");

            assertThat(type.slug()).isEqualTo("wg");
        }
    }

    @Nested
    @DisplayName("Decode failures")
    class Failures {

        @Test
        @DisplayName("malformed JSON is a DECODE failure")
        void malformedJson() {
            assertThatThrownBy(() -> DatatrackerJson.decode("not-json{", Person.class, "/x/"))
                    .isInstanceOf(DecodeException.class)
                    .satisfies(e -> assertThat(((DecodeException) e).kind()).isEqualTo(ErrorKind.DECODE));
        }

        @Test
        @DisplayName("an empty document is a DECODE failure")
        void emptyDocument() {
            assertThatThrownBy(() -> DatatrackerJson.decode("", Person.class, "/x/"))
                    .isInstanceOf(DecodeException.class)
                    .hasMessageContaining("empty document");
        }

        @Test
        @DisplayName("a missing required field is a DECODE failure")
        void missingRequiredField() {
            var json = Fixtures.read("person.json")
                    .replace("\"resource_uri\": \"/api/v1/person/person/20209/\",", "");

            assertThatThrownBy(() -> DatatrackerJson.decode(json, Person.class, "/api/v1/person/person/20209/"))
                    .isInstanceOf(DecodeException.class)
                    .hasMessageContaining("resource_uri")
                    .satisfies(e -> assertThat(((DecodeException) e).source())
                            .isEqualTo("/api/v1/person/person/20209/"));
        }

        @Test
        @DisplayName("a URI field of the wrong kind is a DECODE failure")
        void wrongUriKind() {
            var json = Fixtures.read("email.json")
                    .replace("\"person\": \"/api/v1/person/person/20209/\"", "\"person\": \"/api/v1/group/group/1/\"");

            assertThatThrownBy(() -> DatatrackerJson.decode(json, Email.class, "email.json"))
                    .isInstanceOf(DecodeException.class);
        }

        @Test
        @DisplayName("a malformed timestamp is a DECODE failure")
        void malformedTimestamp() {
            var json = Fixtures.read("email.json").replace("1970-01-01T23:59:59", "a long time ago");

            assertThatThrownBy(() -> DatatrackerJson.decode(json, Email.class, "email.json"))
                    .isInstanceOf(DecodeException.class);
        }

        @Test
        @DisplayName("an unknown history marker is a DECODE failure")
        void unknownHistoryType() {
            var json = Fixtures.read("historicalemail.json").replace("\"+\"", "\"?\"");

            assertThatThrownBy(() -> DatatrackerJson.decode(json, HistoricalEmail.class, "historicalemail.json"))
                    .isInstanceOf(DecodeException.class);
        }
    }

    @Nested
    @DisplayName("decodePage()")
    class DecodePage {

        @Test
        @DisplayName("decodes meta and objects in service order")
        void decodesPage() {
            var page = DatatrackerJson.decodePage(Fixtures.read("person-page.json"), Person.class, "page");

            assertThat(page.meta().totalCount()).isEqualTo(3L);
            assertThat(page.objects()).extracting(Person::id).containsExactly(20209L, 104L);
            assertThat(page.nextPage())
                    .contains("/api/v1/person/person/?limit=2&name__contains=Perkins&offset=2");
        }

        @Test
        @DisplayName("an empty last page is valid")
        void emptyTerminalPage() {
            var json = """
                    {"meta": {"limit": 20, "offset": 0, "total_count": 0, "next": null, "previous": null},
                     "objects": []}
                    """;

            var page = DatatrackerJson.decodePage(json, Person.class, "page");

            assertThat(page.objects()).isEmpty();
            assertThat(page.hasNextPage()).isFalse();
        }

        @Test
        @DisplayName("a page without meta is a DECODE failure")
        void missingMeta() {
            assertThatThrownBy(() -> DatatrackerJson.decodePage("{\"objects\": []}", Person.class, "page"))
                    .isInstanceOf(DecodeException.class);
        }
    }

    @Test
    @DisplayName("encode() writes the service's field names and time format")
    void encodeUsesWireFormat() {
        var email = DatatrackerJson.decode(Fixtures.read("email.json"), Email.class, "email.json");

        var json = DatatrackerJson.encode(email);

        assertThat(json)
                .contains("\"resource_uri\":\"/api/v1/person/email/csp@csperkins.org/\"")
                .contains("\"time\":\"1970-01-01T23:59:59\"");
    }
}
