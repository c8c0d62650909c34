package com.ietfdata.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ietfdata.client.transport.Transport;
import com.ietfdata.client.transport.testing.InMemoryTransport;
import com.ietfdata.gateway.config.DatatrackerProperties;
import com.ietfdata.model.error.FetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Full-context tests of the gateway over an {@link InMemoryTransport}; no request leaves the JVM.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Datatracker Gateway Application")
class DatatrackerGatewayApplicationTest {

    @TestConfiguration
    static class InMemoryTransportConfiguration {

        @Bean
        @Primary
        InMemoryTransport inMemoryTransport() {
            return new InMemoryTransport();
        }
    }

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private InMemoryTransport transport;

    @BeforeEach
    void resetTransport() {
        transport.reset();
    }

    @Test
    @DisplayName("client properties are bound from the test profile")
    void propertiesAreBound() {
        var props = context.getBean(DatatrackerProperties.class);
        assertThat(props.pageSize()).isEqualTo(2);
        assertThat(props.maxListResults()).isEqualTo(3);
        assertThat(context.getBean(Transport.class)).isSameAs(transport);
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("GET /people/{id} resolves the person URI")
        void person() throws Exception {
            transport.serve("/api/v1/person/person/20209/", GatewayDocuments.person(20209, "Colin Perkins"));

            mockMvc.perform(get("/api/v1/people/20209"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("Colin Perkins"))
                    .andExpect(jsonPath("$.resource_uri").value("/api/v1/person/person/20209/"));
        }

        @Test
        @DisplayName("GET /groups/{acronym} looks the group up by acronym")
        void group() throws Exception {
            transport.serve("/api/v1/group/group/?acronym=rmcat&limit=1",
                    GatewayDocuments.page(null, GatewayDocuments.group(1962, "rmcat")));

            mockMvc.perform(get("/api/v1/groups/rmcat"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.acronym").value("rmcat"));
        }

        @Test
        @DisplayName("GET /uris normalizes a URI of the requested kind")
        void parseUri() throws Exception {
            mockMvc.perform(get("/api/v1/uris").param("kind", "person").param("value", "/api/v1/person/person/20209/"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.kind").value("PERSON"))
                    .andExpect(jsonPath("$.identifier").value("20209"));
        }
    }

    @Nested
    @DisplayName("Lists")
    class Lists {

        @Test
        @DisplayName("GET /people walks pages and stops at the configured result cap")
        void truncates() throws Exception {
            String first = "/api/v1/person/person/?name__contains=Perkins&limit=2";
            String second = first + "&offset=2";
            transport.serve(first, GatewayDocuments.page(second,
                            GatewayDocuments.person(1, "A Perkins"), GatewayDocuments.person(2, "B Perkins")))
                    .serve(second, GatewayDocuments.page(null,
                            GatewayDocuments.person(3, "C Perkins"), GatewayDocuments.person(4, "D Perkins")));

            mockMvc.perform(get("/api/v1/people").param("nameContains", "Perkins"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(3))
                    .andExpect(jsonPath("$.truncated").value(true))
                    .andExpect(jsonPath("$.items[2].name").value("C Perkins"));
        }

        @Test
        @DisplayName("an empty result is an empty list")
        void empty() throws Exception {
            transport.serve("/api/v1/person/person/?name=Nobody&limit=2", GatewayDocuments.page(null));

            mockMvc.perform(get("/api/v1/people").param("name", "Nobody"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(0))
                    .andExpect(jsonPath("$.truncated").value(false));
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("GET /history/person keys versions valid in the window by identity path")
        void window() throws Exception {
            transport.serve("/api/v1/person/historicalperson/?history_date__lte=2020-12-31T00%3A00%3A00&limit=2",
                    GatewayDocuments.page(null,
                            GatewayDocuments.historicalPerson(1, 1, "2010-01-01T00:00:00", "Early Person"),
                            GatewayDocuments.historicalPerson(2, 2, "2020-06-01T00:00:00", "Late Person")));

            mockMvc.perform(get("/api/v1/history/person")
                            .param("from", "2020-01-01T00:00:00Z")
                            .param("to", "2020-12-31T00:00:00Z"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$['/api/v1/person/person/1/'][0].state.name").value("Early Person"))
                    .andExpect(jsonPath("$['/api/v1/person/person/2/'][0].state.name").value("Late Person"));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("NOT_FOUND maps to 404 with the kind and correlation ID")
        void notFound() throws Exception {
            mockMvc.perform(get("/api/v1/people/999").header("X-Correlation-ID", "corr-404"))
                    .andExpect(status().isNotFound())
                    .andExpect(header().string("X-Correlation-ID", "corr-404"))
                    .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.correlationId").value("corr-404"));
        }

        @Test
        @DisplayName("FETCH maps to 502 and is marked retryable")
        void fetchFailure() throws Exception {
            transport.failWith("/api/v1/person/person/1/", FetchException.status("/api/v1/person/person/1/", 503));

            mockMvc.perform(get("/api/v1/people/1"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.kind").value("FETCH"))
                    .andExpect(jsonPath("$.retryable").value(true));
        }

        @Test
        @DisplayName("a malformed URI maps to 400 VALIDATION")
        void invalidUri() throws Exception {
            mockMvc.perform(get("/api/v1/uris").param("kind", "person").param("value", "/api/v1/group/group/1/"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("VALIDATION"));
        }

        @Test
        @DisplayName("an inverted history window is a 400")
        void invertedWindow() throws Exception {
            mockMvc.perform(get("/api/v1/history/person")
                            .param("from", "2021-01-01T00:00:00Z")
                            .param("to", "2020-01-01T00:00:00Z"))
                    .andExpect(status().isBadRequest());
            assertThat(transport.fetchCount()).isZero();
        }
    }
}
