package com.ietfdata.gateway.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ietfdata.client.Datatracker;
import com.ietfdata.client.history.Snapshot;
import com.ietfdata.client.history.Timeline;
import com.ietfdata.model.DatatrackerJson;
import com.ietfdata.model.Person;
import com.ietfdata.model.uri.PersonUri;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PeopleController.class)
@DisplayName("PeopleController")
class PeopleControllerTest {

    private static final PersonUri JANE = PersonUri.of(42);
    private static final Instant RENAMED = Instant.parse("2018-06-01T00:00:00Z");

    @Autowired private MockMvc mockMvc;
    @MockBean private Datatracker datatracker;

    private static Person person(String name) {
        return DatatrackerJson.decode("""
                {"id": 42, "resource_uri": "/api/v1/person/person/42/", "name": "%s", "name_from_draft": null,
                 "biography": "", "ascii": "%s", "ascii_short": null, "time": "2012-02-26T00:03:54", "photo": "",
                 "photo_thumb": "", "user": "", "consent": true}
                """.formatted(name, name), Person.class, "test");
    }

    private static Timeline<PersonUri, Person> renamedTimeline() {
        return Timeline.of(JANE, List.of(
                Snapshot.of(JANE, person("Jane Roe"), Instant.parse("2015-01-01T00:00:00Z"), RENAMED),
                Snapshot.of(JANE, person("Jane Doe"), RENAMED, null)));
    }

    @Test
    @DisplayName("version without a time is the current snapshot")
    void currentVersion() throws Exception {
        when(datatracker.personHistory(JANE)).thenReturn(renamedTimeline());

        mockMvc.perform(get("/api/v1/people/42/version"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.name").value("Jane Doe"))
                .andExpect(jsonPath("$.validUntil").doesNotExist());
    }

    @Test
    @DisplayName("version at a time is the snapshot valid then")
    void versionAt() throws Exception {
        when(datatracker.personHistory(JANE)).thenReturn(renamedTimeline());

        mockMvc.perform(get("/api/v1/people/42/version").param("time", "2016-03-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state.name").value("Jane Roe"));
    }

    @Test
    @DisplayName("history lists every snapshot in order")
    void history() throws Exception {
        when(datatracker.personHistory(JANE)).thenReturn(renamedTimeline());

        mockMvc.perform(get("/api/v1/people/42/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identity").value("/api/v1/person/person/42/"))
                .andExpect(jsonPath("$.deleted").value(false))
                .andExpect(jsonPath("$.snapshots.length()").value(2))
                .andExpect(jsonPath("$.snapshots[0].state.name").value("Jane Roe"));
    }

    @Test
    @DisplayName("by-email delegates to the owner lookup")
    void byEmail() throws Exception {
        when(datatracker.personByEmail("jane@example.org")).thenReturn(person("Jane Doe"));

        mockMvc.perform(get("/api/v1/people/by-email").param("address", "jane@example.org"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Jane Doe"));
        verify(datatracker).personByEmail("jane@example.org");
    }

    @Test
    @DisplayName("conflicting name filters are rejected before any lookup")
    void conflictingFilters() throws Exception {
        mockMvc.perform(get("/api/v1/people").param("name", "Jane Doe").param("nameContains", "Jane"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(datatracker);
    }

    @Test
    @DisplayName("a malformed time is a 400")
    void malformedTime() throws Exception {
        mockMvc.perform(get("/api/v1/people/42/version").param("time", "yesterday"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(datatracker);
    }
}
