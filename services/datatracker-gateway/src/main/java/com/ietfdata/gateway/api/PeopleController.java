package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.client.query.AliasFilter;
import com.ietfdata.client.query.EmailFilter;
import com.ietfdata.client.query.PersonFilter;
import com.ietfdata.gateway.config.DatatrackerProperties;
import com.ietfdata.model.Email;
import com.ietfdata.model.Person;
import com.ietfdata.model.PersonAlias;
import com.ietfdata.model.uri.PersonUri;
import java.time.Instant;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/people")
public class PeopleController {

    private final Datatracker datatracker;
    private final DatatrackerProperties properties;

    public PeopleController(Datatracker datatracker, DatatrackerProperties properties) {
        this.datatracker = datatracker;
        this.properties = properties;
    }

    /** People filtered by exact name or name fragment and by last-modified window. */
    @GetMapping
    public ListResponse<Person> people(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String nameContains,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant until) {
        if (name != null && nameContains != null) {
            throw new IllegalArgumentException("name and nameContains are mutually exclusive");
        }
        PersonFilter filter = name != null
                ? PersonFilter.withName(name)
                : nameContains != null ? PersonFilter.withNameContaining(nameContains) : PersonFilter.all();
        if (since != null) {
            filter = filter.since(since);
        }
        if (until != null) {
            filter = filter.until(until);
        }
        return ListResponse.take(datatracker.people(filter), properties.maxListResults());
    }

    @GetMapping("/{id}")
    public Person person(@PathVariable long id) {
        return datatracker.person(PersonUri.of(id));
    }

    @GetMapping("/by-email")
    public Person personByEmail(@RequestParam String address) {
        return datatracker.personByEmail(address);
    }

    @GetMapping("/{id}/emails")
    public ListResponse<Email> emails(@PathVariable long id) {
        return ListResponse.take(datatracker.emails(EmailFilter.forPerson(PersonUri.of(id))), properties.maxListResults());
    }

    @GetMapping("/{id}/aliases")
    public ListResponse<PersonAlias> aliases(@PathVariable long id) {
        return ListResponse.take(datatracker.aliases(AliasFilter.forPerson(PersonUri.of(id))), properties.maxListResults());
    }

    @GetMapping("/{id}/history")
    public TimelineResponse<Person> history(@PathVariable long id) {
        return TimelineResponse.of(datatracker.personHistory(PersonUri.of(id)));
    }

    /** The version of a person that was valid at {@code time}, or the current one without it. */
    @GetMapping("/{id}/version")
    public TimelineResponse.SnapshotResponse<Person> version(
            @PathVariable long id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant time) {
        var timeline = datatracker.personHistory(PersonUri.of(id));
        return TimelineResponse.SnapshotResponse.of(time == null ? timeline.current() : timeline.at(time));
    }
}
