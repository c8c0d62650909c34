package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.model.uri.DatatrackerUri;
import com.ietfdata.model.uri.ResourceKind;
import java.util.Locale;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Validates and normalizes caller-supplied resource URIs without contacting the service. */
@RestController
@RequestMapping("/api/v1/uris")
public class UriController {

    private final Datatracker datatracker;

    public UriController(Datatracker datatracker) {
        this.datatracker = datatracker;
    }

    @GetMapping
    public ParsedUri parse(@RequestParam String kind, @RequestParam String value) {
        ResourceKind resourceKind = ResourceKind.valueOf(kind.strip().toUpperCase(Locale.ROOT).replace('-', '_'));
        DatatrackerUri<?> uri = datatracker.parse(resourceKind, value);
        return new ParsedUri(uri.kind().name(), uri.path(), uri.identifier());
    }

    public record ParsedUri(String kind, String path, String identifier) {
    }
}
