package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.client.query.DocumentFilter;
import com.ietfdata.gateway.config.DatatrackerProperties;
import com.ietfdata.model.Document;
import com.ietfdata.model.Group;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    private final Datatracker datatracker;
    private final DatatrackerProperties properties;

    public DocumentController(Datatracker datatracker, DatatrackerProperties properties) {
        this.datatracker = datatracker;
        this.properties = properties;
    }

    /** Documents by title fragment, or every document of the group with the given acronym. */
    @GetMapping
    public ListResponse<Document> documents(
            @RequestParam(required = false) String titleContains,
            @RequestParam(required = false) String group) {
        if (titleContains != null && group != null) {
            throw new IllegalArgumentException("titleContains and group are mutually exclusive");
        }
        DocumentFilter filter;
        if (group != null) {
            Group owner = datatracker.group(group);
            filter = DocumentFilter.inGroup(owner.resourceUri());
        } else if (titleContains != null) {
            filter = DocumentFilter.withTitleContaining(titleContains);
        } else {
            filter = DocumentFilter.all();
        }
        return ListResponse.take(datatracker.documents(filter), properties.maxListResults());
    }

    @GetMapping("/{name}")
    public Document document(@PathVariable String name) {
        return datatracker.document(name);
    }
}
