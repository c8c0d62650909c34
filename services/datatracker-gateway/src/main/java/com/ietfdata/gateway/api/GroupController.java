package com.ietfdata.gateway.api;

import com.ietfdata.client.Datatracker;
import com.ietfdata.client.query.GroupFilter;
import com.ietfdata.gateway.config.DatatrackerProperties;
import com.ietfdata.model.Group;
import com.ietfdata.model.uri.GroupStateUri;
import com.ietfdata.model.uri.GroupTypeUri;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/groups")
public class GroupController {

    private final Datatracker datatracker;
    private final DatatrackerProperties properties;

    public GroupController(Datatracker datatracker, DatatrackerProperties properties) {
        this.datatracker = datatracker;
        this.properties = properties;
    }

    /**
     * Groups by name fragment, state slug (e.g. {@code active}) and type slug (e.g. {@code wg}).
     */
    @GetMapping
    public ListResponse<Group> groups(
            @RequestParam(required = false) String nameContains,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String type) {
        GroupFilter filter = nameContains != null ? GroupFilter.withNameContaining(nameContains) : GroupFilter.all();
        if (state != null) {
            filter = filter.inState(GroupStateUri.of(state));
        }
        if (type != null) {
            filter = filter.ofType(GroupTypeUri.of(type));
        }
        return ListResponse.take(datatracker.groups(filter), properties.maxListResults());
    }

    @GetMapping("/{acronym}")
    public Group group(@PathVariable String acronym) {
        return datatracker.group(acronym);
    }
}
