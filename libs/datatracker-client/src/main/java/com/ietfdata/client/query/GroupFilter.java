package com.ietfdata.client.query;

import com.ietfdata.model.Group;
import com.ietfdata.model.uri.GroupStateUri;
import com.ietfdata.model.uri.GroupTypeUri;

/** Filters over {@code /api/v1/group/group/}. */
public record GroupFilter(QueryParameters parameters) implements QueryFilter<Group> {

    public GroupFilter {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters must not be null");
        }
    }

    public static GroupFilter all() {
        return new GroupFilter(QueryParameters.empty());
    }

    public static GroupFilter withAcronym(String acronym) {
        return new GroupFilter(QueryParameters.empty().with("acronym", acronym));
    }

    public static GroupFilter withNameContaining(String fragment) {
        return new GroupFilter(QueryParameters.empty().with("name__contains", fragment));
    }

    public GroupFilter inState(GroupStateUri state) {
        return new GroupFilter(parameters.with("state", state));
    }

    public GroupFilter ofType(GroupTypeUri type) {
        return new GroupFilter(parameters.with("type", type));
    }

    @Override
    public ResourceType<Group> resourceType() {
        return ResourceType.GROUP;
    }
}
