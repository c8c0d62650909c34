package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.GroupState;

/** Reference to a group state name, e.g. {@code /api/v1/name/groupstatename/active/}. */
public record GroupStateUri(String path) implements DatatrackerUri<GroupState>, Comparable<GroupStateUri> {

    public GroupStateUri {
        path = ResourceKind.GROUP_STATE.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GroupStateUri parse(String value) {
        return new GroupStateUri(value);
    }

    public static GroupStateUri of(String slug) {
        return new GroupStateUri(ResourceKind.GROUP_STATE.pathFor(slug));
    }

    public String slug() {
        return identifier();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.GROUP_STATE;
    }

    @Override
    public Class<GroupState> entityType() {
        return GroupState.class;
    }

    @Override
    public int compareTo(GroupStateUri other) {
        return path.compareTo(other.path);
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
