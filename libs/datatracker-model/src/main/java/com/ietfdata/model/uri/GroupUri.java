package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.Group;

/** Reference to a working group, research group, area or other group. */
public record GroupUri(String path) implements DatatrackerUri<Group>, Comparable<GroupUri> {

    public GroupUri {
        path = ResourceKind.GROUP.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GroupUri parse(String value) {
        return new GroupUri(value);
    }

    public static GroupUri of(long id) {
        return new GroupUri(ResourceKind.GROUP.pathFor(Long.toString(id)));
    }

    public long id() {
        return Long.parseLong(identifier());
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.GROUP;
    }

    @Override
    public Class<Group> entityType() {
        return Group.class;
    }

    @Override
    public int compareTo(GroupUri other) {
        return Long.compare(id(), other.id());
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
