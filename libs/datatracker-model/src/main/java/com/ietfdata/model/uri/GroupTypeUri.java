package com.ietfdata.model.uri;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ietfdata.model.GroupType;

/** Reference to a group type name, e.g. {@code /api/v1/name/grouptypename/wg/}. */
public record GroupTypeUri(String path) implements DatatrackerUri<GroupType>, Comparable<GroupTypeUri> {

    public GroupTypeUri {
        path = ResourceKind.GROUP_TYPE.normalize(path);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static GroupTypeUri parse(String value) {
        return new GroupTypeUri(value);
    }

    public static GroupTypeUri of(String slug) {
        return new GroupTypeUri(ResourceKind.GROUP_TYPE.pathFor(slug));
    }

    public String slug() {
        return identifier();
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.GROUP_TYPE;
    }

    @Override
    public Class<GroupType> entityType() {
        return GroupType.class;
    }

    @Override
    public int compareTo(GroupTypeUri other) {
        return path.compareTo(other.path);
    }

    @JsonValue
    @Override
    public String toString() {
        return path;
    }
}
