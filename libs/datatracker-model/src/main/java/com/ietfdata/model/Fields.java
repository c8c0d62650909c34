package com.ietfdata.model;

import java.util.List;

/** Compact-constructor checks shared by the entity records. */
final class Fields {

    private Fields() {
        // utility class
    }

    static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("missing required field '" + field + "'");
        }
        return value;
    }

    static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
