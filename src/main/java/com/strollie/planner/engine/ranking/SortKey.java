package com.strollie.planner.engine.ranking;

import com.strollie.planner.model.FieldSource;

import java.util.Comparator;

/**
 * One sort field with its direction. Records missing the field sort last in either direction.
 */
public record SortKey(String field, boolean ascending) {

    public static SortKey asc(String field) {
        return new SortKey(field, true);
    }

    public static SortKey desc(String field) {
        return new SortKey(field, false);
    }

    <T extends FieldSource> Comparator<T> comparator() {
        return (left, right) -> {
            Object a = left.field(field).orElse(null);
            Object b = right.field(field).orElse(null);
            if (a == null && b == null) return 0;
            if (a == null) return 1;
            if (b == null) return -1;
            int c = FieldValues.compare(field, a, b);
            return ascending ? c : -c;
        };
    }
}
