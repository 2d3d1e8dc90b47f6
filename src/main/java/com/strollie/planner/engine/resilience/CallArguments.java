package com.strollie.planner.engine.resilience;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Named arguments of an external call. Kept sorted by name so the same logical call
 * always produces the same cache key, whatever order the caller supplied them in.
 */
public final class CallArguments {

    private static final CallArguments EMPTY = new CallArguments(new TreeMap<>());

    private final SortedMap<String, Object> values;

    private CallArguments(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    public static CallArguments of(String name, Object value) {
        return empty().with(name, value);
    }

    public static CallArguments of(String name1, Object value1, String name2, Object value2) {
        return of(name1, value1).with(name2, value2);
    }

    public static CallArguments from(Map<String, ?> arguments) {
        TreeMap<String, Object> copy = new TreeMap<>();
        arguments.forEach((name, value) -> copy.put(requireName(name), value));
        return new CallArguments(copy);
    }

    public CallArguments with(String name, Object value) {
        TreeMap<String, Object> copy = new TreeMap<>(values);
        copy.put(requireName(name), value);
        return new CallArguments(copy);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public String cacheKey(String operationName) {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", operationName + "(", ")"));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("argument name must not be blank");
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CallArguments other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
