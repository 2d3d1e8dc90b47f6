package com.strollie.planner.model;

import java.util.Optional;
import java.util.Set;

/**
 * Anything the ranking engine can filter and sort: a bag of named values.
 */
public interface FieldSource {

    Optional<Object> field(String name);

    Set<String> fieldNames();
}
