package com.solverhub.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration of one solver.
 *
 * @param name    Unique solver name
 * @param type    Factory type, e.g. {@code process} or {@code remote}
 * @param options Factory-specific options, validated by the factory
 */
public record SolverSpec(String name, String type, Map<String, Object> options) {

    public SolverSpec {
        options = options != null ? Collections.unmodifiableMap(new LinkedHashMap<>(options)) : Map.of();
    }
}
