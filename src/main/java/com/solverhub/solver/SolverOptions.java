package com.solverhub.solver;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated construction options of a solver. Unrecognized keys fail fast.
 */
public final class SolverOptions {

    public static final String SUPPORTED_KIND = "supported-kind";

    private final String solverName;
    private final Map<String, Object> values;

    private SolverOptions(String solverName, Map<String, Object> values) {
        this.solverName = solverName;
        this.values = values;
    }

    /**
     * @throws ConfigurationException if any key is not in {@code recognized}
     */
    public static SolverOptions validate(String solverName, Map<String, Object> options, Set<String> recognized) {
        Map<String, Object> copy = options != null ? new HashMap<>(options) : new HashMap<>();
        Set<String> unknown = new TreeSet<>(copy.keySet());
        unknown.removeAll(recognized);
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Solver '" + solverName + "' does not recognize options "
                    + unknown + ". Recognized: " + new TreeSet<>(recognized));
        }
        return new SolverOptions(solverName, Collections.unmodifiableMap(copy));
    }

    public String solverName() {
        return solverName;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public String requireString(String key) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Solver '" + solverName + "' requires option '" + key + "'");
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Solver '" + solverName + "' option '" + key
                    + "' must be an integer, got: " + value, e);
        }
    }

    /**
     * Duration from a whole number of seconds; zero or absent means none.
     */
    public Duration getSeconds(String key) {
        int seconds = getInt(key, 0);
        return seconds > 0 ? Duration.ofSeconds(seconds) : null;
    }

    @SuppressWarnings("unchecked")
    public CapabilityDescriptor getCapabilities(String key) {
        Object value = values.get(key);
        if (value == null) {
            return CapabilityDescriptor.empty();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Solver '" + solverName + "' option '" + key + "' must be a mapping");
        }
        return CapabilityDescriptor.parse((Map<String, ?>) value);
    }
}
