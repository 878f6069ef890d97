package com.solverhub.capability;

import com.solverhub.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Closed vocabulary of capability categories and the feature tags each one admits.
 */
public enum CapabilityCategory {
    PROBLEM_CLASS("problem-class",
            "ACTION_BASED", "HIERARCHICAL"),

    TIME("time",
            "CONTINUOUS_TIME", "DISCRETE_TIME", "INTERMEDIATE_CONDITIONS_AND_EFFECTS",
            "TIMED_EFFECT", "TIMED_GOALS", "DURATION_INEQUALITIES"),

    NUMBERS("numbers",
            "CONTINUOUS_NUMBERS", "DISCRETE_NUMBERS"),

    TYPING("typing",
            "FLAT_TYPING", "HIERARCHICAL_TYPING"),

    CONDITIONS_KIND("conditions-kind",
            "NEGATIVE_CONDITIONS", "DISJUNCTIVE_CONDITIONS", "EQUALITY",
            "EXISTENTIAL_CONDITIONS", "UNIVERSAL_CONDITIONS"),

    EFFECTS_KIND("effects-kind",
            "CONDITIONAL_EFFECTS", "INCREASE_EFFECTS", "DECREASE_EFFECTS"),

    FLUENTS_TYPE("fluents-type",
            "NUMERIC_FLUENTS", "OBJECT_FLUENTS");

    private final String key;
    private final Set<String> vocabulary;

    CapabilityCategory(String key, String... tags) {
        this.key = key;
        this.vocabulary = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(tags)));
    }

    /**
     * Key used in YAML and JSON documents, e.g. {@code conditions-kind}.
     */
    public String key() {
        return key;
    }

    public Set<String> vocabulary() {
        return vocabulary;
    }

    public boolean admits(String tag) {
        return vocabulary.contains(tag);
    }

    /**
     * Normalize a tag the way config files spell it (case and dashes are lenient).
     *
     * @throws ConfigurationException if the tag is not part of this category
     */
    public String requireTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Empty feature tag in category '" + key + "'");
        }
        String normalized = tag.trim().toUpperCase().replace("-", "_");
        if (!admits(normalized)) {
            throw new ConfigurationException("Unknown feature tag '" + tag + "' in category '" + key
                    + "'. Allowed: " + vocabulary);
        }
        return normalized;
    }

    /**
     * Resolve a category from its key or enum name.
     *
     * @throws ConfigurationException for unknown categories
     */
    public static CapabilityCategory fromKey(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Empty capability category");
        }
        String normalized = name.trim().toUpperCase().replace("-", "_");
        for (CapabilityCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        throw new ConfigurationException("Unknown capability category '" + name + "'");
    }
}
