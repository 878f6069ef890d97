package com.solverhub.capability;

import com.solverhub.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of feature tags per capability category, describing either what a
 * problem requires or what a solver supports.
 * <p>
 * Descriptors are ordered by subsumption: {@code A <= B} iff every category
 * present in {@code A} has its tag set contained in the tag set {@code B}
 * declares for that category. A category absent from {@code B} contributes
 * no tags. A declared category with no tags is distinct from an absent one:
 * it shows up in {@link #declares}, {@link #toMap()} and equality.
 * <p>
 * Immutable after {@link Builder#build()}.
 */
public final class CapabilityDescriptor {

    private static final CapabilityDescriptor EMPTY = new CapabilityDescriptor(new EnumMap<>(CapabilityCategory.class));

    private final Map<CapabilityCategory, Set<String>> features;

    private CapabilityDescriptor(Map<CapabilityCategory, Set<String>> source) {
        EnumMap<CapabilityCategory, Set<String>> copy = new EnumMap<>(CapabilityCategory.class);
        for (Map.Entry<CapabilityCategory, Set<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        this.features = Collections.unmodifiableMap(copy);
    }

    /**
     * Descriptor with no categories: asserts no requirement.
     */
    public static CapabilityDescriptor empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Whether a problem with the given required kind can be handled by the
     * holder of this descriptor, i.e. {@code problemKind <= this}.
     */
    public boolean supports(CapabilityDescriptor problemKind) {
        return problemKind.isSubsumedBy(this);
    }

    public boolean isSubsumedBy(CapabilityDescriptor other) {
        for (Map.Entry<CapabilityCategory, Set<String>> entry : features.entrySet()) {
            Set<String> available = other.features.getOrDefault(entry.getKey(), Set.of());
            if (!available.containsAll(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Tags of this descriptor that {@code available} does not cover.
     * Empty when {@code this <= available}.
     */
    public CapabilityDescriptor unsupportedBy(CapabilityDescriptor available) {
        Builder missing = builder();
        for (Map.Entry<CapabilityCategory, Set<String>> entry : features.entrySet()) {
            Set<String> covered = available.features.getOrDefault(entry.getKey(), Set.of());
            for (String tag : entry.getValue()) {
                if (!covered.contains(tag)) {
                    missing.set(entry.getKey(), tag);
                }
            }
        }
        return missing.build();
    }

    public boolean declares(CapabilityCategory category) {
        return features.containsKey(category);
    }

    public Optional<Set<String>> tags(CapabilityCategory category) {
        return Optional.ofNullable(features.get(category));
    }

    public boolean has(CapabilityCategory category, String tag) {
        Set<String> tags = features.get(category);
        return tags != null && tags.contains(tag);
    }

    public Set<CapabilityCategory> categories() {
        return features.keySet();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    /**
     * YAML/JSON shape: category key to sorted tag list.
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (Map.Entry<CapabilityCategory, Set<String>> entry : features.entrySet()) {
            map.put(entry.getKey().key(), new ArrayList<>(entry.getValue()));
        }
        return map;
    }

    /**
     * Parse the {@code {category: [tags]}} shape used by problem files,
     * solver configs and wire envelopes. A {@code null} map is an empty descriptor.
     *
     * @throws ConfigurationException on unknown categories, unknown tags or malformed values
     */
    public static CapabilityDescriptor parse(Map<String, ?> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            CapabilityCategory category = CapabilityCategory.fromKey(entry.getKey());
            builder.declare(category);
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Collection<?> tags) {
                for (Object tag : tags) {
                    builder.set(category, String.valueOf(tag));
                }
            } else if (value instanceof String tag) {
                builder.set(category, tag);
            } else {
                throw new ConfigurationException("Category '" + entry.getKey()
                        + "' must be a list of feature tags, got: " + value);
            }
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapabilityDescriptor that)) return false;
        return features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return features.hashCode();
    }

    @Override
    public String toString() {
        return "CapabilityDescriptor" + toMap();
    }

    /**
     * Builder for CapabilityDescriptor. Tags are validated as they are added.
     */
    public static class Builder {
        private final Map<CapabilityCategory, Set<String>> features = new EnumMap<>(CapabilityCategory.class);

        private Builder() {
        }

        /**
         * Enable a feature tag.
         *
         * @throws ConfigurationException if the tag is not in the category's vocabulary
         */
        public Builder set(CapabilityCategory category, String tag) {
            String normalized = category.requireTag(tag);
            features.computeIfAbsent(category, c -> new LinkedHashSet<>()).add(normalized);
            return this;
        }

        public Builder set(String category, String tag) {
            return set(CapabilityCategory.fromKey(category), tag);
        }

        /**
         * Mark a category as present even if no tag is ever added to it.
         */
        public Builder declare(CapabilityCategory category) {
            features.computeIfAbsent(category, c -> new LinkedHashSet<>());
            return this;
        }

        public Builder merge(CapabilityDescriptor other) {
            for (Map.Entry<CapabilityCategory, Set<String>> entry : other.features.entrySet()) {
                declare(entry.getKey());
                features.get(entry.getKey()).addAll(entry.getValue());
            }
            return this;
        }

        public CapabilityDescriptor build() {
            return new CapabilityDescriptor(features);
        }
    }
}
