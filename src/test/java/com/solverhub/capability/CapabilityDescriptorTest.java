package com.solverhub.capability;

import com.solverhub.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CapabilityDescriptor and its subsumption order.
 */
class CapabilityDescriptorTest {

    private static CapabilityDescriptor ariesKind() {
        return CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING")
                .set(CapabilityCategory.TYPING, "HIERARCHICAL_TYPING")
                .set(CapabilityCategory.CONDITIONS_KIND, "EQUALITY")
                .set(CapabilityCategory.CONDITIONS_KIND, "UNIVERSAL_CONDITIONS")
                .build();
    }

    // ===== Subsumption =====

    @Test
    @DisplayName("Should support a problem whose tags are a subset")
    void shouldSupportSubset() {
        CapabilityDescriptor problem = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING")
                .set(CapabilityCategory.CONDITIONS_KIND, "EQUALITY")
                .build();

        assertTrue(ariesKind().supports(problem));
        assertTrue(problem.isSubsumedBy(ariesKind()));
        assertFalse(problem.supports(ariesKind()));
    }

    @Test
    @DisplayName("Should not support a problem needing a tag the solver lacks")
    void shouldRejectMissingTag() {
        CapabilityDescriptor problem = CapabilityDescriptor.builder()
                .set(CapabilityCategory.CONDITIONS_KIND, "NEGATIVE_CONDITIONS")
                .build();

        assertFalse(ariesKind().supports(problem));
    }

    @Test
    @DisplayName("Category absent from the solver supports nothing in it")
    void absentCategoryContributesNothing() {
        CapabilityDescriptor problem = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TIME, "CONTINUOUS_TIME")
                .build();

        assertFalse(ariesKind().supports(problem));
    }

    @Test
    @DisplayName("Empty descriptor is supported by everything")
    void emptyIsBottom() {
        assertTrue(ariesKind().supports(CapabilityDescriptor.empty()));
        assertTrue(CapabilityDescriptor.empty().supports(CapabilityDescriptor.empty()));
    }

    @Test
    @DisplayName("Declared but empty category is supported by a solver without it")
    void emptyDeclaredCategoryIsSupported() {
        CapabilityDescriptor problem = CapabilityDescriptor.builder()
                .declare(CapabilityCategory.NUMBERS)
                .build();

        assertTrue(ariesKind().supports(problem));
    }

    @Test
    @DisplayName("Subsumption is reflexive")
    void reflexive() {
        CapabilityDescriptor kind = ariesKind();
        assertTrue(kind.supports(kind));
    }

    @Test
    @DisplayName("Subsumption is transitive")
    void transitive() {
        CapabilityDescriptor a = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING")
                .build();
        CapabilityDescriptor b = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING")
                .set(CapabilityCategory.CONDITIONS_KIND, "EQUALITY")
                .build();
        CapabilityDescriptor c = ariesKind();

        assertTrue(a.isSubsumedBy(b));
        assertTrue(b.isSubsumedBy(c));
        assertTrue(a.isSubsumedBy(c));
    }

    // ===== Empty vs absent =====

    @Test
    @DisplayName("Declared empty category differs from an absent one")
    void emptyCategoryIsNotAbsent() {
        CapabilityDescriptor declared = CapabilityDescriptor.builder()
                .declare(CapabilityCategory.NUMBERS)
                .build();

        assertTrue(declared.declares(CapabilityCategory.NUMBERS));
        assertFalse(CapabilityDescriptor.empty().declares(CapabilityCategory.NUMBERS));
        assertNotEquals(CapabilityDescriptor.empty(), declared);
        assertEquals(Map.of("numbers", List.of()), declared.toMap());
        assertEquals(Set.of(), declared.tags(CapabilityCategory.NUMBERS).orElseThrow());
        assertTrue(CapabilityDescriptor.empty().tags(CapabilityCategory.NUMBERS).isEmpty());
    }

    // ===== Vocabulary =====

    @Test
    @DisplayName("Should reject a tag outside the category vocabulary")
    void shouldRejectUnknownTag() {
        CapabilityDescriptor.Builder builder = CapabilityDescriptor.builder();
        assertThrows(ConfigurationException.class,
                () -> builder.set(CapabilityCategory.TYPING, "EQUALITY"));
    }

    @Test
    @DisplayName("Should reject an unknown category")
    void shouldRejectUnknownCategory() {
        assertThrows(ConfigurationException.class,
                () -> CapabilityDescriptor.builder().set("planning-horizon", "FLAT_TYPING"));
    }

    @ParameterizedTest
    @CsvSource({
            "typing, flat-typing, FLAT_TYPING",
            "conditions-kind, Universal_Conditions, UNIVERSAL_CONDITIONS",
            "CONDITIONS_KIND, equality, EQUALITY",
            "fluents-type, numeric-fluents, NUMERIC_FLUENTS"
    })
    @DisplayName("Should normalize category and tag spelling")
    void shouldNormalizeSpelling(String category, String tag, String expected) {
        CapabilityDescriptor kind = CapabilityDescriptor.builder().set(category, tag).build();
        assertTrue(kind.has(CapabilityCategory.fromKey(category), expected));
    }

    // ===== Parsing =====

    @Test
    @DisplayName("Should parse the category-to-tags map shape")
    void shouldParseMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("typing", List.of("FLAT_TYPING", "HIERARCHICAL_TYPING"));
        map.put("conditions-kind", "EQUALITY");
        map.put("numbers", null);

        CapabilityDescriptor kind = CapabilityDescriptor.parse(map);

        assertTrue(kind.has(CapabilityCategory.TYPING, "HIERARCHICAL_TYPING"));
        assertTrue(kind.has(CapabilityCategory.CONDITIONS_KIND, "EQUALITY"));
        assertTrue(kind.declares(CapabilityCategory.NUMBERS));
        assertEquals(3, kind.categories().size());
    }

    @Test
    @DisplayName("Should reject a malformed category value")
    void shouldRejectMalformedValue() {
        assertThrows(ConfigurationException.class,
                () -> CapabilityDescriptor.parse(Map.of("typing", 42)));
    }

    @Test
    @DisplayName("toMap and parse agree")
    void toMapParsesBack() {
        assertEquals(ariesKind(), CapabilityDescriptor.parse(ariesKind().toMap()));
    }

    @Test
    @DisplayName("Should list the tags a solver does not cover")
    void shouldComputeUnsupportedTags() {
        CapabilityDescriptor problem = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING")
                .set(CapabilityCategory.CONDITIONS_KIND, "NEGATIVE_CONDITIONS")
                .set(CapabilityCategory.TIME, "CONTINUOUS_TIME")
                .build();

        CapabilityDescriptor missing = problem.unsupportedBy(ariesKind());

        assertEquals(Map.of(
                "time", List.of("CONTINUOUS_TIME"),
                "conditions-kind", List.of("NEGATIVE_CONDITIONS")), missing.toMap());
        assertTrue(ariesKind().unsupportedBy(ariesKind()).isEmpty());
    }

    @Test
    @DisplayName("Built descriptor is unaffected by later builder changes")
    void builtDescriptorIsImmutable() {
        CapabilityDescriptor.Builder builder = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TYPING, "FLAT_TYPING");
        CapabilityDescriptor built = builder.build();
        builder.set(CapabilityCategory.TYPING, "HIERARCHICAL_TYPING");

        assertFalse(built.has(CapabilityCategory.TYPING, "HIERARCHICAL_TYPING"));
        assertThrows(UnsupportedOperationException.class,
                () -> built.tags(CapabilityCategory.TYPING).orElseThrow().add("HIERARCHICAL_TYPING"));
    }
}
