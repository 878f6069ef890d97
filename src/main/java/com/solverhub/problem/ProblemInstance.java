package com.solverhub.problem;

import com.solverhub.capability.CapabilityDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A loaded problem. The body is opaque to the hub and forwarded to solvers as is.
 *
 * @param name         Problem name
 * @param locator      Where the serialized problem lives (passed on to endpoints)
 * @param requiredKind Capabilities the problem requires
 * @param body         Remaining problem content
 */
public record ProblemInstance(
        String name,
        String locator,
        CapabilityDescriptor requiredKind,
        Map<String, Object> body
) {
    public ProblemInstance {
        requiredKind = requiredKind != null ? requiredKind : CapabilityDescriptor.empty();
        body = body != null ? Collections.unmodifiableMap(new LinkedHashMap<>(body)) : Map.of();
    }

    /**
     * Problem known only by locator, e.g. an encoding the hub cannot read.
     * Asserts no requirement.
     */
    public static ProblemInstance opaque(String name, String locator) {
        return new ProblemInstance(name, locator, CapabilityDescriptor.empty(), Map.of());
    }
}
