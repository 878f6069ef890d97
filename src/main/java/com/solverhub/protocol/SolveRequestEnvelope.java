package com.solverhub.protocol;

import com.solverhub.capability.CapabilityDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /plan}.
 *
 * @param problemLocator Locator of the serialized problem, resolved on the endpoint side
 * @param requiredKind   Capabilities the client computed for the problem; may be null
 */
public record SolveRequestEnvelope(String problemLocator, Map<String, List<String>> requiredKind) {

    public static SolveRequestEnvelope from(SolveRequest request) {
        return new SolveRequestEnvelope(request.problemLocator(), request.requiredKind().toMap());
    }

    public CapabilityDescriptor requiredKindDescriptor() {
        return CapabilityDescriptor.parse(requiredKind);
    }
}
