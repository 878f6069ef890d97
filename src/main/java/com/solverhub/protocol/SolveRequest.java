package com.solverhub.protocol;

import com.solverhub.capability.CapabilityDescriptor;

import java.util.Objects;

/**
 * One solve attempt against an endpoint. Built fresh per call, never retained.
 *
 * @param address        Endpoint the request is sent to
 * @param problemLocator Opaque locator of the serialized problem (a file path in local deployments)
 * @param requiredKind   Capabilities the problem requires
 */
public record SolveRequest(
        EndpointAddress address,
        String problemLocator,
        CapabilityDescriptor requiredKind
) {
    public SolveRequest {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(problemLocator, "problemLocator");
        requiredKind = requiredKind != null ? requiredKind : CapabilityDescriptor.empty();
    }
}
