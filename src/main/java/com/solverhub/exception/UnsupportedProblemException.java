package com.solverhub.exception;

import com.solverhub.capability.CapabilityDescriptor;

/**
 * Thrown when no solver advertises capabilities that subsume a problem's
 * required kind.
 */
public class UnsupportedProblemException extends SolverHubException {

    private final CapabilityDescriptor requiredKind;

    public UnsupportedProblemException(String message, CapabilityDescriptor requiredKind) {
        super(message);
        this.requiredKind = requiredKind;
    }

    public CapabilityDescriptor getRequiredKind() {
        return requiredKind;
    }
}
