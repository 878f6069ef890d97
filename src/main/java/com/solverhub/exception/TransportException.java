package com.solverhub.exception;

/**
 * Thrown when a solver endpoint cannot be reached or its process cannot be
 * launched. Always fatal to the attempt. Carries the address and problem
 * locator so the attempt can be reproduced.
 */
public class TransportException extends SolverHubException {

    private final String address;
    private final String problemLocator;

    public TransportException(String message, String address, String problemLocator, Throwable cause) {
        super(message + " [address=" + address + ", problem=" + problemLocator + "]", cause);
        this.address = address;
        this.problemLocator = problemLocator;
    }

    public String getAddress() {
        return address;
    }

    public String getProblemLocator() {
        return problemLocator;
    }
}
