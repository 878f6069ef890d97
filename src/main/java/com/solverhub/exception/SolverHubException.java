package com.solverhub.exception;

/**
 * Base exception for the solver hub.
 */
public class SolverHubException extends RuntimeException {

    public SolverHubException(String message) {
        super(message);
    }

    public SolverHubException(String message, Throwable cause) {
        super(message, cause);
    }
}
