package com.solverhub.exception;

/**
 * Raised inside a solver when it ran but crashed or returned garbage.
 * Converted to a {@code Failure} outcome at the solver boundary.
 */
public class SolveFailureException extends SolverHubException {

    public SolveFailureException(String message) {
        super(message);
    }

    public SolveFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
