package com.solverhub.exception;

/**
 * Thrown when the solver executable cannot be built or located.
 */
public class BuildFailedException extends SolverHubException {

    private final int exitCode;

    public BuildFailedException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public BuildFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int getExitCode() {
        return exitCode;
    }
}
