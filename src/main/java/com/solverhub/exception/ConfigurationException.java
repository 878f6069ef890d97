package com.solverhub.exception;

/**
 * Thrown when configuration is invalid: unrecognized solver options, duplicate
 * solver names, unknown capability tags or malformed config files.
 * Never recovered; construction fails fast.
 */
public class ConfigurationException extends SolverHubException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
