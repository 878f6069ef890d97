package com.solverhub;

/**
 * What the process does once started.
 */
public enum LaunchMode {
    /** Serve {@code POST /plan} until stopped. */
    SERVE,
    /** Solve the problem given by {@code --file-path}, print the response and exit. */
    ONESHOT,
    /** Run the validation harness and exit. */
    HARNESS;

    public String propertyValue() {
        return name().toLowerCase();
    }
}
