package com.solverhub.process;

/**
 * Result of a finished process.
 *
 * @param exitCode Exit code, meaningless if {@code timedOut}
 * @param output   Combined stdout/stderr
 * @param timedOut Whether the process was killed after exceeding its timeout
 */
public record ProcessResult(int exitCode, String output, boolean timedOut) {

    public static ProcessResult exited(int exitCode, String output) {
        return new ProcessResult(exitCode, output, false);
    }

    public static ProcessResult timeout(String output) {
        return new ProcessResult(-1, output, true);
    }
}
