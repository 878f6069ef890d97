package com.solverhub.harness;

import java.util.List;

/**
 * Result of a harness run.
 *
 * @param solved     Instances that returned a plan, in order
 * @param failure    Instance that halted the run, {@code null} if none did
 * @param buildError Why the executable could not be obtained, {@code null} if it was
 */
public record HarnessReport(List<String> solved, InstanceFailure failure, String buildError) {

    public HarnessReport {
        solved = List.copyOf(solved);
    }

    public static HarnessReport succeeded(List<String> solved) {
        return new HarnessReport(solved, null, null);
    }

    public static HarnessReport failed(List<String> solved, InstanceFailure failure) {
        return new HarnessReport(solved, failure, null);
    }

    public static HarnessReport buildFailed(String error) {
        return new HarnessReport(List.of(), null, error);
    }

    public boolean successful() {
        return failure == null && buildError == null;
    }

    public int exitCode() {
        return successful() ? 0 : 1;
    }

    public String summary() {
        if (buildError != null) {
            return "Build failed: " + buildError;
        }
        if (failure != null) {
            return "Failed on " + failure + " after " + solved.size() + " solved";
        }
        return "All " + solved.size() + " instances solved";
    }
}
