package com.solverhub.harness;

/**
 * The instance that stopped a harness run.
 *
 * @param instance Instance name
 * @param command  Command line issued for it
 * @param observed Observed outcome or launch error
 */
public record InstanceFailure(String instance, String command, String observed) {

    @Override
    public String toString() {
        return instance + ": " + observed + " [" + command + "]";
    }
}
