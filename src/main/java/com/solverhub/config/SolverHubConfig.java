package com.solverhub.config;

import java.util.List;
import java.util.Optional;

/**
 * Root configuration.
 *
 * @param name     Deployment name
 * @param version  Configuration version
 * @param endpoint Endpoint settings
 * @param solvers  Solver specifications, in registration order
 * @param harness  Validation harness settings, may be null
 */
public record SolverHubConfig(
        String name,
        String version,
        EndpointConfig endpoint,
        List<SolverSpec> solvers,
        HarnessConfig harness
) {
    public Optional<SolverSpec> getSolver(String name) {
        return solvers.stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }
}
