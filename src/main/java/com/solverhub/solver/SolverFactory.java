package com.solverhub.solver;

import java.util.Map;
import java.util.Set;

/**
 * Creates solvers of one type from configuration options.
 */
public interface SolverFactory {

    /**
     * Type name referenced by the {@code type} key of a solver config.
     */
    String type();

    Set<String> recognizedOptions();

    /**
     * Create a solver in state CREATED.
     *
     * @throws com.solverhub.exception.ConfigurationException on unrecognized or invalid options
     */
    Solver create(String name, Map<String, Object> options);
}
