package com.solverhub.solver;

import com.solverhub.capability.CapabilityDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Registry of solvers keyed by name. Roles are resolved once, at registration.
 */
public interface SolverRegistry {

    /**
     * @throws com.solverhub.exception.ConfigurationException if a solver with the same name is registered
     */
    void register(Solver solver);

    Optional<Solver> get(String name);

    /**
     * All solvers, in registration order.
     */
    List<Solver> solvers();

    List<Solver> withRole(SolverRole role);

    /**
     * First solver, in registration order, that has the role and whose
     * capabilities subsume {@code problemKind}.
     */
    Optional<Solver> select(CapabilityDescriptor problemKind, SolverRole role);

    /**
     * Like {@link #select} but fails when nothing matches.
     *
     * @throws com.solverhub.exception.UnsupportedProblemException if no solver supports the kind
     */
    Solver require(CapabilityDescriptor problemKind, SolverRole role);

    /**
     * Destroy every registered solver.
     */
    void destroyAll();
}
