package com.solverhub.solver;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.problem.ProblemInstance;
import com.solverhub.protocol.SolveOutcome;

import java.util.Set;

/**
 * A pluggable planning solver: identity, static capability advertisement and
 * the solve/destroy lifecycle.
 */
public interface Solver {

    /**
     * Stable, non-empty name, used as registry key.
     */
    String name();

    /**
     * Capabilities this solver supports. Pure and callable before any solve.
     */
    CapabilityDescriptor capabilities();

    /**
     * Roles this solver fulfils. Fixed for the lifetime of the instance.
     */
    Set<SolverRole> roles();

    SolverState state();

    default boolean isOneshotPlanner() {
        return roles().contains(SolverRole.ONESHOT_PLANNER);
    }

    default boolean isPlanValidator() {
        return roles().contains(SolverRole.PLAN_VALIDATOR);
    }

    default boolean isGrounder() {
        return roles().contains(SolverRole.GROUNDER);
    }

    /**
     * Whether a problem requiring {@code problemKind} is within this solver's capabilities.
     */
    default boolean supports(CapabilityDescriptor problemKind) {
        return capabilities().supports(problemKind);
    }

    /**
     * Acquire the resources the solver needs (address lease, connection, executable checks).
     *
     * @throws com.solverhub.exception.ConfigurationException if the solver cannot become ready;
     *         the solver is then INVALID
     */
    void open();

    /**
     * Solve a problem. Blocks until the underlying process or request completes.
     *
     * @return {@code Unsupported} when the problem's kind is not supported,
     *         otherwise the outcome reported by the solver
     * @throws com.solverhub.exception.ContractViolationException if the solver is not READY
     *         or is not a oneshot planner
     * @throws com.solverhub.exception.TransportException if the solver could not be reached or launched
     */
    SolveOutcome solve(ProblemInstance problem);

    /**
     * Release every process, connection and address held by this solver.
     * Safe to call more than once, and on a solver whose open failed.
     */
    void destroy();
}
