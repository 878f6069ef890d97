package com.solverhub.solver;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.exception.ContractViolationException;
import com.solverhub.exception.SolveFailureException;
import com.solverhub.problem.ProblemInstance;
import com.solverhub.protocol.SolveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Base class enforcing the solver lifecycle and the capability gate.
 * Subclasses implement {@link #doOpen()}, {@link #doSolve} and {@link #doDestroy()}.
 * Solves on one instance are serialized.
 */
public abstract class AbstractSolver implements Solver {

    private static final Logger log = LoggerFactory.getLogger(AbstractSolver.class);

    private final String name;
    private final CapabilityDescriptor capabilities;
    private final Set<SolverRole> roles;
    private final Object solveLock = new Object();

    private volatile SolverState state = SolverState.CREATED;

    protected AbstractSolver(String name, CapabilityDescriptor capabilities, Set<SolverRole> roles) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Solver name must not be empty");
        }
        this.name = name;
        this.capabilities = capabilities != null ? capabilities : CapabilityDescriptor.empty();
        this.roles = roles == null || roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final CapabilityDescriptor capabilities() {
        return capabilities;
    }

    @Override
    public final Set<SolverRole> roles() {
        return roles;
    }

    @Override
    public final SolverState state() {
        return state;
    }

    @Override
    public final synchronized void open() {
        if (state != SolverState.CREATED) {
            throw new ContractViolationException("Solver '" + name + "' cannot be opened in state " + state);
        }
        try {
            doOpen();
            state = SolverState.READY;
            log.info("Solver '{}' ready (roles={}, capabilities={})", name, roles, capabilities.toMap());
        } catch (RuntimeException e) {
            state = SolverState.INVALID;
            log.error("Solver '{}' failed to open: {}", name, e.getMessage());
            try {
                doDestroy();
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    @Override
    public final SolveOutcome solve(ProblemInstance problem) {
        ensureReady();
        if (!isOneshotPlanner()) {
            throw new ContractViolationException("Solver '" + name + "' is not a oneshot planner (roles=" + roles + ")");
        }
        if (!supports(problem.requiredKind())) {
            String reason = "Problem '" + problem.name() + "' requires "
                    + problem.requiredKind().unsupportedBy(capabilities).toMap()
                    + " which solver '" + name + "' does not support";
            log.info(reason);
            return SolveOutcome.unsupported(reason);
        }

        synchronized (solveLock) {
            ensureReady();
            SolveOutcome outcome;
            try {
                log.debug("Solver '{}' solving '{}'", name, problem.name());
                outcome = doSolve(problem);
            } catch (SolveFailureException e) {
                log.warn("Solver '{}' failed on '{}': {}", name, problem.name(), e.getMessage());
                outcome = SolveOutcome.failure(e.getMessage());
            }
            if (state == SolverState.DESTROYED) {
                throw new ContractViolationException("Solver '" + name + "' was destroyed while solving '"
                        + problem.name() + "'");
            }
            log.info("Solver '{}' on '{}': {}", name, problem.name(), outcome.describe());
            return outcome;
        }
    }

    @Override
    public final void destroy() {
        synchronized (this) {
            if (state != SolverState.READY && state != SolverState.CREATED) {
                log.debug("Solver '{}' already {}, destroy is a no-op", name, state);
                return;
            }
            state = SolverState.DESTROYED;
        }
        doDestroy();
        log.info("Solver '{}' destroyed", name);
    }

    private void ensureReady() {
        SolverState current = state;
        if (current != SolverState.READY) {
            throw new ContractViolationException("Solver '" + name + "' cannot solve in state " + current);
        }
    }

    /**
     * Acquire resources. Throwing leaves the solver INVALID; {@link #doDestroy()}
     * is then called to release anything partially acquired.
     */
    protected abstract void doOpen();

    /**
     * Solve a problem already known to be supported. Throw
     * {@link SolveFailureException} when the solver ran but crashed.
     */
    protected abstract SolveOutcome doSolve(ProblemInstance problem);

    /**
     * Release resources. Called at most once per successful or failed open,
     * possibly while a solve is in flight.
     */
    protected abstract void doDestroy();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "', state=" + state + "}";
    }
}
