package com.solverhub.endpoint;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.exception.TransportException;
import com.solverhub.problem.ProblemInstance;
import com.solverhub.problem.ProblemLoader;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.solver.Solver;
import com.solverhub.solver.SolverRegistry;
import com.solverhub.solver.SolverRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Server side of the solve protocol. Loads the problem a request points to,
 * picks a backend solver and solves. Requests are handled one at a time, in
 * arrival order.
 */
public class SolverEndpoint {

    private static final Logger log = LoggerFactory.getLogger(SolverEndpoint.class);

    private final SolverRegistry registry;
    private final ProblemLoader problemLoader;
    private final String backend;

    /**
     * @param registry      Registered solvers
     * @param problemLoader Loader for problem locators
     * @param backend       Solver that handles every request, or {@code null} to select by capability
     */
    public SolverEndpoint(SolverRegistry registry, ProblemLoader problemLoader, String backend) {
        this.registry = registry;
        this.problemLoader = problemLoader;
        this.backend = backend;
        if (backend != null && registry.get(backend).isEmpty()) {
            throw new ConfigurationException("Endpoint backend '" + backend + "' is not registered");
        }
    }

    public synchronized SolveOutcome solve(String problemLocator) {
        ProblemInstance problem;
        try {
            problem = problemLoader.load(problemLocator);
        } catch (ConfigurationException e) {
            log.warn("Cannot load problem {}: {}", problemLocator, e.getMessage());
            return SolveOutcome.failure("Cannot load problem " + problemLocator + ": " + e.getMessage());
        }
        return solve(problem);
    }

    public synchronized SolveOutcome solve(ProblemInstance problem) {
        Optional<Solver> solver = backend != null
                ? registry.get(backend)
                : registry.select(problem.requiredKind(), SolverRole.ONESHOT_PLANNER);
        if (solver.isEmpty()) {
            String reason = "No registered planner supports " + problem.requiredKind().toMap();
            log.info("Rejecting '{}': {}", problem.name(), reason);
            return SolveOutcome.unsupported(reason);
        }

        log.info("Solving '{}' with solver '{}'", problem.name(), solver.get().name());
        try {
            return solver.get().solve(problem);
        } catch (TransportException e) {
            log.error("Backend '{}' unavailable: {}", solver.get().name(), e.getMessage());
            return SolveOutcome.failure("Backend solver '" + solver.get().name() + "' unavailable: " + e.getMessage());
        }
    }

    public ProblemLoader problemLoader() {
        return problemLoader;
    }

    public SolverRegistry registry() {
        return registry;
    }
}
