package com.solverhub.solver;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.exception.UnsupportedProblemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of SolverRegistry.
 */
public class DefaultSolverRegistry implements SolverRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultSolverRegistry.class);

    private final Map<String, Solver> byName = new LinkedHashMap<>();
    private final Map<SolverRole, List<Solver>> byRole = new EnumMap<>(SolverRole.class);

    @Override
    public synchronized void register(Solver solver) {
        String name = solver.name();
        if (byName.containsKey(name)) {
            throw new ConfigurationException("Duplicate solver name '" + name + "'");
        }
        byName.put(name, solver);
        for (SolverRole role : solver.roles()) {
            byRole.computeIfAbsent(role, r -> new ArrayList<>()).add(solver);
        }
        log.info("Registered solver '{}' with roles {}", name, solver.roles());
    }

    @Override
    public synchronized Optional<Solver> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public synchronized List<Solver> solvers() {
        return List.copyOf(byName.values());
    }

    @Override
    public synchronized List<Solver> withRole(SolverRole role) {
        return List.copyOf(byRole.getOrDefault(role, List.of()));
    }

    @Override
    public synchronized Optional<Solver> select(CapabilityDescriptor problemKind, SolverRole role) {
        for (Solver solver : byRole.getOrDefault(role, List.of())) {
            if (solver.state() == SolverState.READY && solver.supports(problemKind)) {
                return Optional.of(solver);
            }
        }
        return Optional.empty();
    }

    @Override
    public Solver require(CapabilityDescriptor problemKind, SolverRole role) {
        return select(problemKind, role).orElseThrow(() -> new UnsupportedProblemException(
                "No " + role + " supports " + problemKind.toMap(), problemKind));
    }

    @Override
    public void destroyAll() {
        List<Solver> solvers = solvers();
        for (Solver solver : solvers) {
            try {
                solver.destroy();
            } catch (RuntimeException e) {
                log.error("Failed to destroy solver '{}': {}", solver.name(), e.getMessage(), e);
            }
        }
    }
}
