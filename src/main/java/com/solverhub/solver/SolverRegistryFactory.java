package com.solverhub.solver;

import com.solverhub.config.SolverSpec;
import com.solverhub.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a SolverRegistry from solver specs using the available factories.
 * Every solver is created and opened before the registry is returned; if one
 * fails, those already opened are destroyed.
 */
public final class SolverRegistryFactory {

    private static final Logger log = LoggerFactory.getLogger(SolverRegistryFactory.class);

    private SolverRegistryFactory() {
    }

    public static SolverRegistry create(List<SolverSpec> specs, Collection<SolverFactory> factories) {
        Map<String, SolverFactory> byType = new LinkedHashMap<>();
        for (SolverFactory factory : factories) {
            if (byType.putIfAbsent(factory.type(), factory) != null) {
                throw new ConfigurationException("Duplicate solver factory type '" + factory.type() + "'");
            }
        }

        DefaultSolverRegistry registry = new DefaultSolverRegistry();
        try {
            for (SolverSpec spec : specs) {
                SolverFactory factory = byType.get(spec.type());
                if (factory == null) {
                    throw new ConfigurationException("Solver '" + spec.name() + "' has unknown type '"
                            + spec.type() + "'. Known types: " + byType.keySet());
                }
                Solver solver = factory.create(spec.name(), spec.options());
                registry.register(solver);
                solver.open();
            }
        } catch (RuntimeException e) {
            registry.destroyAll();
            throw e;
        }

        log.info("Solver registry ready with {} solvers", registry.solvers().size());
        return registry;
    }
}
