package com.solverhub.endpoint;

import com.solverhub.solver.Solver;
import com.solverhub.solver.SolverRole;
import com.solverhub.solver.SolverState;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Advertisement of a registered solver, as returned by {@code GET /solvers}.
 */
public record SolverInfo(
        String name,
        Set<SolverRole> roles,
        SolverState state,
        Map<String, List<String>> capabilities
) {
    public static SolverInfo of(Solver solver) {
        return new SolverInfo(solver.name(), solver.roles(), solver.state(), solver.capabilities().toMap());
    }
}
