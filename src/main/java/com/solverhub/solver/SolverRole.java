package com.solverhub.solver;

/**
 * Roles a solver can fulfil. A solver advertises exactly the roles it implements.
 */
public enum SolverRole {
    ONESHOT_PLANNER,
    PLAN_VALIDATOR,
    GROUNDER
}
