package com.solverhub.solver;

/**
 * Lifecycle of a solver instance.
 * <pre>
 * CREATED --open()--> READY --destroy()--> DESTROYED
 *    |                                        ^
 *    +--open() fails--> INVALID               |
 *    +---------------destroy()----------------+
 * </pre>
 */
public enum SolverState {
    CREATED,
    READY,
    DESTROYED,
    INVALID
}
