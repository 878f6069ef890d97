package com.solverhub.protocol;

/**
 * Tag of a {@link SolveOutcome}.
 */
public enum OutcomeStatus {
    PLAN_FOUND,
    UNSOLVABLE,
    UNSUPPORTED,
    FAILURE
}
