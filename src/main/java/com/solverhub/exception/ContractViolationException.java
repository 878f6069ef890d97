package com.solverhub.exception;

/**
 * Thrown when a solver is used outside its contract, e.g. solve after destroy
 * or solve on a solver that is not a oneshot planner.
 * This is a programming error, not a recoverable runtime condition.
 */
public class ContractViolationException extends SolverHubException {

    public ContractViolationException(String message) {
        super(message);
    }
}
