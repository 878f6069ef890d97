package com.solverhub.protocol;

import java.util.Objects;

/**
 * Result of a solve attempt. The four variants are always distinguishable;
 * "no plan exists" is {@link Unsolvable}, never a null plan.
 */
public interface SolveOutcome {

    OutcomeStatus status();

    default boolean isPlanFound() {
        return status() == OutcomeStatus.PLAN_FOUND;
    }

    /**
     * Short description used in logs and reports.
     */
    String describe();

    static SolveOutcome planFound(Plan plan) {
        return new PlanFound(plan);
    }

    static SolveOutcome unsolvable() {
        return new Unsolvable();
    }

    static SolveOutcome unsupported(String reason) {
        return new Unsupported(reason);
    }

    static SolveOutcome failure(String error) {
        return new Failure(error);
    }

    record PlanFound(Plan plan) implements SolveOutcome {
        public PlanFound {
            Objects.requireNonNull(plan, "plan");
        }

        @Override
        public OutcomeStatus status() {
            return OutcomeStatus.PLAN_FOUND;
        }

        @Override
        public String describe() {
            return "plan found (" + plan.size() + " actions)";
        }
    }

    record Unsolvable() implements SolveOutcome {
        @Override
        public OutcomeStatus status() {
            return OutcomeStatus.UNSOLVABLE;
        }

        @Override
        public String describe() {
            return "no plan exists";
        }
    }

    record Unsupported(String reason) implements SolveOutcome {
        @Override
        public OutcomeStatus status() {
            return OutcomeStatus.UNSUPPORTED;
        }

        @Override
        public String describe() {
            return "unsupported: " + reason;
        }
    }

    record Failure(String error) implements SolveOutcome {
        @Override
        public OutcomeStatus status() {
            return OutcomeStatus.FAILURE;
        }

        @Override
        public String describe() {
            return "failure: " + error;
        }
    }
}
