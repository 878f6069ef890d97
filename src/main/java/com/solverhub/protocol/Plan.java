package com.solverhub.protocol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sequential plan returned by a solver. An empty action list is a valid plan
 * (the goal already holds in the initial state).
 */
public record Plan(List<PlanAction> actions) {

    public Plan {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public int size() {
        return actions.size();
    }

    @Override
    public String toString() {
        return actions.stream().map(PlanAction::toString).collect(Collectors.joining("\n"));
    }
}
