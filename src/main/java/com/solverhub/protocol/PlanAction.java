package com.solverhub.protocol;

import java.util.List;

/**
 * A ground action of a plan.
 *
 * @param name       Action name
 * @param parameters Object parameters, in order
 */
public record PlanAction(String name, List<String> parameters) {

    public PlanAction {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? "(" + name + ")" : "(" + name + " " + String.join(" ", parameters) + ")";
    }
}
