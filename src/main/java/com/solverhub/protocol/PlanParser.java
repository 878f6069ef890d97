package com.solverhub.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a plan from planner text output.
 * Recognizes one action per line in the {@code (name arg1 arg2)} form, with an
 * optional {@code 0.000:} time prefix and {@code [duration]} suffix. Comment
 * lines starting with {@code ;} and all other lines are ignored.
 */
public final class PlanParser {

    private static final Pattern ACTION_LINE =
            Pattern.compile("^\\s*(?:\\d+(?:\\.\\d+)?\\s*:\\s*)?\\(([^()]+)\\)\\s*(?:\\[[^\\]]*\\])?\\s*$");

    private PlanParser() {
    }

    public static Plan parse(String output) {
        List<PlanAction> actions = new ArrayList<>();
        if (output == null) {
            return new Plan(actions);
        }
        for (String line : output.split("\\R")) {
            if (line.trim().startsWith(";")) {
                continue;
            }
            Matcher matcher = ACTION_LINE.matcher(line);
            if (matcher.matches()) {
                String[] tokens = matcher.group(1).trim().split("\\s+");
                actions.add(new PlanAction(tokens[0], Arrays.asList(tokens).subList(1, tokens.length)));
            }
        }
        return new Plan(actions);
    }
}
