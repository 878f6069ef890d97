package com.solverhub.config;

import java.util.Map;

/**
 * How the harness builds the solver executable when none is given.
 *
 * @param target  Symbolic build target
 * @param command Build command template; {@code {target}} is substituted
 * @param output  Path of the built executable; {@code {target}} is substituted
 */
public record BuildConfig(String target, String command, String output) {

    public String renderedOutput() {
        return render(output);
    }

    public Map<String, String> placeholders() {
        return Map.of("target", target != null ? target : "");
    }

    private String render(String template) {
        return template == null ? null : template.replace("{target}", target != null ? target : "");
    }
}
