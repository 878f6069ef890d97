package com.solverhub.protocol;

import com.solverhub.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command line with {@code {name}} placeholders, e.g.
 * {@code {executable} --address {address} --file-path {instance}}.
 * Tokens are split on whitespace once, at parse time, so substituted values
 * containing spaces stay a single argument.
 */
public final class CommandTemplate {

    public static final String SOLVE_COMMAND = "{executable} --address {address} --file-path {instance}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z][a-z0-9-]*)}");

    private final String template;
    private final List<String> tokens;

    private CommandTemplate(String template, List<String> tokens) {
        this.template = template;
        this.tokens = tokens;
    }

    public static CommandTemplate parse(String template) {
        if (template == null || template.isBlank()) {
            throw new ConfigurationException("Command template must not be empty");
        }
        return new CommandTemplate(template, splitCommand(template));
    }

    public static CommandTemplate solveCommand() {
        return parse(SOLVE_COMMAND);
    }

    /**
     * Substitute every placeholder.
     *
     * @throws ConfigurationException if a placeholder has no value
     */
    public List<String> render(Map<String, String> values) {
        List<String> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Matcher matcher = PLACEHOLDER.matcher(token);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                String value = values.get(matcher.group(1));
                if (value == null) {
                    throw new ConfigurationException("No value for placeholder {" + matcher.group(1)
                            + "} in command template: " + template);
                }
                matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            matcher.appendTail(sb);
            out.add(sb.toString());
        }
        return out;
    }

    public boolean uses(String placeholder) {
        return template.contains("{" + placeholder + "}");
    }

    @Override
    public String toString() {
        return template;
    }

    static List<String> splitCommand(String cmd) {
        List<String> out = new ArrayList<>();
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < cmd.length(); i++) {
            char c = cmd.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (inQuote) {
            throw new ConfigurationException("Unbalanced quote in command template: " + cmd);
        }
        if (cur.length() > 0) {
            out.add(cur.toString());
        }
        return out;
    }
}
