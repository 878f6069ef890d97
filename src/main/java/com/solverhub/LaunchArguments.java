package com.solverhub;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.protocol.EndpointAddress;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Command line of the solver hub:
 * <pre>
 * solver-hub [--address host:port] [--file-path problem] [--config path]
 * solver-hub harness [--executable path] [--config path]
 * </pre>
 * Options accept both {@code --key value} and {@code --key=value}.
 */
public record LaunchArguments(
        LaunchMode mode,
        String address,
        String filePath,
        String executable,
        String configPath
) {

    private static final Set<String> ENDPOINT_OPTIONS = Set.of("address", "file-path", "config");
    private static final Set<String> HARNESS_OPTIONS = Set.of("executable", "config");

    public static LaunchArguments parse(String... args) {
        int start = 0;
        boolean harness = args.length > 0 && "harness".equals(args[0]);
        if (harness) {
            start = 1;
        }
        Set<String> allowed = harness ? HARNESS_OPTIONS : ENDPOINT_OPTIONS;

        Map<String, String> options = new LinkedHashMap<>();
        for (int i = start; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new ConfigurationException("Unexpected argument: " + arg);
            }
            String key;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                key = arg.substring(2, eq);
                value = arg.substring(eq + 1);
            } else {
                key = arg.substring(2);
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("Option --" + key + " requires a value");
                }
                value = args[++i];
            }
            if (!allowed.contains(key)) {
                throw new ConfigurationException("Unknown option --" + key
                        + (harness ? " for harness" : "") + ". Allowed: " + allowed);
            }
            if (value.isBlank()) {
                throw new ConfigurationException("Option --" + key + " requires a value");
            }
            options.put(key, value);
        }

        String address = options.get("address");
        if (address != null) {
            EndpointAddress.parse(address);
        }

        LaunchMode mode;
        if (harness) {
            mode = LaunchMode.HARNESS;
        } else if (options.containsKey("file-path")) {
            mode = LaunchMode.ONESHOT;
        } else {
            mode = LaunchMode.SERVE;
        }
        return new LaunchArguments(mode, address, options.get("file-path"),
                options.get("executable"), options.get("config"));
    }

    /**
     * Spring properties equivalent to these arguments.
     */
    public Map<String, Object> toProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("solverhub.mode", mode.propertyValue());
        if (address != null) {
            properties.put("solverhub.address", address);
        }
        if (filePath != null) {
            properties.put("solverhub.file-path", filePath);
        }
        if (executable != null) {
            properties.put("solverhub.executable", executable);
        }
        if (configPath != null) {
            properties.put("solverhub.config-path", configPath);
        }
        return properties;
    }
}
