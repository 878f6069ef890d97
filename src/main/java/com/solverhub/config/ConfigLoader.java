package com.solverhub.config;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.problem.ProblemCorpus;
import com.solverhub.protocol.CommandTemplate;
import com.solverhub.protocol.EndpointAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads solver hub configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static SolverHubConfig load(String path) {
        log.info("Loading solver hub configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static SolverHubConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration is not a valid YAML mapping: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The hub section may sit at the root or under a 'solverhub' key
        Map<String, Object> hubConfig = root.containsKey("solverhub")
                ? (Map<String, Object>) root.get("solverhub")
                : root;

        String name = getString(hubConfig, "name", "solver-hub");
        String version = getString(hubConfig, "version", "1.0");

        EndpointConfig endpoint = parseEndpoint((Map<String, Object>) hubConfig.get("endpoint"));
        List<SolverSpec> solvers = parseSolvers((List<Map<String, Object>>) hubConfig.get("solvers"));
        HarnessConfig harness = parseHarness((Map<String, Object>) hubConfig.get("harness"));

        if (endpoint.backend() != null && solvers.stream().noneMatch(s -> s.name().equals(endpoint.backend()))) {
            throw new ConfigurationException("Endpoint backend '" + endpoint.backend()
                    + "' is not a configured solver. Define it under solvers.");
        }

        SolverHubConfig config = new SolverHubConfig(name, version, endpoint, solvers, harness);

        log.info("Loaded solver hub configuration: {} v{} with {} solvers, endpoint {}, backend {}",
                name, version, solvers.size(), endpoint.address(),
                endpoint.backend() != null ? endpoint.backend() : "(selected by capability)");

        return config;
    }

    private static EndpointConfig parseEndpoint(Map<String, Object> map) {
        if (map == null) {
            return EndpointConfig.defaults();
        }
        String address = getString(map, "address", EndpointConfig.defaults().address().toString());
        return new EndpointConfig(EndpointAddress.parse(address), getString(map, "backend", null));
    }

    @SuppressWarnings("unchecked")
    private static List<SolverSpec> parseSolvers(List<Map<String, Object>> list) {
        if (list == null || list.isEmpty()) {
            log.warn("No solvers configured");
            return List.of();
        }

        List<SolverSpec> specs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> solverMap = list.get(i);
            String name = getString(solverMap, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Solver #" + i + " has no name");
            }
            if (!names.add(name)) {
                throw new ConfigurationException("Duplicate solver name '" + name + "'");
            }
            String type = getString(solverMap, "type", null);
            if (type == null || type.isBlank()) {
                throw new ConfigurationException("Solver '" + name + "' has no type");
            }
            Object options = solverMap.get("options");
            if (options != null && !(options instanceof Map)) {
                throw new ConfigurationException("Solver '" + name + "' options must be a mapping");
            }
            specs.add(new SolverSpec(name, type, (Map<String, Object>) options));
            log.debug("Parsed solver spec: name={}, type={}", name, type);
        }
        return specs;
    }

    @SuppressWarnings("unchecked")
    private static HarnessConfig parseHarness(Map<String, Object> map) {
        if (map == null) {
            return null;
        }

        BuildConfig build = null;
        Map<String, Object> buildMap = (Map<String, Object>) map.get("build");
        if (buildMap != null) {
            build = new BuildConfig(
                    getString(buildMap, "target", null),
                    getString(buildMap, "command", null),
                    getString(buildMap, "output", null));
        }

        String command = getString(map, "command", CommandTemplate.SOLVE_COMMAND);
        // Fail now rather than on the first instance
        CommandTemplate.parse(command);

        Map<String, Object> problemsMap = (Map<String, Object>) map.get("problems");
        if (problemsMap == null) {
            throw new ConfigurationException("harness.problems is required");
        }
        List<Object> instances = (List<Object>) problemsMap.get("instances");
        if (instances == null || instances.isEmpty()) {
            throw new ConfigurationException("harness.problems.instances must list at least one instance");
        }
        ProblemCorpus corpus = new ProblemCorpus(
                Path.of(getString(problemsMap, "dir", "problems")),
                getString(problemsMap, "extension", "yaml"),
                instances.stream().map(Object::toString).toList());

        int timeoutSeconds = getInt(map, "timeout-seconds", 0);

        return new HarnessConfig(
                getString(map, "executable", null),
                build,
                command,
                EndpointAddress.parse(getString(map, "address", "0.0.0.0:2222")),
                corpus,
                timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }
}
