package com.solverhub.problem;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads problem files.
 * <p>
 * A problem file is YAML; the problem may sit at the root or under a
 * {@code problem} key. Only {@code name} and {@code kind} are interpreted:
 * <pre>
 * problem:
 *   name: basic
 *   kind:
 *     typing: [FLAT_TYPING]
 *     conditions-kind: [EQUALITY]
 *   domain: ...
 * </pre>
 */
public class ProblemLoader {

    private static final Logger log = LoggerFactory.getLogger(ProblemLoader.class);

    /**
     * Load a problem. Supports classpath: prefix for classpath resources.
     *
     * @throws ConfigurationException if the file cannot be read or its kind is invalid
     */
    public ProblemInstance load(String locator) {
        Resource resource = getResource(locator);
        if (!resource.exists()) {
            throw new ConfigurationException("Problem not found: " + locator);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(locator, defaultName(resource), inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read problem from: " + locator, e);
        }
    }

    /**
     * Capability query for a problem: the kind it requires.
     */
    public CapabilityDescriptor requiredKind(String locator) {
        return load(locator).requiredKind();
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            return new ClassPathResource(path.substring("classpath:".length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private ProblemInstance parse(String locator, String defaultName, InputStream inputStream) {
        Object loaded;
        try {
            loaded = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Problem " + locator + " is not valid YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Problem file is empty or not a mapping: " + locator);
        }
        Map<String, Object> root = (Map<String, Object>) loaded;
        Map<String, Object> problem = root.get("problem") instanceof Map
                ? (Map<String, Object>) root.get("problem")
                : root;

        String name = problem.get("name") != null ? problem.get("name").toString() : defaultName;

        Object kindObj = problem.get("kind");
        if (kindObj != null && !(kindObj instanceof Map)) {
            throw new ConfigurationException("Problem '" + name + "' has a kind that is not a mapping");
        }
        CapabilityDescriptor kind = CapabilityDescriptor.parse((Map<String, ?>) kindObj);

        Map<String, Object> body = new LinkedHashMap<>(problem);
        body.remove("name");
        body.remove("kind");

        log.debug("Loaded problem '{}' from {} requiring {}", name, locator, kind);
        return new ProblemInstance(name, locator, kind, body);
    }

    private static String defaultName(Resource resource) {
        String filename = resource.getFilename();
        if (filename == null) {
            return "unnamed";
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
