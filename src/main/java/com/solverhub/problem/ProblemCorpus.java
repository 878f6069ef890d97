package com.solverhub.problem;

import java.nio.file.Path;
import java.util.List;

/**
 * Fixed, ordered list of named problem instances stored as
 * {@code <problemsDir>/<name>.<extension>}.
 *
 * @param problemsDir Directory holding the serialized problems
 * @param extension   File extension without the dot
 * @param instances   Instance names, in submission order
 */
public record ProblemCorpus(Path problemsDir, String extension, List<String> instances) {

    public ProblemCorpus {
        instances = instances != null ? List.copyOf(instances) : List.of();
    }

    public String locate(String instance) {
        return problemsDir.resolve(instance + "." + extension).toString();
    }
}
