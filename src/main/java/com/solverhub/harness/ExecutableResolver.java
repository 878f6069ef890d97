package com.solverhub.harness;

import com.solverhub.config.HarnessConfig;

/**
 * Resolves the solver executable the harness drives.
 */
public interface ExecutableResolver {

    /**
     * @return Absolute path of the executable
     * @throws com.solverhub.exception.BuildFailedException if it has to be built and the build fails
     */
    String resolve(HarnessConfig config);
}
