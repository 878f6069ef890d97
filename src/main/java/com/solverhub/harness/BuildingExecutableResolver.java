package com.solverhub.harness;

import com.solverhub.config.BuildConfig;
import com.solverhub.config.HarnessConfig;
import com.solverhub.exception.BuildFailedException;
import com.solverhub.process.ProcessLauncher;
import com.solverhub.process.ProcessResult;
import com.solverhub.process.RunningProcess;
import com.solverhub.protocol.CommandTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Uses the configured executable when there is one, otherwise runs the build
 * command and returns the path of its output.
 */
public class BuildingExecutableResolver implements ExecutableResolver {

    private static final Logger log = LoggerFactory.getLogger(BuildingExecutableResolver.class);

    private final ProcessLauncher launcher;

    public BuildingExecutableResolver(ProcessLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public String resolve(HarnessConfig config) {
        if (config.executable() != null && !config.executable().isBlank()) {
            String executable = Path.of(config.executable()).toAbsolutePath().toString();
            log.info("Using solver executable: {}", executable);
            return executable;
        }

        BuildConfig build = config.build();
        if (build == null || build.command() == null || build.output() == null) {
            throw new BuildFailedException("No executable given and no build configured", -1);
        }

        List<String> command = CommandTemplate.parse(build.command()).render(build.placeholders());
        log.info("Building solver: {}", String.join(" ", command));

        ProcessResult result;
        try {
            RunningProcess process = launcher.start(command);
            result = process.await(null);
        } catch (IOException e) {
            throw new BuildFailedException("Could not start build command: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildFailedException("Interrupted while building solver", e);
        }

        if (result.exitCode() != 0) {
            log.error("Build output:\n{}", result.output());
            throw new BuildFailedException("Build of '" + build.target() + "' failed with exit code "
                    + result.exitCode(), result.exitCode());
        }

        String executable = Path.of(build.renderedOutput()).toAbsolutePath().toString();
        log.info("Built solver executable: {}", executable);
        return executable;
    }
}
