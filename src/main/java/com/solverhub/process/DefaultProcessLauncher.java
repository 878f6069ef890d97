package com.solverhub.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches processes with {@link ProcessBuilder}. Combined output goes to a
 * temp file so a chatty process can never block on a full pipe.
 */
public class DefaultProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(DefaultProcessLauncher.class);

    private final File workingDirectory;

    public DefaultProcessLauncher() {
        this(null);
    }

    public DefaultProcessLauncher(File workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public RunningProcess start(List<String> command) throws IOException {
        Path output = Files.createTempFile("solverhub-", ".out");
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(output.toFile());
        if (workingDirectory != null) {
            pb.directory(workingDirectory);
        }
        try {
            Process process = pb.start();
            log.debug("Started pid {}: {}", process.pid(), String.join(" ", command));
            return new JdkRunningProcess(command, process, output);
        } catch (IOException e) {
            deleteQuietly(output);
            throw e;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }

    static final class JdkRunningProcess implements RunningProcess {

        private final List<String> command;
        private final Process process;
        private final Path output;

        JdkRunningProcess(List<String> command, Process process, Path output) {
            this.command = List.copyOf(command);
            this.process = process;
            this.output = output;
        }

        @Override
        public List<String> command() {
            return command;
        }

        @Override
        public ProcessResult await(Duration timeout) throws InterruptedException {
            try {
                if (timeout == null) {
                    int exitCode = process.waitFor();
                    return ProcessResult.exited(exitCode, readOutput());
                }
                if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Process {} exceeded {} and is being killed", process.pid(), timeout);
                    destroyTree();
                    process.waitFor();
                    return ProcessResult.timeout(readOutput());
                }
                return ProcessResult.exited(process.exitValue(), readOutput());
            } finally {
                if (!process.isAlive()) {
                    deleteQuietly(output);
                }
            }
        }

        private String readOutput() {
            try {
                return Files.readString(output, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Could not read output of {}: {}", command.get(0), e.getMessage());
                return "";
            }
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        /**
         * Kill the process and its descendants. The output file goes once the
         * process has exited.
         */
        @Override
        public void kill() {
            destroyTree();
            process.onExit().thenRun(() -> deleteQuietly(output));
        }

        private void destroyTree() {
            if (process.isAlive()) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }

        Path outputFile() {
            return output;
        }
    }
}
