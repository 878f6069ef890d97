package com.solverhub.harness;

import com.solverhub.exception.SolverHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Runs the validation harness at startup and exposes its exit code.
 */
public class HarnessRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HarnessRunner.class);

    private final ValidationHarness harness;
    private int exitCode = 1;

    public HarnessRunner(ValidationHarness harness) {
        this.harness = harness;
    }

    @Override
    public void run(String... args) {
        try {
            HarnessReport report = harness.run();
            exitCode = report.exitCode();
            if (report.successful()) {
                log.info(report.summary());
            } else {
                log.error(report.summary());
            }
        } catch (SolverHubException e) {
            log.error("Harness aborted: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
