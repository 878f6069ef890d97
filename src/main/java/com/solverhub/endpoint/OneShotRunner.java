package com.solverhub.endpoint;

import com.solverhub.protocol.ExitStatus;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.protocol.SolveResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;

/**
 * Endpoint started with {@code --file-path}: solves that single problem,
 * prints the {@code RESPONSE=} envelope and exits with the outcome's
 * {@link ExitStatus} code.
 */
public class OneShotRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OneShotRunner.class);

    private final SolverEndpoint endpoint;
    private final String filePath;
    private final PrintStream out;

    private int exitCode = ExitStatus.FAILURE.code();

    public OneShotRunner(SolverEndpoint endpoint, String filePath, PrintStream out) {
        this.endpoint = endpoint;
        this.filePath = filePath;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        log.info("Solving {}", filePath);
        SolveOutcome outcome = endpoint.solve(filePath);
        out.println(SolveResponseEnvelope.from(outcome).toResponseLine());
        out.flush();
        exitCode = ExitStatus.of(outcome).code();
        if (outcome.isPlanFound()) {
            log.info("{}: {}", filePath, outcome.describe());
        } else {
            log.error("Unable to solve {}: {}", filePath, outcome.describe());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
