package com.solverhub.harness;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.config.HarnessConfig;
import com.solverhub.exception.BuildFailedException;
import com.solverhub.exception.TransportException;
import com.solverhub.problem.ProblemCorpus;
import com.solverhub.process.ProcessLauncher;
import com.solverhub.protocol.CommandLineSolveProtocol;
import com.solverhub.protocol.CommandTemplate;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.protocol.SolveRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a solver executable against every instance of a problem corpus, in
 * order, and stops at the first instance that does not yield a plan.
 * No retries.
 */
public class ValidationHarness {

    private static final Logger log = LoggerFactory.getLogger(ValidationHarness.class);

    private final HarnessConfig config;
    private final ExecutableResolver resolver;
    private final ProcessLauncher launcher;

    public ValidationHarness(HarnessConfig config, ExecutableResolver resolver, ProcessLauncher launcher) {
        this.config = config;
        this.resolver = resolver;
        this.launcher = launcher;
    }

    public ValidationHarness(HarnessConfig config, ProcessLauncher launcher) {
        this(config, new BuildingExecutableResolver(launcher), launcher);
    }

    public HarnessReport run() {
        String executable;
        try {
            executable = resolver.resolve(config);
        } catch (BuildFailedException e) {
            log.error("Cannot obtain solver executable: {}", e.getMessage());
            return HarnessReport.buildFailed(e.getMessage());
        }

        CommandLineSolveProtocol protocol = new CommandLineSolveProtocol(
                launcher, CommandTemplate.parse(config.command()), executable, config.timeout());
        ProblemCorpus corpus = config.corpus();
        List<String> solved = new ArrayList<>();

        for (String instance : corpus.instances()) {
            // The harness only knows locators, so it asserts no requirement
            SolveRequest request = new SolveRequest(config.address(), corpus.locate(instance),
                    CapabilityDescriptor.empty());
            String command = protocol.describe(request);
            log.info("Solving instance: {}", request.problemLocator());
            log.info("Command: {}", command);

            SolveOutcome outcome;
            try {
                outcome = protocol.exchange(request);
            } catch (TransportException e) {
                log.error("Could not start solver for {}: {}", instance, e.getMessage());
                return HarnessReport.failed(solved, new InstanceFailure(instance, command,
                        "could not start: " + e.getMessage()));
            }

            if (!outcome.isPlanFound()) {
                log.error("Solver did not return expected result for {}: {}", instance, outcome.describe());
                return HarnessReport.failed(solved, new InstanceFailure(instance, command, outcome.describe()));
            }
            log.info("{}: {}", instance, outcome.describe());
            solved.add(instance);
        }

        log.info("All {} instances solved", solved.size());
        return HarnessReport.succeeded(solved);
    }
}
