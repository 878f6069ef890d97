package com.solverhub.protocol;

import com.solverhub.exception.TransportException;
import com.solverhub.process.ProcessLauncher;
import com.solverhub.process.ProcessResult;
import com.solverhub.process.RunningProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal transport: one process per request, built from a
 * {@link CommandTemplate}. The exit code is the coarse outcome (see
 * {@link ExitStatus}); a {@code RESPONSE=} line in the output, when present,
 * carries the structured envelope and the plan.
 */
public class CommandLineSolveProtocol implements SolveProtocol {

    private static final Logger log = LoggerFactory.getLogger(CommandLineSolveProtocol.class);

    private final ProcessLauncher launcher;
    private final CommandTemplate template;
    private final String executable;
    private final Duration timeout;

    private final Object processLock = new Object();
    private RunningProcess inFlight;
    private boolean cancelled;

    /**
     * @param launcher   Process launcher
     * @param template   Command template with {executable}, {address} and {instance} placeholders
     * @param executable Path of the solver executable
     * @param timeout    Per-request timeout, {@code null} for none
     */
    public CommandLineSolveProtocol(ProcessLauncher launcher, CommandTemplate template,
                                    String executable, Duration timeout) {
        this.launcher = launcher;
        this.template = template;
        this.executable = executable;
        this.timeout = timeout;
    }

    public List<String> command(SolveRequest request) {
        return template.render(Map.of(
                "executable", executable,
                "address", request.address().toString(),
                "instance", request.problemLocator()));
    }

    @Override
    public String describe(SolveRequest request) {
        return String.join(" ", command(request));
    }

    @Override
    public SolveOutcome exchange(SolveRequest request) {
        synchronized (processLock) {
            if (cancelled) {
                return SolveOutcome.failure("Cancelled before launch");
            }
        }
        List<String> command = command(request);
        RunningProcess process;
        try {
            process = launcher.start(command);
        } catch (IOException e) {
            throw new TransportException("Could not launch solver process '" + executable + "': " + e.getMessage(),
                    request.address().toString(), request.problemLocator(), e);
        }

        // a cancel may have arrived while the process was starting
        synchronized (processLock) {
            if (cancelled) {
                log.info("Killing solver process started after cancel: {}", String.join(" ", command));
                process.kill();
            } else {
                inFlight = process;
            }
        }

        ProcessResult result;
        try {
            result = process.await(timeout);
        } catch (InterruptedException e) {
            process.kill();
            Thread.currentThread().interrupt();
            return SolveOutcome.failure("Interrupted while waiting for solver process");
        } finally {
            synchronized (processLock) {
                inFlight = null;
            }
        }

        if (isCancelled()) {
            return SolveOutcome.failure("Cancelled while solving");
        }
        if (result.timedOut()) {
            return SolveOutcome.failure("Solver process timed out after " + timeout);
        }
        return interpret(result);
    }

    SolveOutcome interpret(ProcessResult result) {
        ExitStatus status = ExitStatus.fromCode(result.exitCode());
        Optional<SolveResponseEnvelope> envelope = SolveResponseEnvelope.findInOutput(result.output());

        if (envelope.isPresent()) {
            SolveOutcome outcome = envelope.get().toOutcome();
            if (ExitStatus.of(outcome) != status) {
                log.warn("Exit code {} contradicts response envelope {}", result.exitCode(), outcome.status());
                return SolveOutcome.failure("Exit code " + result.exitCode()
                        + " contradicts reported outcome " + outcome.status());
            }
            return outcome;
        }

        return switch (status) {
            case PLAN_FOUND -> SolveOutcome.planFound(PlanParser.parse(result.output()));
            case UNSOLVABLE -> SolveOutcome.unsolvable();
            case UNSUPPORTED -> SolveOutcome.unsupported("Solver rejected the problem (exit code "
                    + result.exitCode() + ")");
            case FAILURE -> SolveOutcome.failure("Solver exited with code " + result.exitCode()
                    + lastLine(result.output()));
        };
    }

    /**
     * Kill the process in flight, if any. A cancelled protocol kills anything
     * it launches afterwards and refuses further exchanges.
     */
    @Override
    public void cancel() {
        RunningProcess process;
        synchronized (processLock) {
            cancelled = true;
            process = inFlight;
        }
        if (process != null && process.isAlive()) {
            log.info("Cancelling solver process: {}", String.join(" ", process.command()));
            process.kill();
        }
    }

    public boolean isCancelled() {
        synchronized (processLock) {
            return cancelled;
        }
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        String[] lines = output.strip().split("\\R");
        return ": " + lines[lines.length - 1];
    }
}
