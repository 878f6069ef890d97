package com.solverhub.protocol;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.TransportException;
import com.solverhub.process.ProcessResult;
import com.solverhub.process.ScriptedProcessLauncher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CommandLineSolveProtocol.
 */
class CommandLineSolveProtocolTest {

    private static final SolveRequest REQUEST = new SolveRequest(
            EndpointAddress.parse("0.0.0.0:2222"), "problems/basic.bin", CapabilityDescriptor.empty());

    private static CommandLineSolveProtocol protocol(ScriptedProcessLauncher launcher) {
        return new CommandLineSolveProtocol(launcher, CommandTemplate.solveCommand(), "/opt/up-server", null);
    }

    // ===== Exit codes =====

    @ParameterizedTest
    @CsvSource({
            "0, PLAN_FOUND",
            "1, FAILURE",
            "2, UNSOLVABLE",
            "3, UNSUPPORTED",
            "101, FAILURE",
            "-1, FAILURE"
    })
    @DisplayName("Should map the exit code to an outcome")
    void shouldMapExitCode(int exitCode, OutcomeStatus expected) {
        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(exitCode, "")).exchange(REQUEST);
        assertEquals(expected, outcome.status());
    }

    @Test
    @DisplayName("Should issue the expected command line")
    void shouldIssueCommand() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "");
        CommandLineSolveProtocol protocol = protocol(launcher);

        protocol.exchange(REQUEST);

        assertEquals(List.of("/opt/up-server", "--address", "0.0.0.0:2222", "--file-path", "problems/basic.bin"),
                launcher.commands().get(0));
        assertEquals("/opt/up-server --address 0.0.0.0:2222 --file-path problems/basic.bin",
                protocol.describe(REQUEST));
    }

    @Test
    @DisplayName("Should parse the plan from plain output")
    void shouldParsePlainPlan() {
        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(0, """
                ; solved in 0.2s
                (pick a)
                (stack a b)
                """)).exchange(REQUEST);

        SolveOutcome.PlanFound found = assertInstanceOf(SolveOutcome.PlanFound.class, outcome);
        assertEquals(2, found.plan().size());
    }

    @Test
    @DisplayName("Should report the last output line of a crash")
    void shouldReportCrashOutput() {
        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(101,
                "starting\nthread 'main' panicked: no plan")).exchange(REQUEST);

        assertEquals(new SolveOutcome.Failure("Solver exited with code 101: thread 'main' panicked: no plan"),
                outcome);
    }

    // ===== Envelope =====

    @Test
    @DisplayName("Should prefer the response envelope over plain output")
    void shouldUseEnvelope() {
        String output = "(ignored)\nRESPONSE={\"status\":\"PLAN_FOUND\",\"plan\":{\"actions\":[{\"name\":\"go\",\"parameters\":[\"x\"]}]}}\n";

        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(0, output)).exchange(REQUEST);

        SolveOutcome.PlanFound found = assertInstanceOf(SolveOutcome.PlanFound.class, outcome);
        assertEquals(List.of(new PlanAction("go", List.of("x"))), found.plan().actions());
    }

    @Test
    @DisplayName("Envelope contradicting the exit code is a failure")
    void shouldRejectContradictingEnvelope() {
        String output = "RESPONSE={\"status\":\"UNSOLVABLE\"}";

        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(0, output)).exchange(REQUEST);

        assertEquals(OutcomeStatus.FAILURE, outcome.status());
    }

    @Test
    @DisplayName("Debug-printed answer of up-server falls back to the exit code")
    void shouldAcceptUpServerAnswer() {
        String output = """
                Solving problems/basic.bin
                RESPONSE=Answer { status: 0, plan: Some(Plan { actions: [] }) }
                """;

        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(0, output)).exchange(REQUEST);

        SolveOutcome.PlanFound found = assertInstanceOf(SolveOutcome.PlanFound.class, outcome);
        assertTrue(found.plan().actions().isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "2, UNSOLVABLE",
            "3, UNSUPPORTED",
            "1, FAILURE"
    })
    @DisplayName("Non-JSON response line leaves the exit code in charge")
    void shouldIgnoreNonJsonResponseLine(int exitCode, OutcomeStatus expected) {
        SolveOutcome outcome = protocol(ScriptedProcessLauncher.exitingWith(exitCode, "RESPONSE={not json"))
                .exchange(REQUEST);

        assertEquals(expected, outcome.status());
    }

    // ===== Transport =====

    @Test
    @DisplayName("Launch failure is a TransportException, not an outcome")
    void shouldThrowOnLaunchFailure() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "")
                .failingToStart(new IOException("Permission denied"));

        TransportException e = assertThrows(TransportException.class, () -> protocol(launcher).exchange(REQUEST));
        assertEquals("0.0.0.0:2222", e.getAddress());
        assertEquals("problems/basic.bin", e.getProblemLocator());
    }

    @Test
    @DisplayName("Timeout is a failure")
    void shouldReportTimeout() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(c -> ProcessResult.timeout("(partial)"));
        CommandLineSolveProtocol protocol = new CommandLineSolveProtocol(
                launcher, CommandTemplate.solveCommand(), "/opt/up-server", Duration.ofSeconds(5));

        SolveOutcome outcome = protocol.exchange(REQUEST);

        assertEquals(OutcomeStatus.FAILURE, outcome.status());
        assertTrue(outcome.describe().contains("timed out"));
    }

    @Test
    @DisplayName("Exchange after cancel fails without launching")
    void exchangeAfterCancel() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "(a)");
        CommandLineSolveProtocol protocol = protocol(launcher);

        protocol.cancel();
        SolveOutcome outcome = protocol.exchange(REQUEST);

        assertEquals(OutcomeStatus.FAILURE, outcome.status());
        assertTrue(launcher.commands().isEmpty());
        assertTrue(protocol.isCancelled());
    }

    @Test
    @DisplayName("Cancel without a process in flight does nothing")
    void cancelWithoutProcess() {
        assertDoesNotThrow(() -> protocol(ScriptedProcessLauncher.exitingWith(0, "")).cancel());
    }
}
