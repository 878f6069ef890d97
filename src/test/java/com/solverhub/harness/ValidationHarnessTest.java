package com.solverhub.harness;

import com.solverhub.config.BuildConfig;
import com.solverhub.config.HarnessConfig;
import com.solverhub.problem.ProblemCorpus;
import com.solverhub.process.ProcessResult;
import com.solverhub.process.ScriptedProcessLauncher;
import com.solverhub.protocol.CommandTemplate;
import com.solverhub.protocol.EndpointAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValidationHarness.
 */
class ValidationHarnessTest {

    private static final BuildConfig BUILD =
            new BuildConfig("up-server", "cargo build --profile ci --bin {target}", "target/ci/{target}");

    private static HarnessConfig config(String executable, String... instances) {
        return new HarnessConfig(
                executable,
                BUILD,
                CommandTemplate.SOLVE_COMMAND,
                EndpointAddress.parse("0.0.0.0:2222"),
                new ProblemCorpus(Path.of("problems"), "bin", List.of(instances)),
                null);
    }

    private static boolean isBuild(List<String> command) {
        return command.get(0).equals("cargo");
    }

    private static boolean solves(List<String> command, String instance) {
        return command.get(command.size() - 1).endsWith(instance + ".bin");
    }

    // ===== Success =====

    @Test
    @DisplayName("Should solve every instance in order and exit 0")
    void shouldSolveAllInstances() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "(a)");
        ValidationHarness harness = new ValidationHarness(config("/opt/up-server", "basic", "matchcellar"), launcher);

        HarnessReport report = harness.run();

        assertTrue(report.successful());
        assertEquals(0, report.exitCode());
        assertEquals(List.of("basic", "matchcellar"), report.solved());
        assertEquals(List.of(
                List.of("/opt/up-server", "--address", "0.0.0.0:2222", "--file-path",
                        Path.of("problems", "basic.bin").toString()),
                List.of("/opt/up-server", "--address", "0.0.0.0:2222", "--file-path",
                        Path.of("problems", "matchcellar.bin").toString())), launcher.commands());
    }

    @Test
    @DisplayName("Should accept the debug-printed answer of up-server")
    void shouldAcceptUpServerOutput() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0,
                "RESPONSE=Answer { status: 0, plan: Some(Plan { actions: [] }) }\n");
        ValidationHarness harness = new ValidationHarness(config("/opt/up-server", "basic", "matchcellar"), launcher);

        HarnessReport report = harness.run();

        assertEquals(0, report.exitCode());
        assertEquals(List.of("basic", "matchcellar"), report.solved());
    }

    @Test
    @DisplayName("Should build the executable when none is given")
    void shouldBuildExecutable() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "");
        ValidationHarness harness = new ValidationHarness(config(null, "basic"), launcher);

        HarnessReport report = harness.run();

        assertEquals(0, report.exitCode());
        assertEquals(List.of("cargo", "build", "--profile", "ci", "--bin", "up-server"), launcher.commands().get(0));
        assertEquals(Path.of("target/ci/up-server").toAbsolutePath().toString(), launcher.commands().get(1).get(0));
    }

    // ===== Failures =====

    @Test
    @DisplayName("Should halt on the first instance without a plan")
    void shouldHaltOnFirstFailure() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(command ->
                solves(command, "matchcellar") ? ProcessResult.exited(101, "panicked") : ProcessResult.exited(0, "(a)"));
        ValidationHarness harness = new ValidationHarness(
                config("/opt/up-server", "basic", "matchcellar", "hierarchical_blocks_world"), launcher);

        HarnessReport report = harness.run();

        assertFalse(report.successful());
        assertEquals(1, report.exitCode());
        assertEquals(List.of("basic"), report.solved());
        assertEquals("matchcellar", report.failure().instance());
        assertTrue(report.failure().command().endsWith("matchcellar.bin"));
        assertTrue(report.failure().observed().contains("101"));
        assertEquals(2, launcher.commands().size());
    }

    @Test
    @DisplayName("Unsolvable counts as a failure")
    void shouldFailOnUnsolvable() {
        HarnessReport report = new ValidationHarness(config("/opt/up-server", "basic"),
                ScriptedProcessLauncher.exitingWith(2, "")).run();

        assertEquals(1, report.exitCode());
        assertEquals("no plan exists", report.failure().observed());
    }

    @Test
    @DisplayName("Should stop when the solver cannot be launched")
    void shouldFailOnLaunchError() {
        ScriptedProcessLauncher launcher = ScriptedProcessLauncher.exitingWith(0, "")
                .failingToStart(new IOException("No such file or directory"));

        HarnessReport report = new ValidationHarness(config("/opt/up-server", "basic", "matchcellar"), launcher).run();

        assertEquals(1, report.exitCode());
        assertEquals("basic", report.failure().instance());
        assertTrue(report.failure().observed().startsWith("could not start"));
        assertEquals(1, launcher.commands().size());
    }

    @Test
    @DisplayName("Should not solve anything when the build fails")
    void shouldFailOnBuildError() {
        ScriptedProcessLauncher launcher = new ScriptedProcessLauncher(command ->
                isBuild(command) ? ProcessResult.exited(101, "error[E0425]") : ProcessResult.exited(0, "(a)"));

        HarnessReport report = new ValidationHarness(config(null, "basic"), launcher).run();

        assertEquals(1, report.exitCode());
        assertNull(report.failure());
        assertTrue(report.buildError().contains("101"));
        assertEquals(1, launcher.commands().size());
    }

    @Test
    @DisplayName("Runner exposes the report's exit code")
    void runnerExposesExitCode() {
        HarnessRunner ok = new HarnessRunner(new ValidationHarness(config("/opt/up-server", "basic"),
                ScriptedProcessLauncher.exitingWith(0, "(a)")));
        HarnessRunner failing = new HarnessRunner(new ValidationHarness(config("/opt/up-server", "basic"),
                ScriptedProcessLauncher.exitingWith(1, "")));

        ok.run();
        failing.run();

        assertEquals(0, ok.getExitCode());
        assertEquals(1, failing.getExitCode());
    }
}
