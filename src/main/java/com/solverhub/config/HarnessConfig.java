package com.solverhub.config;

import com.solverhub.problem.ProblemCorpus;
import com.solverhub.protocol.EndpointAddress;

import java.time.Duration;

/**
 * Configuration of the validation harness.
 *
 * @param executable Solver executable; {@code null} builds it with {@code build}
 * @param build      Build settings, used only when {@code executable} is null
 * @param command    Command template of one solve attempt
 * @param address    Address passed to the solver
 * @param corpus     Problem instances to run, in order
 * @param timeout    Per-instance timeout, {@code null} for none
 */
public record HarnessConfig(
        String executable,
        BuildConfig build,
        String command,
        EndpointAddress address,
        ProblemCorpus corpus,
        Duration timeout
) {
    public HarnessConfig withExecutable(String executable) {
        return new HarnessConfig(executable, build, command, address, corpus, timeout);
    }
}
