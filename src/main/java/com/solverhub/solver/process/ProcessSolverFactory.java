package com.solverhub.solver.process;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.process.ProcessLauncher;
import com.solverhub.protocol.CommandLineSolveProtocol;
import com.solverhub.protocol.CommandTemplate;
import com.solverhub.protocol.EndpointAddress;
import com.solverhub.solver.AddressLeaseRegistry;
import com.solverhub.solver.Solver;
import com.solverhub.solver.SolverFactory;
import com.solverhub.solver.SolverOptions;

import java.util.Map;
import java.util.Set;

/**
 * Factory for {@link ProcessSolver}, config type {@code process}.
 * <pre>
 * - name: aries
 *   type: process
 *   options:
 *     executable: /opt/aries/up-server
 *     address: 127.0.0.1:2223
 *     command: "{executable} --address {address} --file-path {instance}"
 *     timeout-seconds: 300
 *     supported-kind:
 *       typing: [FLAT_TYPING, HIERARCHICAL_TYPING]
 * </pre>
 */
public class ProcessSolverFactory implements SolverFactory {

    public static final String TYPE = "process";

    private static final Set<String> OPTIONS = Set.of(
            "executable", "address", "command", "timeout-seconds", SolverOptions.SUPPORTED_KIND);

    private final ProcessLauncher launcher;
    private final AddressLeaseRegistry leases;

    public ProcessSolverFactory(ProcessLauncher launcher, AddressLeaseRegistry leases) {
        this.launcher = launcher;
        this.leases = leases;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Set<String> recognizedOptions() {
        return OPTIONS;
    }

    @Override
    public Solver create(String name, Map<String, Object> options) {
        SolverOptions opts = SolverOptions.validate(name, options, OPTIONS);

        CommandTemplate template = CommandTemplate.parse(
                opts.getString("command", CommandTemplate.SOLVE_COMMAND));
        if (!template.uses("instance")) {
            throw new ConfigurationException("Solver '" + name + "' command must contain the {instance} placeholder");
        }
        String executable = template.uses("executable")
                ? opts.requireString("executable")
                : opts.getString("executable", "");

        CommandLineSolveProtocol protocol = new CommandLineSolveProtocol(
                launcher, template, executable, opts.getSeconds("timeout-seconds"));

        return new ProcessSolver(
                name,
                opts.getCapabilities(SolverOptions.SUPPORTED_KIND),
                executable.isEmpty() ? null : executable,
                EndpointAddress.parse(opts.requireString("address")),
                protocol,
                leases);
    }
}
