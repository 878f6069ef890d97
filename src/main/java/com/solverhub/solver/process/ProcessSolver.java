package com.solverhub.solver.process;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.problem.ProblemInstance;
import com.solverhub.protocol.CommandLineSolveProtocol;
import com.solverhub.protocol.EndpointAddress;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.protocol.SolveRequest;
import com.solverhub.solver.AbstractSolver;
import com.solverhub.solver.AddressLeaseRegistry;
import com.solverhub.solver.SolverRole;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Oneshot planner backed by an external executable, one process per solve.
 * The process in flight is killed on destroy.
 */
public class ProcessSolver extends AbstractSolver {

    private final String executable;
    private final EndpointAddress address;
    private final CommandLineSolveProtocol protocol;
    private final AddressLeaseRegistry leases;

    public ProcessSolver(String name,
                         CapabilityDescriptor capabilities,
                         String executable,
                         EndpointAddress address,
                         CommandLineSolveProtocol protocol,
                         AddressLeaseRegistry leases) {
        super(name, capabilities, Set.of(SolverRole.ONESHOT_PLANNER));
        this.executable = executable;
        this.address = address;
        this.protocol = protocol;
        this.leases = leases;
    }

    @Override
    protected void doOpen() {
        if (executable != null && executable.contains("/")) {
            Path path = Path.of(executable);
            if (!Files.isExecutable(path)) {
                throw new ConfigurationException("Solver '" + name() + "' executable is missing or not executable: "
                        + path.toAbsolutePath());
            }
        }
        leases.acquire(address, name());
    }

    @Override
    protected SolveOutcome doSolve(ProblemInstance problem) {
        SolveRequest request = new SolveRequest(address, problem.locator(), problem.requiredKind());
        return protocol.exchange(request);
    }

    @Override
    protected void doDestroy() {
        protocol.cancel();
        leases.release(address, name());
    }

    public EndpointAddress address() {
        return address;
    }
}
