package com.solverhub.solver.remote;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.problem.ProblemInstance;
import com.solverhub.protocol.EndpointAddress;
import com.solverhub.protocol.HttpSolveProtocol;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.protocol.SolveRequest;
import com.solverhub.solver.AbstractSolver;
import com.solverhub.solver.AddressLeaseRegistry;
import com.solverhub.solver.SolverRole;

import java.util.Set;

/**
 * Oneshot planner served by a running solver endpoint over HTTP.
 */
public class RemoteSolver extends AbstractSolver {

    private final EndpointAddress address;
    private final HttpSolveProtocol protocol;
    private final AddressLeaseRegistry leases;

    public RemoteSolver(String name,
                        CapabilityDescriptor capabilities,
                        EndpointAddress address,
                        HttpSolveProtocol protocol,
                        AddressLeaseRegistry leases) {
        super(name, capabilities, Set.of(SolverRole.ONESHOT_PLANNER));
        this.address = address;
        this.protocol = protocol;
        this.leases = leases;
    }

    @Override
    protected void doOpen() {
        leases.acquire(address, name());
    }

    @Override
    protected SolveOutcome doSolve(ProblemInstance problem) {
        return protocol.exchange(new SolveRequest(address, problem.locator(), problem.requiredKind()));
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
