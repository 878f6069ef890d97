package com.solverhub.solver.remote;

import com.solverhub.protocol.AbortableRequestFactory;
import com.solverhub.protocol.EndpointAddress;
import com.solverhub.protocol.HttpSolveProtocol;
import com.solverhub.solver.AddressLeaseRegistry;
import com.solverhub.solver.Solver;
import com.solverhub.solver.SolverFactory;
import com.solverhub.solver.SolverOptions;

import java.util.Map;
import java.util.Set;

/**
 * Factory for {@link RemoteSolver}, config type {@code remote}.
 * Each solver gets its own RestTemplate and connection settings.
 */
public class RemoteSolverFactory implements SolverFactory {

    public static final String TYPE = "remote";

    private static final Set<String> OPTIONS = Set.of(
            "address", "connect-timeout-ms", "read-timeout-ms", SolverOptions.SUPPORTED_KIND);

    private final AddressLeaseRegistry leases;

    public RemoteSolverFactory(AddressLeaseRegistry leases) {
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

        // read timeout 0 = wait for the planner as long as it takes; destroy aborts the request
        AbortableRequestFactory requestFactory = AbortableRequestFactory.withTimeouts(
                opts.getInt("connect-timeout-ms", 5000),
                opts.getInt("read-timeout-ms", 0));

        return new RemoteSolver(
                name,
                opts.getCapabilities(SolverOptions.SUPPORTED_KIND),
                EndpointAddress.parse(opts.requireString("address")),
                new HttpSolveProtocol(requestFactory),
                leases);
    }
}
