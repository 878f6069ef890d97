package com.solverhub.protocol;

/**
 * Request/response exchange between a client and a solver endpoint.
 * An exchange blocks for the duration of the external computation.
 */
public interface SolveProtocol {

    /**
     * Submit one request and wait for its outcome.
     *
     * @throws com.solverhub.exception.TransportException if the endpoint could
     *         not be reached or the solver process could not be launched
     */
    SolveOutcome exchange(SolveRequest request);

    /**
     * Human-readable form of what {@link #exchange} issues for this request
     * (command line or URL), used in failure reports.
     */
    String describe(SolveRequest request);

    /**
     * Out-of-band cancellation of the exchange in flight, if any. Final: an
     * exchange still starting is aborted once it gets going, and later
     * exchanges fail without reaching the solver.
     */
    void cancel();
}
