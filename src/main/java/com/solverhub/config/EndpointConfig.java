package com.solverhub.config;

import com.solverhub.protocol.EndpointAddress;

/**
 * Configuration of the solver endpoint served by this process.
 *
 * @param address Default bind address, overridden by {@code --address}
 * @param backend Name of the solver that handles requests; {@code null}
 *                selects one by capability for each problem
 */
public record EndpointConfig(EndpointAddress address, String backend) {

    public static EndpointConfig defaults() {
        return new EndpointConfig(new EndpointAddress("127.0.0.1", 2222), null);
    }
}
