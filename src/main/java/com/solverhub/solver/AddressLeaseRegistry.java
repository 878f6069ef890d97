package com.solverhub.solver;

import com.solverhub.exception.ConfigurationException;
import com.solverhub.protocol.EndpointAddress;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks which live solver holds which endpoint address.
 * An address is held by at most one solver between its open and destroy.
 */
public class AddressLeaseRegistry {

    private final ConcurrentMap<EndpointAddress, String> leases = new ConcurrentHashMap<>();

    /**
     * @throws ConfigurationException if another solver already holds the address
     */
    public void acquire(EndpointAddress address, String owner) {
        String holder = leases.putIfAbsent(address, owner);
        if (holder != null && !holder.equals(owner)) {
            throw new ConfigurationException("Address " + address + " is already in use by solver '" + holder + "'");
        }
    }

    public void release(EndpointAddress address, String owner) {
        leases.remove(address, owner);
    }

    public Optional<String> holder(EndpointAddress address) {
        return Optional.ofNullable(leases.get(address));
    }

    public int size() {
        return leases.size();
    }
}
