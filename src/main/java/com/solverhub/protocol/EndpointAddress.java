package com.solverhub.protocol;

import com.solverhub.exception.ConfigurationException;

/**
 * Bind/connect target of a solver endpoint.
 *
 * @param host Host name or IP literal
 * @param port TCP port
 */
public record EndpointAddress(String host, int port) {

    public EndpointAddress {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("Endpoint host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Endpoint port out of range: " + port);
        }
    }

    /**
     * Parse {@code host:port}. IPv6 literals may be bracketed: {@code [::1]:2222}.
     */
    public static EndpointAddress parse(String address) {
        if (address == null || address.isBlank()) {
            throw new ConfigurationException("Endpoint address must not be empty");
        }
        String value = address.trim();
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new ConfigurationException("Endpoint address must be host:port, got: " + address);
        }
        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        try {
            return new EndpointAddress(host, Integer.parseInt(value.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port in endpoint address: " + address, e);
        }
    }

    /**
     * Base URL of the HTTP transport.
     */
    public String httpUrl() {
        String h = host.contains(":") ? "[" + host + "]" : host;
        return "http://" + h + ":" + port;
    }

    @Override
    public String toString() {
        return (host.contains(":") ? "[" + host + "]" : host) + ":" + port;
    }
}
