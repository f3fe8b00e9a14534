/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.service;

import java.net.InetSocketAddress;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A host and port pair, written {@code host:port}. IPv6 literals are written in brackets.
 *
 * @param host host name or address
 * @param port port number, 0 asks the operating system for an ephemeral port
 */
public record HostPort(String host, int port) {

    public HostPort {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Parses {@code host:port}.
     *
     * @param address the address
     * @return the host port
     * @throws IllegalArgumentException if the address is malformed
     */
    @JsonCreator
    public static HostPort parse(String address) {
        Objects.requireNonNull(address, "address");
        int split = address.lastIndexOf(':');
        if (split <= 0 || split == address.length() - 1) {
            throw new IllegalArgumentException("expected host:port, got '" + address + "'");
        }
        String host = address.substring(0, split);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        try {
            return new HostPort(host, Integer.parseInt(address.substring(split + 1)));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected host:port, got '" + address + "'", e);
        }
    }

    public static HostPort of(InetSocketAddress address) {
        return new HostPort(address.getHostString(), address.getPort());
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @JsonValue
    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
