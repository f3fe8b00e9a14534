/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.util.Objects;

import io.ferryman.service.HostPort;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One client-facing listener.
 *
 * @param name unique listener name, defaults to the protocol name
 * @param protocol wire protocol name, see {@code WireProtocolRegistry}
 * @param bindAddress address to bind
 * @param websocketPath upgrade path for websocket listeners
 * @param tls certificate for protocols that require TLS
 */
public record ListenerDefinition(@Nullable String name,
                                 String protocol,
                                 HostPort bindAddress,
                                 @Nullable String websocketPath,
                                 @Nullable TlsDefinition tls) {

    public static final String DEFAULT_WEBSOCKET_PATH = "/ws";

    public ListenerDefinition {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (name == null) {
            name = protocol;
        }
        if (websocketPath == null) {
            websocketPath = DEFAULT_WEBSOCKET_PATH;
        }
    }

    public static ListenerDefinition of(String protocol, HostPort bindAddress) {
        return new ListenerDefinition(null, protocol, bindAddress, null, null);
    }
}
