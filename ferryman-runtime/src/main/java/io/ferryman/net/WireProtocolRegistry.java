/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

import io.ferryman.config.ConfigurationException;
import io.ferryman.config.ListenerDefinition;

/**
 * Named factories for the wire protocols a gateway can listen with. The built-in protocols
 * are {@value TelnetProtocol#NAME}, {@value SecureTelnetProtocol#NAME} and
 * {@value WebSocketProtocol#NAME}; further protocols are registered before the gateway
 * starts.
 */
public class WireProtocolRegistry {

    private final Map<String, Function<ListenerDefinition, WireProtocol>> factories = new TreeMap<>();

    public static WireProtocolRegistry withBuiltIns() {
        WireProtocolRegistry registry = new WireProtocolRegistry();
        registry.register(TelnetProtocol.NAME, listener -> new TelnetProtocol());
        registry.register(SecureTelnetProtocol.NAME, listener -> {
            if (listener.tls() == null) {
                throw new ConfigurationException("listener '" + listener.name() + "' uses " + SecureTelnetProtocol.NAME + " but has no tls section");
            }
            return SecureTelnetProtocol.fromDefinition(listener.tls());
        });
        registry.register(WebSocketProtocol.NAME, listener -> new WebSocketProtocol(listener.websocketPath()));
        return registry;
    }

    /**
     * @param name protocol name used in listener definitions
     * @param factory creates the protocol instance for a listener
     * @throws IllegalArgumentException if the name is taken
     */
    public synchronized void register(String name, Function<ListenerDefinition, WireProtocol> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("wire protocol '" + name + "' is already registered");
        }
    }

    /**
     * @param listener listener definition
     * @return a protocol instance for the listener
     * @throws ConfigurationException if the protocol is unknown or cannot be set up
     */
    public synchronized WireProtocol create(ListenerDefinition listener) {
        Function<ListenerDefinition, WireProtocol> factory = factories.get(listener.protocol());
        if (factory == null) {
            throw new ConfigurationException("listener '" + listener.name() + "' uses unknown protocol '" + listener.protocol()
                    + "', known protocols are " + factories.keySet());
        }
        return factory.apply(listener);
    }

    public synchronized Set<String> names() {
        return Set.copyOf(factories.keySet());
    }
}
