/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.ferryman.service.HostPort;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Root of the gateway configuration document.
 *
 * @param controlAddress address of the control-channel server engines and launchers dial
 * @param maxFrameSizeBytes largest control frame accepted
 * @param logFrames log every control message
 * @param listeners client-facing listeners, at least one
 * @param engine engine launch description and lifecycle timeouts
 * @param inputQueue buffering while no engine is attached
 * @param outbound per-client output bounds
 * @param throttle per-session input limits
 */
public record GatewayConfiguration(@Nullable HostPort controlAddress,
                                   @Nullable Integer maxFrameSizeBytes,
                                   @Nullable Boolean logFrames,
                                   List<ListenerDefinition> listeners,
                                   @Nullable EngineDefinition engine,
                                   @Nullable InputQueueDefinition inputQueue,
                                   @Nullable OutboundDefinition outbound,
                                   @Nullable ThrottleDefinition throttle) {

    public static final HostPort DEFAULT_CONTROL_ADDRESS = new HostPort("localhost", 4005);
    public static final int DEFAULT_MAX_FRAME_SIZE_BYTES = 1024 * 1024;

    public GatewayConfiguration {
        controlAddress = controlAddress == null ? DEFAULT_CONTROL_ADDRESS : controlAddress;
        if (maxFrameSizeBytes == null) {
            maxFrameSizeBytes = DEFAULT_MAX_FRAME_SIZE_BYTES;
        }
        else if (maxFrameSizeBytes < 64) {
            throw new ConfigurationException("maxFrameSizeBytes must be at least 64, got " + maxFrameSizeBytes);
        }
        logFrames = logFrames != null && logFrames;
        if (listeners == null || listeners.isEmpty()) {
            throw new ConfigurationException("at least one listener must be configured");
        }
        listeners = List.copyOf(listeners);
        Set<String> names = new HashSet<>();
        for (ListenerDefinition listener : listeners) {
            if (!names.add(listener.name())) {
                throw new ConfigurationException("duplicate listener name '" + listener.name() + "'");
            }
        }
        engine = engine == null ? EngineDefinition.defaults() : engine;
        inputQueue = inputQueue == null ? InputQueueDefinition.defaults() : inputQueue;
        outbound = outbound == null ? OutboundDefinition.defaults() : outbound;
        throttle = throttle == null ? ThrottleDefinition.defaults() : throttle;
    }
}
