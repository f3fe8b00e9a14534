/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal.util;

import java.util.function.Supplier;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Meters published by the gateway. All meters live on
 * {@link io.micrometer.core.instrument.Metrics#globalRegistry}.
 *
 * <p>Each client input frame is counted exactly once when it arrives: as routed (sent
 * straight to the engine), queued, or dropped. A queued frame later counts again as
 * flushed when it reaches an engine on resync, or as dropped with reason {@code overflow}
 * if a newer frame pushed it out. Whatever remains is still pending or went with a closed
 * session.</p>
 */
public final class Metrics {

    public static final String PROTOCOL_TAG = "protocol";
    public static final String REASON_TAG = "reason";

    private static final String CLIENT_CONNECTIONS = "ferryman_client_connections";
    private static final String INBOUND_ROUTED = "ferryman_inbound_frames_routed";
    private static final String INBOUND_QUEUED = "ferryman_inbound_frames_queued";
    private static final String INBOUND_FLUSHED = "ferryman_inbound_frames_flushed";
    private static final String INBOUND_DROPPED = "ferryman_inbound_frames_dropped";
    private static final String OUTBOUND_DISCARDED = "ferryman_outbound_frames_discarded";
    private static final String ENGINE_ATTACHES = "ferryman_engine_attaches";
    private static final String ENGINE_CRASHES = "ferryman_engine_crashes";
    private static final String ENGINE_FORCED_TERMINATIONS = "ferryman_engine_forced_terminations";
    private static final String OPEN_SESSIONS = "ferryman_open_sessions";

    private Metrics() {
    }

    private static MeterRegistry registry() {
        return io.micrometer.core.instrument.Metrics.globalRegistry;
    }

    public static Counter clientConnectionCounter(String protocol) {
        return Counter.builder(CLIENT_CONNECTIONS)
                .description("Client connections accepted")
                .tag(PROTOCOL_TAG, protocol)
                .register(registry());
    }

    public static Counter inboundRoutedCounter() {
        return Counter.builder(INBOUND_ROUTED)
                .description("Client input forwarded to the engine as it arrived")
                .register(registry());
    }

    public static Counter inboundQueuedCounter() {
        return Counter.builder(INBOUND_QUEUED)
                .description("Client input queued until a session is resynced to an engine")
                .register(registry());
    }

    public static Counter inboundFlushedCounter() {
        return Counter.builder(INBOUND_FLUSHED)
                .description("Queued client input forwarded to an engine on resync")
                .register(registry());
    }

    /**
     * @param reason one of {@code overflow}, {@code rejected}, {@code rate}, {@code length}
     */
    public static Counter inboundDroppedCounter(String reason) {
        return Counter.builder(INBOUND_DROPPED)
                .description("Client input discarded before reaching the engine")
                .tag(REASON_TAG, reason)
                .register(registry());
    }

    /**
     * @param reason {@code closed} for output to a session that no longer exists, {@code slow} for a slow client
     */
    public static Counter outboundDiscardedCounter(String reason) {
        return Counter.builder(OUTBOUND_DISCARDED)
                .description("Engine output not delivered to a client")
                .tag(REASON_TAG, reason)
                .register(registry());
    }

    public static Counter engineAttachCounter() {
        return Counter.builder(ENGINE_ATTACHES)
                .description("Engines attached to the gateway")
                .register(registry());
    }

    public static Counter engineCrashCounter() {
        return Counter.builder(ENGINE_CRASHES)
                .description("Engine control connections lost without a clean shutdown")
                .register(registry());
    }

    public static Counter engineForcedTerminationCounter() {
        return Counter.builder(ENGINE_FORCED_TERMINATIONS)
                .description("Engines forcibly terminated after a lifecycle timeout")
                .register(registry());
    }

    public static Gauge openSessionsGauge(Supplier<Number> value) {
        return Gauge.builder(OPEN_SESSIONS, value)
                .description("Sessions currently registered with the gateway")
                .register(registry());
    }
}
