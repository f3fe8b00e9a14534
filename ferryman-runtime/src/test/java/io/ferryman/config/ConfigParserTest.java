/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.ferryman.service.HostPort;
import io.ferryman.session.OverflowPolicy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    @Test
    void minimalConfiguration_appliesDefaults() {
        GatewayConfiguration config = parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                """);

        assertEquals(GatewayConfiguration.DEFAULT_CONTROL_ADDRESS, config.controlAddress());
        assertEquals(GatewayConfiguration.DEFAULT_MAX_FRAME_SIZE_BYTES, config.maxFrameSizeBytes());
        assertFalse(config.logFrames());
        assertEquals("telnet", config.listeners().get(0).name());
        assertEquals(new HostPort("localhost", 4000), config.listeners().get(0).bindAddress());
        assertFalse(config.engine().hasCommand());
        assertFalse(config.engine().autoStart());
        assertEquals(EngineDefinition.DEFAULT_ATTACH_TIMEOUT, config.engine().attachTimeout());
        assertEquals(InputQueueDefinition.DEFAULT_CAPACITY, config.inputQueue().capacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.inputQueue().overflowPolicy());
        assertEquals(SlowClientPolicy.DISCONNECT, config.outbound().slowClientPolicy());
        assertEquals(ThrottleDefinition.DEFAULT_MAX_COMMANDS_PER_SECOND, config.throttle().maxCommandsPerSecond());
    }

    @Test
    void fullConfiguration_isRead() {
        GatewayConfiguration config = parser.parseConfiguration("""
                controlAddress: 127.0.0.1:5005
                maxFrameSizeBytes: 4096
                logFrames: true
                listeners:
                  - name: main
                    protocol: telnet
                    bindAddress: 0.0.0.0:4000
                  - name: web
                    protocol: websocket
                    bindAddress: 0.0.0.0:4001
                    websocketPath: /game
                engine:
                  command: [java, -jar, engine.jar]
                  attachTimeout: PT5S
                  stopTimeout: PT2S
                  environment:
                    WORLD: test
                inputQueue:
                  capacity: 8
                  overflowPolicy: REJECT_NEW
                outbound:
                  writeBufferHighWaterMark: 1024
                  writeBufferLowWaterMark: 512
                  slowClientPolicy: DROP
                throttle:
                  maxCommandsPerSecond: 0
                  maxInputLength: 100
                """);

        assertEquals(new HostPort("127.0.0.1", 5005), config.controlAddress());
        assertEquals(4096, config.maxFrameSizeBytes());
        assertTrue(config.logFrames());
        assertEquals(2, config.listeners().size());
        assertEquals("/game", config.listeners().get(1).websocketPath());
        assertEquals(List.of("java", "-jar", "engine.jar"), config.engine().command());
        assertTrue(config.engine().autoStart());
        assertEquals(Duration.ofSeconds(5), config.engine().attachTimeout());
        assertEquals(Duration.ofSeconds(2), config.engine().stopTimeout());
        assertEquals("test", config.engine().environment().get("WORLD"));
        assertEquals(8, config.inputQueue().capacity());
        assertEquals(OverflowPolicy.REJECT_NEW, config.inputQueue().overflowPolicy());
        assertEquals(1024, config.outbound().writeBufferHighWaterMark());
        assertEquals(SlowClientPolicy.DROP, config.outbound().slowClientPolicy());
        assertEquals(0, config.throttle().maxCommandsPerSecond());
        assertEquals(100, config.throttle().maxInputLength());
    }

    @Test
    void autoStartCanBeDisabledWithCommand() {
        GatewayConfiguration config = parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                engine:
                  command: [engine]
                  autoStart: false
                """);

        assertTrue(config.engine().hasCommand());
        assertFalse(config.engine().autoStart());
    }

    @Test
    void noListeners_rejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                controlAddress: localhost:4005
                listeners: []
                """));

        assertTrue(e.getMessage().contains("at least one listener"), e.getMessage());
    }

    @Test
    void duplicateListenerNames_rejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                  - protocol: telnet
                    bindAddress: localhost:4001
                """));

        assertTrue(e.getMessage().contains("duplicate listener name 'telnet'"), e.getMessage());
    }

    @Test
    void tinyFrameLimit_rejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                maxFrameSizeBytes: 10
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                """));

        assertTrue(e.getMessage().contains("maxFrameSizeBytes"), e.getMessage());
    }

    @Test
    void nonPositiveAttachTimeout_rejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                engine:
                  attachTimeout: PT0S
                """));

        assertTrue(e.getMessage().contains("attachTimeout"), e.getMessage());
    }

    @Test
    void unknownProperty_rejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: localhost:4000
                bogus: 1
                """));

        assertTrue(e.getMessage().contains("bogus"), e.getMessage());
    }

    @Test
    void malformedAddress_rejected() {
        assertThrows(ConfigurationException.class, () -> parser.parseConfiguration("""
                listeners:
                  - protocol: telnet
                    bindAddress: no-port-here
                """));
    }
}
