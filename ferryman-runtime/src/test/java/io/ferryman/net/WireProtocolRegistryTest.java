/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.netty.channel.ChannelPipeline;

import io.ferryman.config.ConfigurationException;
import io.ferryman.config.ListenerDefinition;
import io.ferryman.service.HostPort;
import io.ferryman.session.Capabilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WireProtocolRegistryTest {

    private static final HostPort ANY = new HostPort("localhost", 0);

    @Test
    void builtIns_areRegistered() {
        assertEquals(Set.of("telnet", "telnet-ssl", "websocket"), WireProtocolRegistry.withBuiltIns().names());
    }

    @Test
    void create_telnet() {
        WireProtocol protocol = WireProtocolRegistry.withBuiltIns().create(ListenerDefinition.of("telnet", ANY));

        assertInstanceOf(TelnetProtocol.class, protocol);
        assertTrue(protocol.readyOnActive());
    }

    @Test
    void create_websocketWaitsForHandshake() {
        WireProtocol protocol = WireProtocolRegistry.withBuiltIns().create(ListenerDefinition.of("websocket", ANY));

        assertEquals("websocket", protocol.name());
        assertFalse(protocol.readyOnActive());
    }

    @Test
    void create_secureTelnetWithoutTls_rejected() {
        WireProtocolRegistry registry = WireProtocolRegistry.withBuiltIns();

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.create(ListenerDefinition.of("telnet-ssl", ANY)));
        assertTrue(e.getMessage().contains("no tls section"), e.getMessage());
    }

    @Test
    void create_unknownProtocol_rejected() {
        WireProtocolRegistry registry = WireProtocolRegistry.withBuiltIns();

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.create(ListenerDefinition.of("ssh", ANY)));
        assertTrue(e.getMessage().contains("unknown protocol 'ssh'"), e.getMessage());
    }

    @Test
    void register_customProtocol() {
        WireProtocolRegistry registry = WireProtocolRegistry.withBuiltIns();
        WireProtocol custom = new WireProtocol() {
            @Override
            public String name() {
                return "raw";
            }

            @Override
            public Capabilities defaultCapabilities() {
                return Capabilities.of(StandardCharsets.ISO_8859_1, false, 80);
            }

            @Override
            public void configurePipeline(ChannelPipeline pipeline) {
                // raw bytes
            }
        };
        registry.register("raw", listener -> custom);

        assertEquals(custom, registry.create(ListenerDefinition.of("raw", ANY)));
        assertThrows(IllegalArgumentException.class, () -> registry.register("raw", listener -> custom));
    }

    @Test
    void formatNotice_usesClientEncoding() {
        WireProtocol protocol = new TelnetProtocol();

        byte[] notice = protocol.formatNotice("café", Capabilities.of(StandardCharsets.ISO_8859_1, false, 80));

        assertEquals(6, notice.length);
        assertEquals("café\r\n", new String(notice, StandardCharsets.ISO_8859_1));
    }
}
