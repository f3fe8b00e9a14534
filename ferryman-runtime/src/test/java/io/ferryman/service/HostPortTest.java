/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostPortTest {

    @Test
    void parse_hostAndPort() {
        HostPort hostPort = HostPort.parse("example.com:4000");

        assertEquals("example.com", hostPort.host());
        assertEquals(4000, hostPort.port());
        assertEquals("example.com:4000", hostPort.toString());
    }

    @Test
    void parse_bracketedIpv6() {
        HostPort hostPort = HostPort.parse("[::1]:4005");

        assertEquals("::1", hostPort.host());
        assertEquals(4005, hostPort.port());
        assertEquals("[::1]:4005", hostPort.toString());
    }

    @Test
    void parse_portZeroAllowed() {
        assertEquals(0, HostPort.parse("localhost:0").port());
    }

    @Test
    void parse_missingPort() {
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost"));
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost:"));
    }

    @Test
    void parse_nonNumericPort() {
        assertThrows(IllegalArgumentException.class, () -> HostPort.parse("localhost:telnet"));
    }

    @Test
    void portOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new HostPort("localhost", 65536));
    }
}
