/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

import io.ferryman.config.GatewayConfiguration;
import io.ferryman.config.ListenerDefinition;
import io.ferryman.gateway.Gateway;
import io.ferryman.gateway.StatusReport;
import io.ferryman.service.HostPort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LauncherCommandTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Gateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        GatewayConfiguration configuration = new GatewayConfiguration(HostPort.parse("127.0.0.1:0"),
                null,
                null,
                List.of(ListenerDefinition.of("telnet", HostPort.parse("127.0.0.1:0"))),
                null,
                null,
                null,
                null);
        gateway = new Gateway(configuration).start();
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private int run(String... args) {
        CommandLine commandLine = Ferryman.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private String gatewayAddress() {
        return HostPort.of(gateway.controlAddress()).toString();
    }

    @Test
    void status_rendersReport() {
        int exit = run("status", "--gateway", gatewayAddress());

        assertEquals(0, exit);
        assertTrue(out.toString().contains("engine:         ABSENT"), out.toString());
        assertTrue(out.toString().contains("sessions:       0 (0 authenticated)"), out.toString());
    }

    @Test
    void statusJson_printsDocument() {
        int exit = run("status", "--json", "--gateway", gatewayAddress());

        assertEquals(0, exit);
        assertTrue(out.toString().contains("\"engine\":\"ABSENT\""), out.toString());
    }

    @Test
    void stop_withoutEngine_isRejected() {
        int exit = run("stop", "--gateway", gatewayAddress());

        assertEquals(2, exit);
        assertEquals("stop: REJECTED engine not running", out.toString().strip());
    }

    @Test
    void start_withoutEngineCommand_fails() {
        int exit = run("start", "--gateway", gatewayAddress());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("start: ERROR failed to spawn engine: no engine command configured"), err.toString());
    }

    @Test
    void unreachableGateway_exitsWithError() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        int exit = run("reload", "--gateway", "127.0.0.1:" + port, "--timeout", "PT5S");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("reload: ERROR gateway not reachable"), err.toString());
    }

    @Test
    void describe_runningEngine() {
        String text = LauncherCommand.Status.describe(new StatusReport("RUNNING", 3, 1, 4242L, 90L, 600L));

        String[] lines = text.split(System.lineSeparator());
        assertEquals("engine:         RUNNING (pid 4242, up 90s)", lines[0]);
        assertEquals("sessions:       3 (1 authenticated)", lines[1]);
        assertEquals("gateway uptime: 600s", lines[2]);
    }

    @Test
    void missingSubcommand_isUsageError() {
        assertEquals(2, run());
    }
}
