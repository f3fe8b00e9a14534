/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import io.ferryman.config.GatewayConfiguration;
import io.ferryman.gateway.StatusReport;
import io.ferryman.launcher.LauncherClient;
import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.protocol.ResultStatus;
import io.ferryman.service.HostPort;

/**
 * Sends one lifecycle command to a running gateway. Exits 0 for OK, 2 for REJECTED and 1
 * for ERROR or when the gateway cannot be reached.
 */
abstract class LauncherCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--gateway", defaultValue = Ferryman.DEFAULT_GATEWAY, description = "Gateway control address (default: ${DEFAULT-VALUE})")
    HostPort gateway;

    @Option(names = "--timeout", defaultValue = "PT60S", description = "How long to wait for the gateway's answer, as an ISO-8601 duration")
    Duration timeout;

    abstract LifecycleCommand command();

    @Override
    public Integer call() {
        CommandResult result;
        try (LauncherClient client = new LauncherClient(gateway, GatewayConfiguration.DEFAULT_MAX_FRAME_SIZE_BYTES)) {
            result = client.execute(command(), timeout).join();
        }
        PrintWriter out = result.status() == ResultStatus.ERROR ? spec.commandLine().getErr() : spec.commandLine().getOut();
        out.println(render(result));
        out.flush();
        return LauncherClient.exitCode(result);
    }

    String render(CommandResult result) {
        return command().commandName() + ": " + result.status() + (result.detail().isEmpty() ? "" : " " + result.detail());
    }

    @Command(name = "start", description = "Start an engine if none is running")
    static final class Start extends LauncherCommand {
        @Override
        LifecycleCommand command() {
            return LifecycleCommand.START;
        }
    }

    @Command(name = "stop", description = "Stop the running engine; clients stay connected")
    static final class Stop extends LauncherCommand {
        @Override
        LifecycleCommand command() {
            return LifecycleCommand.STOP;
        }
    }

    @Command(name = "reload", description = "Replace the running engine with a fresh one; clients stay connected")
    static final class Reload extends LauncherCommand {
        @Override
        LifecycleCommand command() {
            return LifecycleCommand.RELOAD;
        }
    }

    @Command(name = "status", description = "Show engine state and session counts")
    static final class Status extends LauncherCommand {

        @Option(names = "--json", description = "Print the raw JSON status document")
        boolean json;

        @Override
        LifecycleCommand command() {
            return LifecycleCommand.STATUS;
        }

        @Override
        String render(CommandResult result) {
            if (!result.isOk() || json) {
                return result.isOk() ? result.detail() : super.render(result);
            }
            try {
                return describe(MAPPER.readValue(result.detail(), StatusReport.class));
            }
            catch (JsonProcessingException e) {
                return result.detail();
            }
        }

        static String describe(StatusReport report) {
            StringBuilder text = new StringBuilder();
            text.append("engine:         ").append(report.engine());
            if (report.enginePid() != null) {
                text.append(" (pid ").append(report.enginePid());
                if (report.engineUptimeSeconds() != null) {
                    text.append(", up ").append(report.engineUptimeSeconds()).append("s");
                }
                text.append(")");
            }
            text.append(System.lineSeparator())
                    .append("sessions:       ").append(report.sessions())
                    .append(" (").append(report.authenticatedSessions()).append(" authenticated)")
                    .append(System.lineSeparator())
                    .append("gateway uptime: ").append(report.gatewayUptimeSeconds()).append("s");
            return text.toString();
        }
    }
}
