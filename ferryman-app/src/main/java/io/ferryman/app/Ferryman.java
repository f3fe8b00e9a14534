/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.time.Duration;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import io.ferryman.service.HostPort;

/**
 * Entry point for every Ferryman process.
 *
 * <pre>
 *   ferryman gateway -c gateway.yaml
 *   ferryman engine [--gateway host:port]
 *   ferryman start|stop|reload|status [--gateway host:port]
 * </pre>
 */
@Command(
        name = "ferryman",
        mixinStandardHelpOptions = true,
        description = "Hot-reload runtime: a gateway holds client connections while engines come and go.",
        subcommands = {
                GatewayCommand.class,
                EngineCommand.class,
                LauncherCommand.Start.class,
                LauncherCommand.Stop.class,
                LauncherCommand.Reload.class,
                LauncherCommand.Status.class
        })
public final class Ferryman implements Runnable {

    /**
     * Gateway control address used when neither an option nor the environment gives one.
     */
    static final String DEFAULT_GATEWAY = "${env:FERRYMAN_GATEWAY:-localhost:4005}";

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }

    static CommandLine commandLine() {
        return new CommandLine(new Ferryman())
                .registerConverter(HostPort.class, HostPort::parse)
                .registerConverter(Duration.class, Duration::parse);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
