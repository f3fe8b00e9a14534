/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.app;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import io.ferryman.engine.EngineClient;
import io.ferryman.engine.EngineRuntime;
import io.ferryman.engine.SessionPolicy;
import io.ferryman.engine.WorldPersistence;
import io.ferryman.protocol.RestartMode;
import io.ferryman.service.HostPort;

@Command(name = "engine", description = "Run an engine that attaches to a gateway")
final class EngineCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineCommand.class);

    @Option(names = "--gateway", defaultValue = Ferryman.DEFAULT_GATEWAY, description = "Gateway control address (default: ${DEFAULT-VALUE})")
    HostPort gateway;

    @Option(names = "--startup-deadline", defaultValue = "PT30S", description = "Give up if the gateway is not reachable within this ISO-8601 duration")
    Duration startupDeadline;

    @Option(names = "--drain-timeout", defaultValue = "PT10S", description = "How long in-flight commands may run during shutdown")
    Duration drainTimeout;

    @Option(names = "--workers", description = "Worker threads for command processing (default: available processors)")
    int workers = Math.max(2, Runtime.getRuntime().availableProcessors());

    @Option(names = "--max-frame-size", defaultValue = "1048576", description = "Largest control frame accepted, in bytes")
    int maxFrameSizeBytes;

    @Option(names = "--max-sessions-per-account", defaultValue = "0", description = "Sessions one account may hold at once, 0 for unlimited")
    int maxSessionsPerAccount;

    @Option(names = "--auto-puppet", negatable = true, defaultValue = "true", description = "Re-bind an account's last puppet on login")
    boolean autoPuppet;

    @Option(names = "--auto-create-puppet", defaultValue = "false", description = "Create a puppet for accounts that have none")
    boolean autoCreatePuppet;

    @Option(names = "--idle-timeout", defaultValue = "PT0S", description = "Disconnect sessions silent for longer than this ISO-8601 duration, PT0S to never")
    Duration idleTimeout;

    @Option(names = "--start-mode", defaultValue = "${env:FERRYMAN_START_MODE:-cold}", description = "reload or cold, set by the gateway when it spawns the engine (default: ${DEFAULT-VALUE})")
    String startMode;

    @Override
    public Integer call() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        SessionPolicy policy = new SessionPolicy(maxSessionsPerAccount, autoPuppet, autoCreatePuppet, idleTimeout);
        LineEchoDispatcher dispatcher = new LineEchoDispatcher();
        EngineRuntime runtime = new EngineRuntime(dispatcher, WorldPersistence.NONE, dispatcher, policy, dispatcher, pool, drainTimeout);
        try {
            runtime.start(RestartMode.parse(startMode));
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Engine could not start: {}", e.getMessage());
            pool.shutdownNow();
            return 1;
        }

        try (EngineClient client = new EngineClient(gateway, runtime, maxFrameSizeBytes, startupDeadline)) {
            try {
                client.connect().get();
            }
            catch (ExecutionException e) {
                LOGGER.error("Could not attach to gateway: {}", e.getCause().getMessage());
                pool.shutdownNow();
                return 1;
            }
            client.installShutdownHook();
            boolean clean = client.closeFuture().join();
            LOGGER.info("Engine exiting, clean={}", clean);
            return clean ? 0 : 1;
        }
        finally {
            pool.shutdownNow();
        }
    }
}
