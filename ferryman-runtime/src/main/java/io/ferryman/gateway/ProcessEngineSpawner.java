/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.gateway;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ferryman.config.EngineDefinition;
import io.ferryman.protocol.RestartMode;
import io.ferryman.service.HostPort;

/**
 * Spawns the engine as an operating system process using the configured command line.
 *
 * <p>The child learns where to dial from the {@value #GATEWAY_ADDRESS_ENV} environment
 * variable, and whether it follows a reload from {@value #START_MODE_ENV}. Its merged stdout and stderr are copied, line by line, into the
 * {@value #ENGINE_OUTPUT_LOGGER} logger.</p>
 */
public class ProcessEngineSpawner implements EngineSpawner {

    public static final String GATEWAY_ADDRESS_ENV = "FERRYMAN_GATEWAY";
    public static final String START_MODE_ENV = "FERRYMAN_START_MODE";
    public static final String ENGINE_OUTPUT_LOGGER = "io.ferryman.engine.output";

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessEngineSpawner.class);
    private static final Logger OUTPUT = LoggerFactory.getLogger(ENGINE_OUTPUT_LOGGER);

    private final EngineDefinition definition;
    private final HostPort controlAddress;

    public ProcessEngineSpawner(EngineDefinition definition, HostPort controlAddress) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.controlAddress = Objects.requireNonNull(controlAddress, "controlAddress");
    }

    @Override
    public SpawnedEngine spawn(RestartMode mode) throws IOException {
        if (!definition.hasCommand()) {
            throw new IOException("no engine command configured");
        }
        if (!Files.isDirectory(definition.workingDirectory())) {
            throw new IOException("engine working directory does not exist: " + definition.workingDirectory());
        }

        List<String> command = new ArrayList<>(definition.command());
        LOGGER.info("Spawning engine ({}) in {}", mode.label(), definition.workingDirectory());
        LOGGER.debug("Engine command: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(definition.workingDirectory().toFile());
        builder.redirectErrorStream(true);
        builder.environment().putAll(definition.environment());
        builder.environment().put(GATEWAY_ADDRESS_ENV, controlAddress.toString());
        builder.environment().put(START_MODE_ENV, mode.label());

        Process process = builder.start();
        startOutputCapture(process);
        LOGGER.info("Engine process started with PID {}", process.pid());
        return new ProcessHandleEngine(process);
    }

    private static void startOutputCapture(Process process) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    OUTPUT.info("[{}] {}", process.pid(), line);
                }
            }
            catch (IOException e) {
                LOGGER.debug("Engine {} output closed: {}", process.pid(), e.getMessage());
            }
        }, "engine-output-" + process.pid());
        thread.setDaemon(true);
        thread.start();
    }

    static final class ProcessHandleEngine implements SpawnedEngine {
        private final Process process;
        private final CompletableFuture<Integer> exit;

        ProcessHandleEngine(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void destroyForcibly() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public String toString() {
            return "ProcessHandleEngine{pid=" + process.pid() + ", alive=" + process.isAlive() + '}';
        }
    }
}
