/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * How the gateway launches its engine and how long it waits for lifecycle transitions.
 *
 * @param command executable and arguments; empty if engines are only ever started by hand
 * @param workingDirectory working directory of the spawned process
 * @param environment extra environment variables
 * @param attachTimeout how long a spawned engine has to dial in
 * @param stopTimeout how long a stopping engine has to report a clean shutdown
 * @param autoStart whether the gateway spawns an engine as soon as it is up
 */
public record EngineDefinition(@Nullable List<String> command,
                               @Nullable Path workingDirectory,
                               @Nullable Map<String, String> environment,
                               @Nullable Duration attachTimeout,
                               @Nullable Duration stopTimeout,
                               @Nullable Boolean autoStart) {

    public static final Duration DEFAULT_ATTACH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(15);

    public EngineDefinition {
        command = command == null ? List.of() : List.copyOf(command);
        workingDirectory = workingDirectory == null ? Path.of(".") : workingDirectory;
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        attachTimeout = positive(attachTimeout, DEFAULT_ATTACH_TIMEOUT, "attachTimeout");
        stopTimeout = positive(stopTimeout, DEFAULT_STOP_TIMEOUT, "stopTimeout");
        autoStart = autoStart == null ? Boolean.valueOf(!command.isEmpty()) : autoStart;
    }

    public static EngineDefinition defaults() {
        return new EngineDefinition(null, null, null, null, null, null);
    }

    public boolean hasCommand() {
        return !command.isEmpty();
    }

    private static Duration positive(@Nullable Duration value, Duration fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new ConfigurationException("engine." + field + " must be positive, got " + value);
        }
        return value;
    }
}
