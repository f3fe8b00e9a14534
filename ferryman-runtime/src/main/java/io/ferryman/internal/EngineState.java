/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.ferryman.internal;

import java.time.Instant;
import java.util.Objects;

import io.ferryman.gateway.SpawnedEngine;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sealed hierarchy representing the gateway's single engine slot.
 *
 * <pre>
 *   Absent ◄──────────────────────────────────────────┐
 *      │ start / reload                               │ crash, attach timeout,
 *      ▼                                              │ spawned process exited
 *   Starting ─────────────────────────────────────────┤
 *      │ engine Hello                                 │
 *      ▼                                              │
 *   Running ──────────────────────────────────────────┤
 *      │ stop / reload                                │
 *      ▼                                              │
 *   Stopping ──── detach (clean, crash or forced) ────┘
 *                 └── reload: straight on to Starting
 * </pre>
 *
 * An engine that dials in while the slot is {@code Absent} (started by hand rather than
 * spawned) moves it straight to {@code Running}.
 */
public sealed interface EngineState permits
        EngineState.Absent,
        EngineState.Starting,
        EngineState.Running,
        EngineState.Stopping {

    /**
     * No engine attached and none expected.
     */
    record Absent() implements EngineState {
        public static final Absent INSTANCE = new Absent();

        public Starting toStarting(@Nullable SpawnedEngine process, long attempt, Instant now) {
            return new Starting(process, attempt, now);
        }

        public Running toRunning(EngineLink link, Instant now) {
            return new Running(link, null, now);
        }
    }

    /**
     * Engine spawned, waiting for it to dial in.
     *
     * @param process the spawned process
     * @param attempt identifies this spawn so stale timeouts can be ignored
     * @param since when the spawn happened
     */
    record Starting(@Nullable SpawnedEngine process, long attempt, Instant since) implements EngineState {
        public Starting {
            Objects.requireNonNull(since);
        }

        public Running toRunning(EngineLink link, Instant now) {
            return new Running(link, process, now);
        }
    }

    /**
     * Engine attached; session traffic flows.
     */
    record Running(EngineLink link, @Nullable SpawnedEngine process, Instant since) implements EngineState {
        public Running {
            Objects.requireNonNull(link);
            Objects.requireNonNull(since);
        }

        public Stopping toStopping(boolean reloadAfter, Instant now) {
            return new Stopping(link, process, reloadAfter, now);
        }
    }

    /**
     * Engine asked to shut down, waiting for it to detach.
     *
     * @param reloadAfter spawn a replacement as soon as this engine is gone
     */
    record Stopping(EngineLink link, @Nullable SpawnedEngine process, boolean reloadAfter, Instant since) implements EngineState {
        public Stopping {
            Objects.requireNonNull(link);
            Objects.requireNonNull(since);
        }
    }

    /**
     * @return ABSENT, STARTING, RUNNING or STOPPING
     */
    default String label() {
        if (this instanceof Absent) {
            return "ABSENT";
        }
        else if (this instanceof Starting) {
            return "STARTING";
        }
        else if (this instanceof Running) {
            return "RUNNING";
        }
        return "STOPPING";
    }

    default boolean isTransitioning() {
        return this instanceof Starting || this instanceof Stopping;
    }

    @Nullable
    default EngineLink attachedLink() {
        if (this instanceof Running running) {
            return running.link();
        }
        else if (this instanceof Stopping stopping) {
            return stopping.link();
        }
        return null;
    }
}
