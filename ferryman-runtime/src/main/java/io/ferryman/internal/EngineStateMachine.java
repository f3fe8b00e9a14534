/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.channel.Channel;

import io.ferryman.gateway.EngineSpawner;
import io.ferryman.gateway.SpawnedEngine;
import io.ferryman.internal.util.Metrics;
import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.protocol.RestartMode;
import io.ferryman.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Owns the {@link EngineState} of the gateway's single engine slot and drives it from
 * lifecycle commands, engine control connections, process exits and timeouts.
 *
 * <p>All transitions happen under this object's monitor. Listener callbacks and command
 * completions are run after the monitor is released, in the order the transitions
 * happened.</p>
 *
 * <p>At most one lifecycle command is in flight: while the slot is {@code Starting} or
 * {@code Stopping} every other command is rejected.</p>
 */
public class EngineStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineStateMachine.class);

    static final String IN_PROGRESS = "operation in progress";
    static final String ALREADY_ATTACHED = "engine already attached";

    private final EngineSpawner spawner;
    private final EngineSlot slot;
    private final EngineLifecycleListener listener;
    private final ScheduledExecutorService scheduler;
    private final Duration attachTimeout;
    private final Duration stopTimeout;
    private final Clock clock;

    private final Counter attachCounter = Metrics.engineAttachCounter();
    private final Counter crashCounter = Metrics.engineCrashCounter();
    private final Counter forcedTerminationCounter = Metrics.engineForcedTerminationCounter();

    // guarded by this
    private EngineState state = EngineState.Absent.INSTANCE;
    private @Nullable PendingCommand pending;
    private @Nullable ScheduledFuture<?> timeout;
    private CompletableFuture<Void> absent = CompletableFuture.completedFuture(null);
    private long nextGeneration = 1;
    private long nextAttempt = 1;
    private boolean shuttingDown;

    public EngineStateMachine(EngineSpawner spawner,
                              EngineSlot slot,
                              EngineLifecycleListener listener,
                              ScheduledExecutorService scheduler,
                              Duration attachTimeout,
                              Duration stopTimeout,
                              Clock clock) {
        this.spawner = Objects.requireNonNull(spawner, "spawner");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.attachTimeout = Objects.requireNonNull(attachTimeout, "attachTimeout");
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized EngineState state() {
        return state;
    }

    // ==================== Lifecycle commands ====================

    /**
     * Apply {@code start}, {@code stop} or {@code reload}.
     *
     * @return completes when the transition the command started has finished, or
     *         immediately if the command was rejected or failed outright
     */
    public CompletableFuture<CommandResult> handleCommand(LifecycleCommand command) {
        List<Runnable> deferred = new ArrayList<>();
        CompletableFuture<CommandResult> result;
        synchronized (this) {
            result = applyCommand(command, deferred);
        }
        deferred.forEach(Runnable::run);
        return result;
    }

    private CompletableFuture<CommandResult> applyCommand(LifecycleCommand command, List<Runnable> deferred) {
        if (shuttingDown) {
            return CompletableFuture.completedFuture(CommandResult.rejected("gateway shutting down"));
        }
        if (state.isTransitioning()) {
            LOGGER.info("Rejecting {} while engine is {}", command.commandName(), state.label());
            return CompletableFuture.completedFuture(CommandResult.rejected(IN_PROGRESS));
        }
        switch (command) {
            case START:
                if (state instanceof EngineState.Running running) {
                    return CompletableFuture.completedFuture(CommandResult.rejected("engine already running (pid " + running.link().pid() + ")"));
                }
                return spawnFromAbsent(command, deferred);
            case RELOAD:
                if (state instanceof EngineState.Running running) {
                    return requestStop(running, command, true);
                }
                return spawnFromAbsent(command, deferred);
            case STOP:
                if (state instanceof EngineState.Running running) {
                    return requestStop(running, command, false);
                }
                return CompletableFuture.completedFuture(CommandResult.rejected("engine not running"));
            default:
                throw new IllegalArgumentException("not an engine transition: " + command);
        }
    }

    private CompletableFuture<CommandResult> spawnFromAbsent(LifecycleCommand command, List<Runnable> deferred) {
        PendingCommand request = new PendingCommand(command);
        pending = request;
        spawn(RestartMode.COLD, deferred);
        return request.future;
    }

    private CompletableFuture<CommandResult> requestStop(EngineState.Running running, LifecycleCommand command, boolean reloadAfter) {
        PendingCommand request = new PendingCommand(command);
        pending = request;
        EngineLink link = running.link();
        setState(running.toStopping(reloadAfter, clock.instant()));
        slot.drain(link);
        LOGGER.info("Asking engine (pid {}) to shut down for {}", link.pid(), command.commandName());
        link.send(new ControlMessage.Shutdown(command.commandName()));
        schedule(() -> onStopTimeout(link), stopTimeout);
        return request.future;
    }

    /**
     * Spawns an engine and moves to {@code Starting}; on failure moves to {@code Absent} and
     * fails the pending command. Caller holds the monitor.
     */
    private void spawn(RestartMode mode, List<Runnable> deferred) {
        long attempt = nextAttempt++;
        SpawnedEngine process;
        try {
            process = spawner.spawn(mode);
        }
        catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to spawn engine: {}", e.getMessage());
            LOGGER.debug("Spawn failure", e);
            setState(EngineState.Absent.INSTANCE);
            completePending(CommandResult.error("failed to spawn engine: " + e.getMessage()), deferred);
            return;
        }
        setState(EngineState.Absent.INSTANCE.toStarting(process, attempt, clock.instant()));
        schedule(() -> onAttachTimeout(attempt), attachTimeout);
        process.onExit().whenCompleteAsync((code, error) -> onSpawnedExit(attempt, code), scheduler);
    }

    // ==================== Engine control connection ====================

    /**
     * An engine said Hello on {@code channel}.
     *
     * @return the attached link, or null if another engine is already attached
     */
    @Nullable
    public EngineLink attachEngine(Channel channel, long pid) {
        List<Runnable> deferred = new ArrayList<>();
        EngineLink link;
        synchronized (this) {
            if (shuttingDown || state.attachedLink() != null) {
                LOGGER.warn("Rejecting engine (pid {}) from {}: engine is {}", pid, channel.remoteAddress(), shuttingDown ? "shutting down" : state.label());
                return null;
            }
            cancelTimeout();
            link = new EngineLink(nextGeneration++, pid, channel, clock.instant());
            if (state instanceof EngineState.Starting starting) {
                setState(starting.toRunning(link, clock.instant()));
            }
            else {
                LOGGER.info("Engine (pid {}) attached without being spawned by the gateway", pid);
                setState(EngineState.Absent.INSTANCE.toRunning(link, clock.instant()));
            }
            slot.attach(link);
            PendingCommand request = pending;
            if (request != null) {
                String verb = request.command == LifecycleCommand.RELOAD ? "reloaded" : "started";
                completePending(CommandResult.ok("engine " + verb + " (pid " + pid + ")"), deferred);
            }
        }
        attachCounter.increment();
        LOGGER.info("Engine attached: {}", link);
        listener.engineAttached(link);
        deferred.forEach(Runnable::run);
        return link;
    }

    /**
     * The engine announced it is going away.
     */
    public void engineStopping(EngineLink link, boolean clean) {
        link.announceStopping(clean);
        LOGGER.info("Engine (pid {}) is stopping, clean={}", link.pid(), clean);
    }

    /**
     * The control connection of {@code link} closed. Ignored unless {@code link} is the
     * attached engine.
     */
    public void engineDisconnected(EngineLink link) {
        detach(link, false);
    }

    private void detach(EngineLink link, boolean forced) {
        List<Runnable> deferred = new ArrayList<>();
        boolean clean;
        synchronized (this) {
            if (state.attachedLink() != link) {
                return;
            }
            slot.detach(link);
            clean = !forced && link.isCleanStop();
            if (clean) {
                LOGGER.info("Engine (pid {}) detached cleanly", link.pid());
            }
            else {
                crashCounter.increment();
                LOGGER.error("Engine (pid {}) lost without a clean shutdown{}", link.pid(), forced ? " (forcibly terminated)" : "");
            }

            if (state instanceof EngineState.Stopping stopping) {
                cancelTimeout();
                if (stopping.reloadAfter() && !shuttingDown) {
                    spawn(RestartMode.RELOAD, deferred);
                }
                else {
                    setState(EngineState.Absent.INSTANCE);
                    completePending(CommandResult.ok(forced ? "engine terminated after " + stopTimeout + " stop timeout" : "engine stopped"), deferred);
                }
            }
            else {
                setState(EngineState.Absent.INSTANCE);
            }
        }
        listener.engineDetached(link, clean);
        deferred.forEach(Runnable::run);
    }

    // ==================== Timeouts and process exits ====================

    @VisibleForTesting
    void onAttachTimeout(long attempt) {
        List<Runnable> deferred = new ArrayList<>();
        synchronized (this) {
            if (!(state instanceof EngineState.Starting starting) || starting.attempt() != attempt) {
                return;
            }
            timeout = null;
            LOGGER.error("Engine did not attach within {}, terminating it", attachTimeout);
            SpawnedEngine process = starting.process();
            if (process != null) {
                forcedTerminationCounter.increment();
                process.destroyForcibly();
            }
            setState(EngineState.Absent.INSTANCE);
            completePending(CommandResult.error("engine did not attach within " + attachTimeout), deferred);
        }
        deferred.forEach(Runnable::run);
    }

    @VisibleForTesting
    void onStopTimeout(EngineLink link) {
        SpawnedEngine process;
        synchronized (this) {
            if (!(state instanceof EngineState.Stopping stopping) || stopping.link() != link) {
                return;
            }
            timeout = null;
            process = stopping.process();
            LOGGER.warn("Engine (pid {}) did not stop within {}, terminating it", link.pid(), stopTimeout);
            forcedTerminationCounter.increment();
        }
        if (process != null) {
            process.destroyForcibly();
        }
        link.close();
        detach(link, true);
    }

    private void onSpawnedExit(long attempt, @Nullable Integer exitCode) {
        List<Runnable> deferred = new ArrayList<>();
        synchronized (this) {
            if (!(state instanceof EngineState.Starting starting) || starting.attempt() != attempt) {
                LOGGER.debug("Engine process from spawn attempt {} exited with status {}", attempt, exitCode);
                return;
            }
            cancelTimeout();
            LOGGER.error("Engine process exited with status {} before attaching", exitCode);
            setState(EngineState.Absent.INSTANCE);
            completePending(CommandResult.error("engine process exited with status " + exitCode + " before attaching"), deferred);
        }
        deferred.forEach(Runnable::run);
    }

    // ==================== Gateway shutdown ====================

    /**
     * Stop accepting commands and engines, and stop whatever engine is there.
     *
     * @return completes once the slot is {@code Absent}
     */
    public CompletableFuture<Void> shutdown() {
        List<Runnable> deferred = new ArrayList<>();
        CompletableFuture<Void> whenAbsent;
        synchronized (this) {
            shuttingDown = true;
            if (state instanceof EngineState.Running running) {
                requestStop(running, LifecycleCommand.STOP, false);
            }
            else if (state instanceof EngineState.Starting starting) {
                cancelTimeout();
                SpawnedEngine process = starting.process();
                if (process != null) {
                    process.destroyForcibly();
                }
                setState(EngineState.Absent.INSTANCE);
                completePending(CommandResult.error("gateway shutting down"), deferred);
            }
            whenAbsent = absent;
        }
        deferred.forEach(Runnable::run);
        return whenAbsent;
    }

    // ==================== Helpers, caller holds the monitor ====================

    private void setState(EngineState next) {
        LOGGER.trace("Engine state {} -> {}", state.label(), next.label());
        if (state instanceof EngineState.Absent && !(next instanceof EngineState.Absent)) {
            absent = new CompletableFuture<>();
        }
        else if (next instanceof EngineState.Absent) {
            absent.complete(null);
        }
        state = next;
    }

    private void completePending(CommandResult result, List<Runnable> deferred) {
        PendingCommand request = pending;
        pending = null;
        if (request != null) {
            LOGGER.info("{} finished: {} {}", request.command.commandName(), result.status(), result.detail());
            deferred.add(() -> request.future.complete(result));
        }
    }

    private void schedule(Runnable task, Duration delay) {
        cancelTimeout();
        timeout = scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelTimeout() {
        ScheduledFuture<?> current = timeout;
        timeout = null;
        if (current != null) {
            current.cancel(false);
        }
    }

    private static final class PendingCommand {
        private final LifecycleCommand command;
        private final CompletableFuture<CommandResult> future = new CompletableFuture<>();

        private PendingCommand(LifecycleCommand command) {
            this.command = command;
        }
    }
}
