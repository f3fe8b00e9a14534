/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.RestartMode;
import io.ferryman.protocol.SessionSnapshot;

/**
 * Engine-side session handling: adopts the sessions the gateway hands over, runs client
 * input through the {@link CommandDispatcher} and sends the output back.
 *
 * <p>Input for one session is processed in arrival order on that session's
 * {@link SerialExecutor}; different sessions run in parallel on the shared worker pool.</p>
 *
 * <p>When the {@link SessionPolicy} sets an idle timeout, {@link #disconnectIdleSessions}
 * closes sessions whose client has been silent for longer; {@link EngineClient} calls it
 * periodically.</p>
 */
public class EngineRuntime {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineRuntime.class);

    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(10);

    private final CommandDispatcher dispatcher;
    private final WorldPersistence persistence;
    private final SessionListener listener;
    private final SessionPolicy policy;
    private final EngineLifecycleHooks hooks;
    private final ExecutorService workers;
    private final Duration drainTimeout;

    private final EngineSessionTable table = new EngineSessionTable();
    private final Map<String, String> lastPuppets = new ConcurrentHashMap<>();

    private volatile ControlSender sender = message -> {
        throw new IllegalStateException("engine runtime is not connected to a gateway");
    };
    private volatile boolean accepting = true;

    public EngineRuntime(CommandDispatcher dispatcher,
                         WorldPersistence persistence,
                         SessionListener listener,
                         SessionPolicy policy,
                         ExecutorService workers,
                         Duration drainTimeout) {
        this(dispatcher, persistence, listener, policy, EngineLifecycleHooks.NONE, workers, drainTimeout);
    }

    public EngineRuntime(CommandDispatcher dispatcher,
                         WorldPersistence persistence,
                         SessionListener listener,
                         SessionPolicy policy,
                         EngineLifecycleHooks hooks,
                         ExecutorService workers,
                         Duration drainTimeout) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.hooks = Objects.requireNonNull(hooks, "hooks");
        this.workers = Objects.requireNonNull(workers, "workers");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    }

    public void bind(ControlSender sender) {
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    public EngineSessionTable sessions() {
        return table;
    }

    public SessionPolicy policy() {
        return policy;
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Runs the start hook. Call once, before connecting to the gateway.
     *
     * @throws IllegalStateException if the hook failed
     */
    public void start(RestartMode mode) {
        LOGGER.info("Engine starting ({})", mode.label());
        try {
            hooks.engineStarting(mode);
        }
        catch (Exception e) {
            throw new IllegalStateException("engine start hook failed: " + e.getMessage(), e);
        }
    }

    // ==================== Gateway to engine ====================

    /**
     * Adopt a session. Idempotent: a session already known keeps its state and no hook runs.
     *
     * @param snapshot the session as the gateway holds it
     * @param resumed true for a session that predates this engine, false for a new connection
     */
    public void onSessionAttach(SessionSnapshot snapshot, boolean resumed) {
        EngineSessionTable.Attach attach = table.attach(snapshot, s -> new EngineSession(s, this, new SerialExecutor(workers)));
        EngineSession session = attach.session();
        if (!attach.created()) {
            LOGGER.debug("{}: Session already attached", session.id());
            return;
        }
        if (snapshot.accountId() != null && snapshot.puppetRef() != null) {
            lastPuppets.put(snapshot.accountId(), snapshot.puppetRef());
        }
        LOGGER.debug("{}: Session {} ({})", session.id(), resumed ? "resumed" : "opened", session);
        submit(session, () -> {
            try {
                if (resumed) {
                    listener.sessionResumed(session);
                }
                else {
                    listener.sessionOpened(session);
                }
            }
            catch (Exception e) {
                String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                LOGGER.warn("{}: Could not {} session: {}", session.id(), resumed ? "resume" : "open", detail);
                session.markFailed(detail);
                sender.send(new ControlMessage.ResyncFailed(session.id(), detail));
            }
        });
    }

    public void onInbound(long sessionId, byte[] input) {
        if (!accepting) {
            LOGGER.debug("{}: Input after shutdown began, discarded", sessionId);
            return;
        }
        EngineSession session = table.get(sessionId);
        if (session == null) {
            LOGGER.warn("{}: Input for unknown session discarded", sessionId);
            return;
        }
        session.inputReceived(System.nanoTime());
        submit(session, () -> {
            List<byte[]> output;
            try {
                output = dispatcher.dispatch(session, input);
            }
            catch (Exception e) {
                LOGGER.warn("{}: Command failed: {}", sessionId, e.getMessage());
                LOGGER.debug("{}: Command failure detail", sessionId, e);
                return;
            }
            for (byte[] payload : output) {
                emitOutbound(sessionId, payload);
            }
        });
    }

    public void onSessionClosed(long sessionId, String reason) {
        EngineSession session = table.remove(sessionId);
        if (session == null) {
            return;
        }
        LOGGER.debug("{}: Session closed: {}", sessionId, reason);
        submit(session, () -> listener.sessionClosed(session, reason));
    }

    private void submit(EngineSession session, Runnable task) {
        try {
            session.executor().execute(task);
        }
        catch (RejectedExecutionException e) {
            LOGGER.debug("{}: Work rejected, engine is shutting down", session.id());
        }
    }

    // ==================== Engine to gateway ====================

    public void emitOutbound(long sessionId, byte[] payload) {
        sender.send(new ControlMessage.Data(sessionId, payload));
    }

    /**
     * Broadcast a message to every client of the gateway.
     */
    public void announce(String message) {
        sender.send(new ControlMessage.Announce(message));
    }

    void authenticate(EngineSession session, String accountId) {
        if (policy.limitsSessions()) {
            List<EngineSession> existing = table.forAccount(accountId);
            existing.remove(session);
            int excess = existing.size() + 1 - policy.maxSessionsPerAccount();
            for (int i = 0; i < excess; i++) {
                EngineSession older = existing.get(i);
                LOGGER.info("{}: Disconnecting, account {} logged in from session {}", older.id(), accountId, session.id());
                older.disconnect("logged in from another location");
            }
        }
        session.setAccount(accountId);
        String lastPuppet = lastPuppets.get(accountId);
        if (policy.autoPuppet() && lastPuppet != null && session.puppetRef() == null) {
            LOGGER.debug("{}: Re-binding puppet {} for account {}", session.id(), lastPuppet, accountId);
            session.setPuppet(lastPuppet);
        }
        pushUpdate(session);
    }

    void puppetBound(EngineSession session) {
        String accountId = session.accountId();
        String puppetRef = session.puppetRef();
        if (accountId != null && puppetRef != null) {
            lastPuppets.put(accountId, puppetRef);
        }
    }

    void pushUpdate(EngineSession session) {
        sender.send(new ControlMessage.SessionUpdate(session.id(), session.accountId(), session.puppetRef(), session.capabilities()));
    }

    void disconnect(EngineSession session, String reason) {
        if (table.remove(session.id()) != null) {
            sender.send(new ControlMessage.Disconnect(session.id(), reason));
            submit(session, () -> listener.sessionClosed(session, reason));
        }
    }

    // ==================== Idle sessions ====================

    /**
     * Disconnects every session idle for longer than the policy's idle timeout. The check is
     * repeated on the session's executor, so input queued ahead of it counts.
     *
     * @param nowNanos current {@link System#nanoTime()}
     * @return sessions found idle
     */
    public int disconnectIdleSessions(long nowNanos) {
        if (!policy.limitsIdleTime() || !accepting) {
            return 0;
        }
        long timeoutNanos = policy.idleTimeout().toNanos();
        int idle = 0;
        for (EngineSession session : table.sessions()) {
            if (session.idleNanos(nowNanos) <= timeoutNanos) {
                continue;
            }
            idle++;
            submit(session, () -> {
                if (session.idleNanos(System.nanoTime()) > timeoutNanos && table.get(session.id()) == session) {
                    LOGGER.info("{}: Disconnecting after {} without input", session.id(), policy.idleTimeout());
                    session.sendLine(SessionPolicy.IDLE_TIMEOUT_REASON + ", disconnecting.");
                    disconnect(session, SessionPolicy.IDLE_TIMEOUT_REASON);
                }
            });
        }
        return idle;
    }

    // ==================== Shutdown ====================

    /**
     * Cold shutdown, see {@link #shutdown(RestartMode)}.
     */
    public boolean shutdown() {
        return shutdown(RestartMode.COLD);
    }

    /**
     * Stop taking input, let in-flight commands finish (bounded by the drain timeout), run
     * the stop hook and flush world state.
     *
     * @param mode whether the gateway will start another engine for the same sessions
     * @return true if everything drained and the hook and the flush succeeded
     */
    public boolean shutdown(RestartMode mode) {
        accepting = false;
        boolean clean = true;
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("In-flight commands did not finish within {}, abandoning them", drainTimeout);
                workers.shutdownNow();
                clean = false;
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            clean = false;
        }
        try {
            hooks.engineStopping(mode);
        }
        catch (Exception e) {
            LOGGER.error("Engine stop hook failed ({}): {}", mode.label(), e.getMessage(), e);
            clean = false;
        }
        try {
            persistence.flush();
        }
        catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to flush world state: {}", e.getMessage(), e);
            clean = false;
        }
        LOGGER.info("Engine runtime stopped ({}), clean={}", mode.label(), clean);
        return clean;
    }
}
