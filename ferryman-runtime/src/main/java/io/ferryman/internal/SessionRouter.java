/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;

import io.ferryman.config.InputQueueDefinition;
import io.ferryman.config.ThrottleDefinition;
import io.ferryman.internal.util.Metrics;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.session.Capabilities;
import io.ferryman.session.ClientConnection;
import io.ferryman.session.PendingInput;
import io.ferryman.session.Session;
import io.ferryman.session.SessionRegistry;

/**
 * Moves bytes between client sessions and whichever engine is attached.
 *
 * <p>Input from a session flows straight to the engine only once the session has been
 * resynced to that engine's generation; until then it waits in the session's pending
 * input queue. Resync and queue draining happen under the session's monitor, as does
 * live routing, so an engine always sees a session's input in the order it was typed.</p>
 *
 * <p>Once the attached engine has been asked to shut down it is draining: input and new
 * sessions are held for the next engine exactly as if none were attached.</p>
 *
 * <p>Lock order is session monitor, then the {@link EngineSlot} read lock.</p>
 */
public class SessionRouter implements EngineLifecycleListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRouter.class);

    private final SessionRegistry registry;
    private final EngineSlot slot;
    private final InputThrottle throttle;
    private final InputQueueDefinition queueDefinition;
    private final ThrottleDefinition throttleDefinition;

    private final Counter routedCounter = Metrics.inboundRoutedCounter();
    private final Counter queuedCounter = Metrics.inboundQueuedCounter();
    private final Counter flushedCounter = Metrics.inboundFlushedCounter();
    private final Counter overflowCounter = Metrics.inboundDroppedCounter("overflow");
    private final Counter rejectedCounter = Metrics.inboundDroppedCounter("rejected");
    private final Counter rateCounter = Metrics.inboundDroppedCounter("rate");
    private final Counter lengthCounter = Metrics.inboundDroppedCounter("length");
    private final Counter closedSessionCounter = Metrics.outboundDiscardedCounter("closed");

    public SessionRouter(SessionRegistry registry,
                         EngineSlot slot,
                         InputQueueDefinition queueDefinition,
                         ThrottleDefinition throttleDefinition) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.queueDefinition = Objects.requireNonNull(queueDefinition, "queueDefinition");
        this.throttleDefinition = Objects.requireNonNull(throttleDefinition, "throttleDefinition");
        this.throttle = new InputThrottle(throttleDefinition);
    }

    public SessionRegistry registry() {
        return registry;
    }

    // ==================== Client side ====================

    /**
     * Registers a newly accepted client and, if an engine is attached, tells it about the session.
     */
    public Session acceptClient(String protocol, String remoteAddress, Capabilities capabilities, ClientConnection connection) {
        Session session = registry.create(protocol, remoteAddress, capabilities, connection);
        Metrics.clientConnectionCounter(protocol).increment();
        LOGGER.info("{}: {} client connected from {}", session.id(), protocol, remoteAddress);
        synchronized (session) {
            slot.withLink(link -> {
                if (EngineSlot.isAccepting(link)) {
                    link.send(new ControlMessage.SessionOpened(session.snapshot()));
                    session.markSynced(link.generation());
                }
                return null;
            });
        }
        return session;
    }

    /**
     * Client input, called on the client's event loop.
     */
    public void routeInbound(Session session, byte[] input) {
        InputThrottle.Verdict verdict = throttle.check(session, input, System.nanoTime());
        if (verdict == InputThrottle.Verdict.TOO_LONG) {
            lengthCounter.increment();
            LOGGER.debug("{}: Discarding {} bytes of input over the length limit", session.id(), input.length);
            session.connection().sendNotice(throttleDefinition.inputLengthNotice());
            return;
        }
        if (verdict == InputThrottle.Verdict.TOO_FAST) {
            rateCounter.increment();
            LOGGER.debug("{}: Discarding input over the command rate limit", session.id());
            session.connection().sendNotice(throttleDefinition.commandRateNotice());
            return;
        }

        synchronized (session) {
            slot.withLink(link -> {
                boolean accepting = EngineSlot.isAccepting(link);
                if (accepting && session.syncedGeneration() == link.generation()) {
                    link.send(new ControlMessage.Data(session.id(), input));
                    routedCounter.increment();
                }
                else {
                    queue(session, input, !accepting);
                }
                return null;
            });
        }
    }

    /**
     * Input that the protocol decoder refused as oversized before it reached {@link #routeInbound}.
     */
    public void inputTooLong(Session session) {
        lengthCounter.increment();
        session.connection().sendNotice(throttleDefinition.inputLengthNotice());
    }

    // caller holds the session monitor
    private void queue(Session session, byte[] input, boolean outage) {
        PendingInput.Offer offer = session.pendingInput().offer(input);
        switch (offer) {
            case QUEUED:
                queuedCounter.increment();
                break;
            case QUEUED_DROPPED_OLDEST:
                queuedCounter.increment();
                overflowCounter.increment();
                LOGGER.debug("{}: Pending input full, dropped oldest entry", session.id());
                break;
            case REJECTED:
                rejectedCounter.increment();
                LOGGER.debug("{}: Pending input full, rejected new entry", session.id());
                session.connection().sendNotice(queueDefinition.unavailableNotice());
                return;
            default:
                throw new IllegalStateException("unexpected offer outcome " + offer);
        }
        if (outage && session.claimOutageNotice()) {
            session.connection().sendNotice(queueDefinition.restartingNotice());
        }
    }

    /**
     * The client's socket closed. Removes the session and tells the engine.
     */
    public void clientClosed(Session session, String reason) {
        if (registry.remove(session.id()).isEmpty()) {
            return;
        }
        LOGGER.info("{}: Client disconnected: {}", session.id(), reason);
        synchronized (session) {
            slot.withLink(link -> {
                if (link != null && session.syncedGeneration() == link.generation()) {
                    link.send(new ControlMessage.Disconnect(session.id(), reason));
                }
                return null;
            });
        }
    }

    // ==================== Engine side ====================

    /**
     * Engine output for a session. Output for a session that no longer exists is dropped.
     */
    public void routeOutbound(long sessionId, byte[] payload) {
        Session session = registry.get(sessionId);
        if (session == null) {
            closedSessionCounter.increment();
            LOGGER.debug("{}: Discarding {} bytes for unknown session", sessionId, payload.length);
            return;
        }
        session.connection().deliver(payload);
    }

    /**
     * The engine asked for a client to be disconnected.
     */
    public void disconnectClient(long sessionId, String reason) {
        registry.remove(sessionId).ifPresentOrElse(session -> {
            LOGGER.info("{}: Engine disconnected client: {}", sessionId, reason);
            session.connection().close(reason);
        }, () -> LOGGER.debug("{}: Engine disconnect for unknown session", sessionId));
    }

    public void sessionUpdated(ControlMessage.SessionUpdate update) {
        if (!registry.update(update.sessionId(), update.accountId(), update.puppetRef(), update.capabilities())) {
            LOGGER.debug("{}: Update for unknown session ignored", update.sessionId());
        }
    }

    public void resyncFailed(long sessionId, String detail) {
        LOGGER.warn("{}: Engine could not resume session: {}", sessionId, detail);
        registry.markUnbound(sessionId);
    }

    public void announce(String message) {
        List<Session> sessions = registry.sessions();
        LOGGER.info("Announcing to {} sessions: {}", sessions.size(), message);
        for (Session session : sessions) {
            session.connection().sendNotice(message);
        }
    }

    // ==================== Engine lifecycle ====================

    /**
     * Resyncs every session to the new engine. A session closed after the registry copy was
     * taken is skipped; one closed after its resync gets a {@code Disconnect} from
     * {@link #clientClosed}.
     */
    @Override
    public void engineAttached(EngineLink link) {
        List<Session> sessions = registry.sessions();
        LOGGER.info("Resyncing {} sessions to engine generation {}", sessions.size(), link.generation());
        for (Session session : sessions) {
            synchronized (session) {
                slot.withLink(current -> {
                    if (current == link && session.syncedGeneration() != link.generation() && registry.get(session.id()) == session) {
                        resync(session, link);
                    }
                    return null;
                });
            }
        }
    }

    // caller holds the session monitor and the slot read lock
    private void resync(Session session, EngineLink link) {
        link.send(new ControlMessage.ResyncSession(session.snapshot()));
        List<byte[]> pending = session.pendingInput().drain();
        for (byte[] input : pending) {
            link.send(new ControlMessage.Data(session.id(), input));
        }
        flushedCounter.increment(pending.size());
        session.markSynced(link.generation());
        if (!pending.isEmpty()) {
            LOGGER.debug("{}: Flushed {} queued inputs", session.id(), pending.size());
        }
    }

    @Override
    public void engineDetached(EngineLink link, boolean clean) {
        LOGGER.info("Engine generation {} detached ({}), holding {} sessions", link.generation(), clean ? "clean" : "crash", registry.size());
    }
}
