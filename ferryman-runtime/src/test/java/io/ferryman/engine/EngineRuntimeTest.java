/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.RestartMode;
import io.ferryman.protocol.SessionSnapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineRuntimeTest {

    private final BlockingQueue<ControlMessage> sent = new LinkedBlockingQueue<>();
    private EngineRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null && runtime.isAccepting()) {
            runtime.shutdown();
        }
    }

    private EngineRuntime runtime(CommandDispatcher dispatcher, SessionListener listener, SessionPolicy policy, WorldPersistence persistence, Duration drainTimeout) {
        return runtime(dispatcher, listener, policy, EngineLifecycleHooks.NONE, persistence, drainTimeout);
    }

    private EngineRuntime runtime(CommandDispatcher dispatcher,
                                  SessionListener listener,
                                  SessionPolicy policy,
                                  EngineLifecycleHooks hooks,
                                  WorldPersistence persistence,
                                  Duration drainTimeout) {
        runtime = new EngineRuntime(dispatcher, persistence, listener, policy, hooks, Executors.newFixedThreadPool(4), drainTimeout);
        runtime.bind(sent::add);
        return runtime;
    }

    private EngineRuntime runtime(CommandDispatcher dispatcher, SessionListener listener, SessionPolicy policy) {
        return runtime(dispatcher, listener, policy, WorldPersistence.NONE, Duration.ofSeconds(5));
    }

    private static SessionSnapshot snapshot(long id, String account, String puppet) {
        return new SessionSnapshot(id, "telnet", "10.0.0.1:5000", 1000 + id, account, puppet, Map.of("encoding", "UTF-8"));
    }

    private static CommandDispatcher echo() {
        return (session, input) -> List.of(("> " + new String(input, StandardCharsets.UTF_8)).getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private ControlMessage next() throws InterruptedException {
        ControlMessage message = sent.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "expected a control message");
        return message;
    }

    private String nextDataText() throws InterruptedException {
        return new String(assertInstanceOf(ControlMessage.Data.class, next()).payload(), StandardCharsets.UTF_8);
    }

    // ==================== Session hand-over ====================

    @Test
    void openedAndResumedSessions_runMatchingHook() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        CountDownLatch hooks = new CountDownLatch(2);
        runtime(echo(), new SessionListener() {
            @Override
            public void sessionOpened(EngineSession session) {
                calls.add("opened " + session.id());
                hooks.countDown();
            }

            @Override
            public void sessionResumed(EngineSession session) {
                calls.add("resumed " + session.id());
                hooks.countDown();
            }
        }, SessionPolicy.defaults());

        runtime.onSessionAttach(snapshot(1, "alice", "#1"), true);
        runtime.onSessionAttach(snapshot(2, null, null), false);

        assertTrue(hooks.await(5, TimeUnit.SECONDS));
        assertTrue(calls.contains("resumed 1"));
        assertTrue(calls.contains("opened 2"));
        assertEquals("alice", runtime.sessions().get(1).accountId());
        assertEquals("#1", runtime.sessions().get(1).puppetRef());
    }

    @Test
    void repeatedResync_runsHookOnce() throws Exception {
        AtomicInteger resumed = new AtomicInteger();
        runtime(echo(), new SessionListener() {
            @Override
            public void sessionResumed(EngineSession session) {
                resumed.incrementAndGet();
            }
        }, SessionPolicy.defaults());

        runtime.onSessionAttach(snapshot(1, "alice", "#1"), true);
        runtime.onSessionAttach(snapshot(1, "alice", "#1"), true);
        runtime.onInbound(1, bytes("ping"));

        assertEquals("> ping", nextDataText());
        assertEquals(1, resumed.get());
        assertEquals(1, runtime.sessions().size());
    }

    @Test
    void resumeFailure_reportsResyncFailed() throws Exception {
        runtime(echo(), new SessionListener() {
            @Override
            public void sessionResumed(EngineSession session) {
                throw new IllegalStateException("puppet #9 no longer exists");
            }
        }, SessionPolicy.defaults());

        runtime.onSessionAttach(snapshot(4, "alice", "#9"), true);

        assertEquals(new ControlMessage.ResyncFailed(4, "puppet #9 no longer exists"), next());
        EngineSession session = runtime.sessions().get(4);
        assertEquals("puppet #9 no longer exists", session.failure());
        assertNull(session.puppetRef());
        assertEquals("alice", session.accountId());
    }

    // ==================== Input ====================

    @Test
    void inputForOneSession_processedInOrder() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);

        for (int i = 0; i < 100; i++) {
            runtime.onInbound(1, bytes("cmd " + i));
        }

        for (int i = 0; i < 100; i++) {
            assertEquals("> cmd " + i, nextDataText());
        }
    }

    @Test
    void failingCommand_doesNotStopSession() throws Exception {
        runtime((session, input) -> {
            String text = new String(input, StandardCharsets.UTF_8);
            if (text.equals("crash")) {
                throw new IOException("command blew up");
            }
            return List.of(bytes("ok " + text));
        }, SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);

        runtime.onInbound(1, bytes("crash"));
        runtime.onInbound(1, bytes("look"));

        assertEquals("ok look", nextDataText());
    }

    @Test
    void inputForUnknownSession_dropped() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());

        runtime.onInbound(77, bytes("hello"));

        assertNull(sent.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void sessionClosed_forgetsSessionAndRunsHook() throws Exception {
        CountDownLatch closed = new CountDownLatch(1);
        runtime(echo(), new SessionListener() {
            @Override
            public void sessionClosed(EngineSession session, String reason) {
                if (reason.equals("connection closed")) {
                    closed.countDown();
                }
            }
        }, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);

        runtime.onSessionClosed(1, "connection closed");

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertNull(runtime.sessions().get(1));
    }

    @Test
    void engineDisconnect_runsClosedHook() throws Exception {
        List<String> reasons = new CopyOnWriteArrayList<>();
        CountDownLatch closed = new CountDownLatch(1);
        runtime(echo(), new SessionListener() {
            @Override
            public void sessionClosed(EngineSession session, String reason) {
                reasons.add(reason);
                closed.countDown();
            }
        }, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);

        runtime.sessions().get(1).disconnect("kicked");

        assertEquals(new ControlMessage.Disconnect(1, "kicked"), next());
        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("kicked"), reasons);
    }

    // ==================== Idle sessions ====================

    @Test
    void idleSession_toldAndDisconnected() throws Exception {
        runtime(echo(), SessionListener.NONE, new SessionPolicy(0, false, false, Duration.ofMillis(50)));
        runtime.onSessionAttach(snapshot(1, null, null), false);
        Thread.sleep(120);

        assertEquals(1, runtime.disconnectIdleSessions(System.nanoTime()));

        assertEquals("idle timeout exceeded, disconnecting.\r\n", nextDataText());
        assertEquals(new ControlMessage.Disconnect(1, SessionPolicy.IDLE_TIMEOUT_REASON), next());
        assertNull(runtime.sessions().get(1));
    }

    @Test
    void recentInput_keepsSessionOpen() throws Exception {
        runtime(echo(), SessionListener.NONE, new SessionPolicy(0, false, false, Duration.ofMinutes(5)));
        runtime.onSessionAttach(snapshot(1, null, null), false);
        runtime.onSessionAttach(snapshot(2, null, null), false);
        long later = System.nanoTime() + Duration.ofMinutes(4).toNanos();
        runtime.sessions().get(2).inputReceived(later);

        assertEquals(1, runtime.disconnectIdleSessions(later + Duration.ofMinutes(2).toNanos()));

        // session 1 is re-checked against the real clock before it is dropped
        assertEquals(2, runtime.sessions().size());
        assertNull(sent.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void zeroIdleTimeout_neverDisconnects() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);

        assertEquals(0, runtime.disconnectIdleSessions(System.nanoTime() + Duration.ofDays(1).toNanos()));

        assertNotNull(runtime.sessions().get(1));
        assertNull(sent.poll(200, TimeUnit.MILLISECONDS));
    }

    // ==================== Accounts ====================

    @Test
    void login_beyondSessionLimit_disconnectsOldest() throws Exception {
        runtime(echo(), SessionListener.NONE, new SessionPolicy(1, false, false));
        runtime.onSessionAttach(snapshot(1, "alice", null), true);
        runtime.onSessionAttach(snapshot(2, null, null), false);

        runtime.sessions().get(2).authenticate("alice");

        assertEquals(new ControlMessage.Disconnect(1, "logged in from another location"), next());
        ControlMessage.SessionUpdate update = assertInstanceOf(ControlMessage.SessionUpdate.class, next());
        assertEquals(2, update.sessionId());
        assertEquals("alice", update.accountId());
        assertNull(runtime.sessions().get(1));
    }

    @Test
    void login_withoutLimit_keepsOtherSessions() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, "alice", null), true);
        runtime.onSessionAttach(snapshot(2, null, null), false);

        runtime.sessions().get(2).authenticate("alice");

        assertInstanceOf(ControlMessage.SessionUpdate.class, next());
        assertEquals(2, runtime.sessions().forAccount("alice").size());
    }

    @Test
    void login_autoPuppetsLastCharacter() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, "alice", "#12"), true);
        runtime.onSessionAttach(snapshot(2, null, null), false);

        runtime.sessions().get(2).authenticate("alice");

        ControlMessage.SessionUpdate update = assertInstanceOf(ControlMessage.SessionUpdate.class, next());
        assertEquals("#12", update.puppetRef());
    }

    @Test
    void bindPuppet_pushesUpdate() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, "alice", null), true);
        EngineSession session = runtime.sessions().get(1);

        session.bindPuppet("#3");
        session.updateCapabilities(Map.of("screenWidth", "120"));

        assertEquals(new ControlMessage.SessionUpdate(1, "alice", "#3", Map.of("encoding", "UTF-8")), next());
        assertEquals(new ControlMessage.SessionUpdate(1, "alice", "#3", Map.of("encoding", "UTF-8", "screenWidth", "120")), next());
    }

    // ==================== Start and shutdown ====================

    @Test
    void start_runsHookWithMode() {
        List<RestartMode> starts = new CopyOnWriteArrayList<>();
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), new EngineLifecycleHooks() {
            @Override
            public void engineStarting(RestartMode mode) {
                starts.add(mode);
            }
        }, WorldPersistence.NONE, Duration.ofSeconds(5));

        runtime.start(RestartMode.RELOAD);

        assertEquals(List.of(RestartMode.RELOAD), starts);
    }

    @Test
    void start_hookFailureIsReported() {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), new EngineLifecycleHooks() {
            @Override
            public void engineStarting(RestartMode mode) {
                throw new IllegalArgumentException("no world");
            }
        }, WorldPersistence.NONE, Duration.ofSeconds(5));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> runtime.start(RestartMode.COLD));
        assertEquals("engine start hook failed: no world", e.getMessage());
    }

    @Test
    void shutdown_runsStopHookBeforeFlush() {
        List<String> calls = new CopyOnWriteArrayList<>();
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), new EngineLifecycleHooks() {
            @Override
            public void engineStopping(RestartMode mode) {
                calls.add("stopping " + mode.label());
            }
        }, () -> calls.add("flush"), Duration.ofSeconds(5));

        assertTrue(runtime.shutdown(RestartMode.RELOAD));
        assertEquals(List.of("stopping reload", "flush"), calls);
    }

    @Test
    void shutdown_stopHookFailureIsUnclean() {
        AtomicBoolean flushed = new AtomicBoolean();
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), new EngineLifecycleHooks() {
            @Override
            public void engineStopping(RestartMode mode) throws IOException {
                throw new IOException("cannot save");
            }
        }, () -> flushed.set(true), Duration.ofSeconds(5));

        assertFalse(runtime.shutdown(RestartMode.COLD));
        assertTrue(flushed.get());
    }

    @Test
    void shutdown_flushesAndReportsClean() {
        AtomicBoolean flushed = new AtomicBoolean();
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), () -> flushed.set(true), Duration.ofSeconds(5));

        assertTrue(runtime.shutdown());
        assertTrue(flushed.get());
        assertFalse(runtime.isAccepting());
    }

    @Test
    void shutdown_flushFailureIsUnclean() {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults(), () -> {
            throw new IOException("disk full");
        }, Duration.ofSeconds(5));

        assertFalse(runtime.shutdown());
    }

    @Test
    void shutdown_drainTimeoutIsUnclean() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        runtime((session, input) -> {
            started.countDown();
            never.await();
            return List.of();
        }, SessionListener.NONE, SessionPolicy.defaults(), WorldPersistence.NONE, Duration.ofMillis(100));
        runtime.onSessionAttach(snapshot(1, null, null), false);
        runtime.onInbound(1, bytes("hang"));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertFalse(runtime.shutdown());
    }

    @Test
    void inputAfterShutdown_discarded() throws Exception {
        runtime(echo(), SessionListener.NONE, SessionPolicy.defaults());
        runtime.onSessionAttach(snapshot(1, null, null), false);
        runtime.shutdown();

        runtime.onInbound(1, bytes("late"));

        assertNull(sent.poll(200, TimeUnit.MILLISECONDS));
    }
}
