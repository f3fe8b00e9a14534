/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.ferryman.protocol.SessionSnapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(4, OverflowPolicy.DROP_OLDEST, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Session create() {
        return registry.create("telnet", "127.0.0.1:4000", Capabilities.of(StandardCharsets.UTF_8, true, 80), new RecordingConnection());
    }

    // ==================== Create and remove ====================

    @Test
    void create_assignsIncreasingIdsFromOne() {
        assertEquals(1, create().id());
        assertEquals(2, create().id());
        assertEquals(3, create().id());
    }

    @Test
    void create_idsAreNotReusedAfterRemove() {
        Session first = create();
        registry.remove(first.id());

        assertEquals(2, create().id());
    }

    @Test
    void create_startsAnonymousAndActive() {
        Session session = create();

        assertFalse(session.authState().isAuthenticated());
        assertNull(session.puppetRef());
        assertEquals(SessionStatus.ACTIVE, session.status());
        assertEquals(NOW, session.connectedAt());
        assertEquals(0, session.syncedGeneration());
    }

    @Test
    void remove_unknownIdIsEmpty() {
        assertTrue(registry.remove(99).isEmpty());
    }

    @Test
    void sessions_orderedById() {
        create();
        create();
        create();

        List<Long> ids = new ArrayList<>();
        registry.sessions().forEach(s -> ids.add(s.id()));

        assertEquals(List.of(1L, 2L, 3L), ids);
    }

    // ==================== Engine-driven updates ====================

    @Test
    void update_recordsLoginPuppetAndCapabilities() {
        Session session = create();

        assertTrue(registry.update(session.id(), "alice", "#12", Map.of(Capabilities.SCREEN_WIDTH, "132")));

        assertEquals("alice", session.authState().accountId().orElseThrow());
        assertEquals("#12", session.puppetRef());
        assertEquals(132, session.capabilities().screenWidth());
        assertTrue(session.capabilities().ansi());
        assertEquals(1, registry.countAuthenticated());
    }

    @Test
    void update_unknownSessionReturnsFalse() {
        assertFalse(registry.update(5, "bob", null, Map.of()));
    }

    @Test
    void snapshot_reflectsUpdates() {
        Session session = create();
        registry.update(session.id(), "alice", "#12", Map.of());

        SessionSnapshot snapshot = session.snapshot();

        assertEquals(session.id(), snapshot.sessionId());
        assertEquals("alice", snapshot.accountId());
        assertEquals("#12", snapshot.puppetRef());
        assertEquals(NOW.toEpochMilli(), snapshot.connectedAtMillis());
    }

    @Test
    void markUnbound_clearsPuppetKeepsAccount() {
        Session session = create();
        registry.update(session.id(), "alice", "#12", Map.of());

        assertTrue(registry.markUnbound(session.id()));

        assertEquals(SessionStatus.UNBOUND, session.status());
        assertNull(session.puppetRef());
        assertTrue(session.authState().isAuthenticated());
    }

    // ==================== Concurrency ====================

    @Test
    void concurrentCreates_yieldDistinctIds() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Map<Long, Session> seen = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Session session = create();
                    assertNull(seen.put(session.id(), session));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(threads * perThread, registry.size());
        assertEquals(threads * perThread, seen.size());
        assertSame(seen.get(1L), registry.get(1L));
    }
}
