/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.ferryman.protocol.SessionSnapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineSessionTableTest {

    private final ExecutorService workers = Executors.newSingleThreadExecutor();
    private final EngineRuntime runtime = new EngineRuntime((session, input) -> List.of(),
            WorldPersistence.NONE,
            SessionListener.NONE,
            SessionPolicy.defaults(),
            workers,
            Duration.ofSeconds(1));
    private final EngineSessionTable table = new EngineSessionTable();

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    private EngineSessionTable.Attach attach(long id, long connectedAt, String account) {
        SessionSnapshot snapshot = new SessionSnapshot(id, "telnet", "10.0.0.1:5000", connectedAt, account, null, Map.of());
        return table.attach(snapshot, s -> new EngineSession(s, runtime, new SerialExecutor(workers)));
    }

    @Test
    void attach_isIdempotent() {
        EngineSessionTable.Attach first = attach(1, 100, null);
        EngineSessionTable.Attach second = attach(1, 100, "alice");

        assertTrue(first.created());
        assertFalse(second.created());
        assertSame(first.session(), second.session());
        assertNull(second.session().accountId());
        assertEquals(1, table.size());
    }

    @Test
    void forAccount_oldestFirst() {
        attach(3, 300, "alice");
        attach(1, 500, "alice");
        attach(2, 200, "bob");
        attach(4, 100, "alice");

        List<Long> ids = table.forAccount("alice").stream().map(EngineSession::id).toList();

        assertEquals(List.of(4L, 3L, 1L), ids);
    }

    @Test
    void sessions_orderedById() {
        attach(3, 1, null);
        attach(1, 2, null);
        attach(2, 3, null);

        assertEquals(List.of(1L, 2L, 3L), table.sessions().stream().map(EngineSession::id).toList());
    }

    @Test
    void remove_forgetsSession() {
        attach(1, 1, null);

        assertEquals(1, table.remove(1).id());
        assertNull(table.get(1));
        assertNull(table.remove(1));
    }
}
