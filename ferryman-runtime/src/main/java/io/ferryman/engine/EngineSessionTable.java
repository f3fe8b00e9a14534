/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import io.ferryman.protocol.SessionSnapshot;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sessions known to this engine, keyed by the gateway's session id.
 */
public class EngineSessionTable {

    /**
     * @param session the session for the id
     * @param created false if the session was already known and left untouched
     */
    public record Attach(EngineSession session, boolean created) {
    }

    private final Map<Long, EngineSession> sessions = new ConcurrentHashMap<>();

    /**
     * Registers the session described by {@code snapshot} unless it is already known.
     * Attaching the same session twice changes nothing.
     */
    public Attach attach(SessionSnapshot snapshot, Function<SessionSnapshot, EngineSession> factory) {
        Objects.requireNonNull(snapshot, "snapshot");
        boolean[] created = { false };
        EngineSession session = sessions.computeIfAbsent(snapshot.sessionId(), id -> {
            created[0] = true;
            return factory.apply(snapshot);
        });
        return new Attach(session, created[0]);
    }

    @Nullable
    public EngineSession get(long sessionId) {
        return sessions.get(sessionId);
    }

    @Nullable
    public EngineSession remove(long sessionId) {
        return sessions.remove(sessionId);
    }

    /**
     * @return sessions logged in to {@code accountId}, oldest first
     */
    public List<EngineSession> forAccount(String accountId) {
        List<EngineSession> matches = new ArrayList<>();
        for (EngineSession session : sessions.values()) {
            if (accountId.equals(session.accountId())) {
                matches.add(session);
            }
        }
        matches.sort(Comparator.comparingLong(EngineSession::connectedAtMillis).thenComparingLong(EngineSession::id));
        return matches;
    }

    /**
     * @return every session, ordered by id
     */
    public List<EngineSession> sessions() {
        List<EngineSession> copy = new ArrayList<>(sessions.values());
        copy.sort(Comparator.comparingLong(EngineSession::id));
        return copy;
    }

    public int size() {
        return sessions.size();
    }
}
