/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The gateway's table of open sessions.
 *
 * <p>Every mutation (create, engine-driven update, unbind, remove) is serialised by a single
 * writer lock. Lookups used on the routing path read the backing concurrent map without
 * locking, and {@link #sessions()} returns a copy, so iteration never observes a
 * half-applied change.</p>
 *
 * <p>Session ids are assigned from an ever increasing counter starting at 1 and are never
 * reused within the lifetime of the gateway.</p>
 */
public class SessionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<Long, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final ReentrantLock writeLock = new ReentrantLock();
    private final int pendingInputCapacity;
    private final OverflowPolicy overflowPolicy;
    private final Clock clock;

    public SessionRegistry(int pendingInputCapacity, OverflowPolicy overflowPolicy) {
        this(pendingInputCapacity, overflowPolicy, Clock.systemUTC());
    }

    public SessionRegistry(int pendingInputCapacity, OverflowPolicy overflowPolicy, Clock clock) {
        if (pendingInputCapacity < 1) {
            throw new IllegalArgumentException("pendingInputCapacity must be positive");
        }
        this.pendingInputCapacity = pendingInputCapacity;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a newly accepted client connection.
     *
     * @param protocol wire protocol name
     * @param remoteAddress client address
     * @param capabilities the protocol's initial capabilities
     * @param connection the client socket
     * @return the new session
     */
    public Session create(String protocol, String remoteAddress, Capabilities capabilities, ClientConnection connection) {
        writeLock.lock();
        try {
            long id = nextId.getAndIncrement();
            Session session = new Session(id,
                    protocol,
                    remoteAddress,
                    clock.instant(),
                    capabilities,
                    connection,
                    new PendingInput(pendingInputCapacity, overflowPolicy));
            sessions.put(id, session);
            LOGGER.debug("{}: Session created for {} client {}", id, protocol, remoteAddress);
            return session;
        }
        finally {
            writeLock.unlock();
        }
    }

    public Optional<Session> find(long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Nullable
    public Session get(long sessionId) {
        return sessions.get(sessionId);
    }

    /**
     * Applies an engine-driven change.
     *
     * @param sessionId session to update
     * @param accountId authenticated account, null for anonymous
     * @param puppetRef bound puppet, null for unbound
     * @param capabilityUpdates capabilities to merge
     * @return false if the session no longer exists
     */
    public boolean update(long sessionId,
                          @Nullable String accountId,
                          @Nullable String puppetRef,
                          Map<String, String> capabilityUpdates) {
        writeLock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            session.apply(AuthState.of(accountId), puppetRef, session.capabilities().merge(capabilityUpdates));
            LOGGER.debug("{}: Session updated, account={}, puppet={}", sessionId, accountId, puppetRef);
            return true;
        }
        finally {
            writeLock.unlock();
        }
    }

    /**
     * Clears the puppet binding of a session the engine could not resume.
     *
     * @return false if the session no longer exists
     */
    public boolean markUnbound(long sessionId) {
        writeLock.lock();
        try {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return false;
            }
            session.unbind();
            return true;
        }
        finally {
            writeLock.unlock();
        }
    }

    public Optional<Session> remove(long sessionId) {
        writeLock.lock();
        try {
            Session removed = sessions.remove(sessionId);
            if (removed != null) {
                LOGGER.debug("{}: Session removed", sessionId);
            }
            return Optional.ofNullable(removed);
        }
        finally {
            writeLock.unlock();
        }
    }

    /**
     * @return a copy of the open sessions, ordered by id
     */
    public List<Session> sessions() {
        List<Session> copy = new ArrayList<>(sessions.values());
        copy.sort(Comparator.comparingLong(Session::id));
        return copy;
    }

    public int size() {
        return sessions.size();
    }

    public int countAuthenticated() {
        int count = 0;
        for (Session session : sessions.values()) {
            if (session.authState().isAuthenticated()) {
                count++;
            }
        }
        return count;
    }
}
