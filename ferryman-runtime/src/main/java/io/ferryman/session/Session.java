/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

import java.time.Instant;
import java.util.Objects;

import io.ferryman.protocol.SessionSnapshot;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Per-connection state held by the gateway. A session lives from socket accept to socket
 * close and is never discarded because the engine went away; only its puppet binding may
 * go stale while no engine is attached.
 *
 * <p>Identity, protocol and address are immutable. Authentication, puppet and
 * capabilities are written by the registry on behalf of the engine and may be read from
 * any thread. The pending-input queue, the synced engine generation and the outage flag
 * are guarded by this object's monitor: callers must hold {@code synchronized (session)}.</p>
 */
public class Session {

    private final long id;
    private final String protocol;
    private final String remoteAddress;
    private final Instant connectedAt;
    private final ClientConnection connection;

    private volatile AuthState authState = AuthState.Anonymous.INSTANCE;
    private volatile @Nullable String puppetRef;
    private volatile Capabilities capabilities;
    private volatile SessionStatus status = SessionStatus.ACTIVE;

    // guarded by this
    private final PendingInput pendingInput;
    private long syncedGeneration;
    private boolean outageNoticeSent;

    // only touched from the client's event loop
    private int commandsInWindow;
    private long windowStartNanos;

    Session(long id,
            String protocol,
            String remoteAddress,
            Instant connectedAt,
            Capabilities capabilities,
            ClientConnection connection,
            PendingInput pendingInput) {
        this.id = id;
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.pendingInput = Objects.requireNonNull(pendingInput, "pendingInput");
    }

    // ==================== Accessors ====================

    public long id() {
        return id;
    }

    public String protocol() {
        return protocol;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public ClientConnection connection() {
        return connection;
    }

    public AuthState authState() {
        return authState;
    }

    @Nullable
    public String puppetRef() {
        return puppetRef;
    }

    public Capabilities capabilities() {
        return capabilities;
    }

    public SessionStatus status() {
        return status;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(id,
                protocol,
                remoteAddress,
                connectedAt.toEpochMilli(),
                authState.accountId().orElse(null),
                puppetRef,
                capabilities.asMap());
    }

    // ==================== Registry-driven updates ====================

    void apply(AuthState authState, @Nullable String puppetRef, Capabilities capabilities) {
        this.authState = authState;
        this.puppetRef = puppetRef;
        this.capabilities = capabilities;
        this.status = SessionStatus.ACTIVE;
    }

    void unbind() {
        this.puppetRef = null;
        this.status = SessionStatus.UNBOUND;
    }

    // ==================== Routing state, caller holds the monitor ====================

    public PendingInput pendingInput() {
        return pendingInput;
    }

    /**
     * @return generation of the engine this session was last resynced to, 0 if none
     */
    public long syncedGeneration() {
        return syncedGeneration;
    }

    public void markSynced(long generation) {
        this.syncedGeneration = generation;
        this.outageNoticeSent = false;
    }

    /**
     * Records that the outage notice has been shown.
     *
     * @return true the first time it is called for the current outage
     */
    public boolean claimOutageNotice() {
        if (outageNoticeSent) {
            return false;
        }
        outageNoticeSent = true;
        return true;
    }

    // ==================== Input throttling, event loop only ====================

    /**
     * Counts one command against a one second window.
     *
     * @param nowNanos current {@link System#nanoTime()}
     * @param maxPerSecond allowed commands per window
     * @return true if the command is within the limit
     */
    public boolean tryAcquireCommand(long nowNanos, int maxPerSecond) {
        if (commandsInWindow == 0 || nowNanos - windowStartNanos > 1_000_000_000L) {
            windowStartNanos = nowNanos;
            commandsInWindow = 0;
        }
        commandsInWindow++;
        return commandsInWindow <= maxPerSecond;
    }

    @Override
    public String toString() {
        return "Session{" +
                "id=" + id +
                ", protocol='" + protocol + '\'' +
                ", remoteAddress='" + remoteAddress + '\'' +
                ", authState=" + authState +
                ", puppetRef=" + puppetRef +
                ", status=" + status +
                '}';
    }
}
