/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import io.ferryman.protocol.SessionSnapshot;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The engine's view of one client session. Created when the gateway hands the session
 * over, either as a brand new connection or as a survivor of an engine restart.
 *
 * <p>Changes to the account, puppet or capabilities are pushed to the gateway immediately,
 * so the gateway can hand them to the next engine if this one goes away.</p>
 */
public class EngineSession {

    private final long id;
    private final String protocol;
    private final String remoteAddress;
    private final long connectedAtMillis;
    private final EngineRuntime runtime;
    private final SerialExecutor executor;

    private volatile @Nullable String accountId;
    private volatile @Nullable String puppetRef;
    private volatile Map<String, String> capabilities;
    private volatile @Nullable String failure;
    private volatile long lastInputNanos;

    EngineSession(SessionSnapshot snapshot, EngineRuntime runtime, SerialExecutor executor) {
        this.id = snapshot.sessionId();
        this.protocol = snapshot.protocol();
        this.remoteAddress = snapshot.remoteAddress();
        this.connectedAtMillis = snapshot.connectedAtMillis();
        this.accountId = snapshot.accountId();
        this.puppetRef = snapshot.puppetRef();
        this.capabilities = Map.copyOf(snapshot.capabilities());
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.lastInputNanos = System.nanoTime();
    }

    public long id() {
        return id;
    }

    public String protocol() {
        return protocol;
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    public long connectedAtMillis() {
        return connectedAtMillis;
    }

    @Nullable
    public String accountId() {
        return accountId;
    }

    public boolean isAuthenticated() {
        return accountId != null;
    }

    @Nullable
    public String puppetRef() {
        return puppetRef;
    }

    public Map<String, String> capabilities() {
        return capabilities;
    }

    public SessionPolicy policy() {
        return runtime.policy();
    }

    /**
     * @return why the session could not be resumed, or null if it is healthy
     */
    @Nullable
    public String failure() {
        return failure;
    }

    SerialExecutor executor() {
        return executor;
    }

    /**
     * @return how long the client has sent nothing, as of {@code nowNanos} on the
     *         {@link System#nanoTime()} clock. Counts from adoption for a session that has
     *         not sent input to this engine yet.
     */
    public long idleNanos(long nowNanos) {
        return nowNanos - lastInputNanos;
    }

    void inputReceived(long nowNanos) {
        this.lastInputNanos = nowNanos;
    }

    // ==================== Output ====================

    public void send(byte[] payload) {
        runtime.emitOutbound(id, payload);
    }

    /**
     * Send a line of text in the client's encoding, terminated with CRLF.
     */
    public void sendLine(String text) {
        send((text + "\r\n").getBytes(encoding()));
    }

    public Charset encoding() {
        String name = capabilities.get("encoding");
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name);
        }
        catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    // ==================== Account and puppet ====================

    /**
     * Log the session in to {@code accountId}, applying the session policy.
     */
    public void authenticate(String accountId) {
        runtime.authenticate(this, Objects.requireNonNull(accountId, "accountId"));
    }

    public void logout() {
        this.accountId = null;
        this.puppetRef = null;
        runtime.pushUpdate(this);
    }

    public void bindPuppet(String puppetRef) {
        this.puppetRef = Objects.requireNonNull(puppetRef, "puppetRef");
        runtime.puppetBound(this);
        runtime.pushUpdate(this);
    }

    public void unbindPuppet() {
        this.puppetRef = null;
        runtime.pushUpdate(this);
    }

    public void updateCapabilities(Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(capabilities);
        merged.putAll(updates);
        this.capabilities = Map.copyOf(merged);
        runtime.pushUpdate(this);
    }

    /**
     * Ask the gateway to close this client.
     */
    public void disconnect(String reason) {
        runtime.disconnect(this, reason);
    }

    // ==================== Runtime-driven changes ====================

    void setAccount(@Nullable String accountId) {
        this.accountId = accountId;
    }

    void setPuppet(@Nullable String puppetRef) {
        this.puppetRef = puppetRef;
    }

    void markFailed(String detail) {
        this.failure = detail;
        this.puppetRef = null;
    }

    @Override
    public String toString() {
        return "EngineSession{" +
                "id=" + id +
                ", protocol='" + protocol + '\'' +
                ", accountId=" + accountId +
                ", puppetRef=" + puppetRef +
                (failure != null ? ", failure='" + failure + '\'' : "") +
                '}';
    }
}
