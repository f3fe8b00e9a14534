/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.time.Duration;
import java.util.Objects;

/**
 * How sessions relate to accounts and puppets, and how long they may sit idle. The
 * settings are independent.
 *
 * @param maxSessionsPerAccount sessions one account may have open at once, 0 for no limit.
 *        When a login would exceed it, the account's oldest sessions are disconnected.
 * @param autoPuppet on login, bind the puppet the account last used
 * @param autoCreatePuppet whether a dispatcher should create a puppet for an account that has none
 * @param idleTimeout sessions with no input for longer than this are disconnected, zero to never
 */
public record SessionPolicy(int maxSessionsPerAccount, boolean autoPuppet, boolean autoCreatePuppet, Duration idleTimeout) {

    public static final String IDLE_TIMEOUT_REASON = "idle timeout exceeded";

    private static final Duration MIN_IDLE_SWEEP = Duration.ofMillis(100);
    private static final Duration MAX_IDLE_SWEEP = Duration.ofSeconds(30);

    public SessionPolicy {
        if (maxSessionsPerAccount < 0) {
            throw new IllegalArgumentException("maxSessionsPerAccount must not be negative");
        }
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must not be negative");
        }
    }

    public SessionPolicy(int maxSessionsPerAccount, boolean autoPuppet, boolean autoCreatePuppet) {
        this(maxSessionsPerAccount, autoPuppet, autoCreatePuppet, Duration.ZERO);
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(0, true, false);
    }

    public boolean limitsSessions() {
        return maxSessionsPerAccount > 0;
    }

    public boolean limitsIdleTime() {
        return !idleTimeout.isZero();
    }

    /**
     * How often to look for idle sessions: a quarter of the timeout, between 100 ms and 30 s.
     */
    public Duration idleSweepInterval() {
        Duration quarter = idleTimeout.dividedBy(4);
        if (quarter.compareTo(MIN_IDLE_SWEEP) < 0) {
            return MIN_IDLE_SWEEP;
        }
        return quarter.compareTo(MAX_IDLE_SWEEP) > 0 ? MAX_IDLE_SWEEP : quarter;
    }
}
