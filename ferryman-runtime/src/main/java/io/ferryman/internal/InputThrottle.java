/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.util.Objects;

import io.ferryman.config.ThrottleDefinition;
import io.ferryman.session.Session;

/**
 * Guards the engine against clients that type too fast or paste too much.
 * A limit of zero disables that check.
 */
public class InputThrottle {

    public enum Verdict {
        ACCEPT,
        TOO_FAST,
        TOO_LONG
    }

    private final int maxCommandsPerSecond;
    private final int maxInputLength;

    public InputThrottle(ThrottleDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        this.maxCommandsPerSecond = definition.maxCommandsPerSecond();
        this.maxInputLength = definition.maxInputLength();
    }

    /**
     * Must be called from the session's event loop.
     */
    public Verdict check(Session session, byte[] input, long nowNanos) {
        if (maxInputLength > 0 && input.length > maxInputLength) {
            return Verdict.TOO_LONG;
        }
        if (maxCommandsPerSecond > 0 && !session.tryAcquireCommand(nowNanos, maxCommandsPerSecond)) {
            return Verdict.TOO_FAST;
        }
        return Verdict.ACCEPT;
    }
}
