/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import io.ferryman.session.OverflowPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Buffering of client input while no engine is attached.
 *
 * @param capacity per-session queue length
 * @param overflowPolicy what happens when the queue is full
 * @param restartingNotice shown once per outage to a client whose input was queued
 * @param unavailableNotice shown when input is refused under {@link OverflowPolicy#REJECT_NEW}
 */
public record InputQueueDefinition(@Nullable Integer capacity,
                                   @Nullable OverflowPolicy overflowPolicy,
                                   @Nullable String restartingNotice,
                                   @Nullable String unavailableNotice) {

    public static final int DEFAULT_CAPACITY = 64;

    public InputQueueDefinition {
        if (capacity == null) {
            capacity = DEFAULT_CAPACITY;
        }
        else if (capacity < 1) {
            throw new ConfigurationException("inputQueue.capacity must be positive, got " + capacity);
        }
        overflowPolicy = overflowPolicy == null ? OverflowPolicy.DROP_OLDEST : overflowPolicy;
        restartingNotice = restartingNotice == null ? "The server is restarting, your input will be processed shortly." : restartingNotice;
        unavailableNotice = unavailableNotice == null ? "The server is temporarily unavailable, please try again in a moment." : unavailableNotice;
    }

    public static InputQueueDefinition defaults() {
        return new InputQueueDefinition(null, null, null, null);
    }
}
