/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

/**
 * What a full pending-input queue does with one more entry.
 */
public enum OverflowPolicy {
    /** Evict the oldest queued input and accept the new one. */
    DROP_OLDEST,
    /** Keep the queue as is and refuse the new input; the client is told. */
    REJECT_NEW
}
