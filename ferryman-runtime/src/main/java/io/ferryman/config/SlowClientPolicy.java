/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

/**
 * What the gateway does with output for a client whose socket is not keeping up.
 */
public enum SlowClientPolicy {
    /** Discard the output; the client stays connected. */
    DROP,
    /** Close the client connection. */
    DISCONNECT
}
