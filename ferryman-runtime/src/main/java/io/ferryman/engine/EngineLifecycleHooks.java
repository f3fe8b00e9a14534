/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import io.ferryman.protocol.RestartMode;

/**
 * Game hooks around the engine's own start and stop, told whether this is one half of a
 * reload or a cold start or stop.
 */
public interface EngineLifecycleHooks {

    EngineLifecycleHooks NONE = new EngineLifecycleHooks() {
    };

    /**
     * Runs once, before the engine dials the gateway. After a reload the gateway resyncs
     * the surviving sessions as soon as the engine attaches.
     */
    default void engineStarting(RestartMode mode) throws Exception {
    }

    /**
     * Runs during an orderly shutdown, after in-flight commands have drained and before
     * world state is flushed. Throwing makes the shutdown unclean.
     */
    default void engineStopping(RestartMode mode) throws Exception {
    }
}
