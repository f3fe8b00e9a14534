/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.gateway;

import java.io.IOException;

import io.ferryman.protocol.RestartMode;

/**
 * Launches engine processes. Spawning never waits for the engine to become usable: the
 * engine reports itself by dialling the gateway's control address.
 */
@FunctionalInterface
public interface EngineSpawner {

    /**
     * @param mode {@code RELOAD} when the engine replaces one that stopped for a reload
     * @return handle on the launched process
     * @throws IOException if the process could not be launched
     */
    SpawnedEngine spawn(RestartMode mode) throws IOException;
}
