/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on an engine process the gateway launched.
 */
public interface SpawnedEngine {

    long pid();

    boolean isAlive();

    /**
     * @return completes with the exit code once the process has terminated
     */
    CompletableFuture<Integer> onExit();

    /**
     * Terminates the process without waiting for it to shut down.
     */
    void destroyForcibly();
}
