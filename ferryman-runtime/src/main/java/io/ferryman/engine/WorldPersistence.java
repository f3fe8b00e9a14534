/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.io.IOException;

/**
 * Persists world state. Flushed once during an orderly engine shutdown, after in-flight
 * commands have drained.
 */
@FunctionalInterface
public interface WorldPersistence {

    WorldPersistence NONE = () -> {
    };

    void flush() throws IOException;
}
