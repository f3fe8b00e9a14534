/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.util.List;

/**
 * Game logic seen from the engine runtime. Called with one line of client input at a time,
 * never concurrently for the same session.
 */
@FunctionalInterface
public interface CommandDispatcher {

    /**
     * @param session the session the input came from
     * @param input raw client input
     * @return output for the same session, in order; may be empty
     * @throws Exception if the command failed; logged, and the session carries on
     */
    List<byte[]> dispatch(EngineSession session, byte[] input) throws Exception;
}
