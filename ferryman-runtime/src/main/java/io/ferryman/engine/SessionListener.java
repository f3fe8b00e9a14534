/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

/**
 * Hooks run on a session's own executor, ahead of any input for that session.
 */
public interface SessionListener {

    SessionListener NONE = new SessionListener() {
    };

    /**
     * A client connected while this engine was running.
     */
    default void sessionOpened(EngineSession session) throws Exception {
    }

    /**
     * A session that existed before this engine started was handed over by the gateway.
     * Account and puppet are already set; login must not be repeated. Throwing marks the
     * session as failed and the gateway is told it could not be resumed.
     */
    default void sessionResumed(EngineSession session) throws Exception {
    }

    default void sessionClosed(EngineSession session, String reason) {
    }
}
