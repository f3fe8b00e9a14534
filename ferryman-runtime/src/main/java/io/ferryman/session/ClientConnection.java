/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.session;

/**
 * The gateway side of a client socket, as seen by the session registry and the router.
 * Implementations must be safe to call from any thread.
 */
public interface ClientConnection {

    /**
     * Queue bytes for the client. Never blocks.
     *
     * @param payload encoded output
     */
    void deliver(byte[] payload);

    /**
     * Show a gateway-originated text to the client, encoded the way the client's protocol
     * and capabilities require.
     *
     * @param text notice text, without line terminator
     */
    void sendNotice(String text);

    /**
     * Close the client socket after flushing pending output.
     *
     * @param reason logged, and shown to the client if the protocol allows
     */
    void close(String reason);

    boolean isOpen();
}
