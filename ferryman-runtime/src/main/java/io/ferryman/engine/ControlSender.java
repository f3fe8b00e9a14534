/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import io.ferryman.protocol.ControlMessage;

/**
 * Where the engine runtime writes control messages for the gateway.
 */
@FunctionalInterface
public interface ControlSender {

    void send(ControlMessage message);
}
