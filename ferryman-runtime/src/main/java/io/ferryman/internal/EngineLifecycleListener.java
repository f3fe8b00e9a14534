/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.ferryman.internal;

/**
 * Told about engine attach and detach after {@link EngineStateMachine} has committed the transition.
 */
public interface EngineLifecycleListener {

    void engineAttached(EngineLink link);

    /**
     * @param clean true if the engine announced a clean shutdown before going away
     */
    void engineDetached(EngineLink link, boolean clean);
}
