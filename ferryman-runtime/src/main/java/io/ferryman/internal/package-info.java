/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Netty handlers and state machines behind {@link io.ferryman.gateway.Gateway}.
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link io.ferryman.internal.EngineState}</dt>
 *   <dd>Sealed hierarchy for the engine slot (Absent, Starting, Running, Stopping)</dd>
 *
 *   <dt>{@link io.ferryman.internal.EngineStateMachine}</dt>
 *   <dd>Drives the slot from lifecycle commands, engine connections, process exits and timeouts</dd>
 *
 *   <dt>{@link io.ferryman.internal.SessionRouter}</dt>
 *   <dd>Routes session traffic, queues input while no engine is attached and resyncs sessions to a new engine</dd>
 *
 *   <dt>{@link io.ferryman.internal.ClientFrontendHandler}</dt>
 *   <dd>Per-client handler; one session per client socket</dd>
 *
 *   <dt>{@link io.ferryman.internal.ControlServerHandler}</dt>
 *   <dd>Per control connection; speaks to either an engine or a launcher</dd>
 * </dl>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.ferryman.internal;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
