/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Engine side of the control channel.
 *
 * <p>An engine connects with {@link io.ferryman.engine.EngineClient}, receives the gateway's
 * sessions through {@link io.ferryman.engine.EngineRuntime} and hands input to a
 * {@link io.ferryman.engine.CommandDispatcher}. Game logic lives behind that interface and
 * {@link io.ferryman.engine.WorldPersistence}; nothing in this package knows about it.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.ferryman.engine;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
