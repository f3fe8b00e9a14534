/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

/**
 * Installs the control-channel codec on a pipeline. Every process that speaks the control
 * protocol, gateway, engine or launcher, builds its pipeline through here.
 */
public final class ControlChannels {

    public static final String DECODER = "controlDecoder";
    public static final String ENCODER = "controlEncoder";

    private static final ControlFrameEncoder ENCODER_INSTANCE = new ControlFrameEncoder();

    private ControlChannels() {
    }

    /**
     * @param pipeline the pipeline to configure
     * @param maxFrameSizeBytes largest accepted inbound frame
     * @param logFrames whether to log every decoded message at INFO
     */
    public static void configure(ChannelPipeline pipeline, int maxFrameSizeBytes, boolean logFrames) {
        pipeline.addLast(DECODER, new ControlFrameDecoder(maxFrameSizeBytes));
        pipeline.addLast(ENCODER, ENCODER_INSTANCE);
        if (logFrames) {
            pipeline.addLast("frameLogger", new LoggingHandler("io.ferryman.protocol.ControlFrameLogger", LogLevel.INFO));
        }
    }
}
