/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import java.nio.charset.StandardCharsets;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LineBasedFrameDecoder;

import io.ferryman.session.Capabilities;

/**
 * Line-oriented text. Each line, without its terminator, is one unit of input; output is
 * written to the socket unchanged.
 */
public class TelnetProtocol implements WireProtocol {

    public static final String NAME = "telnet";

    /** Longer lines are discarded by the decoder and reported through the pipeline. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Capabilities defaultCapabilities() {
        return Capabilities.of(StandardCharsets.UTF_8, true, Capabilities.DEFAULT_SCREEN_WIDTH);
    }

    @Override
    public void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast("lineDecoder", new LineBasedFrameDecoder(MAX_LINE_LENGTH, true, false));
    }
}
