/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

/**
 * Thrown by {@link ControlFrameDecoder} when a frame header announces more bytes than the
 * configured maximum. Netty reports it wrapped in a {@link io.netty.handler.codec.DecoderException}.
 */
public class FrameOversizedException extends RuntimeException {

    private final int maxFrameSizeBytes;
    private final int receivedFrameSizeBytes;

    public FrameOversizedException(int maxFrameSizeBytes, int receivedFrameSizeBytes) {
        super("Frame of " + receivedFrameSizeBytes + " bytes exceeds the maximum of " + maxFrameSizeBytes + " bytes");
        this.maxFrameSizeBytes = maxFrameSizeBytes;
        this.receivedFrameSizeBytes = receivedFrameSizeBytes;
    }

    public int getMaxFrameSizeBytes() {
        return maxFrameSizeBytes;
    }

    public int getReceivedFrameSizeBytes() {
        return receivedFrameSizeBytes;
    }
}
