/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Bounds on output buffered for a single client.
 *
 * @param writeBufferHighWaterMark bytes pending before a client counts as slow
 * @param writeBufferLowWaterMark bytes pending at which a slow client recovers
 * @param slowClientPolicy treatment of output for a slow client
 */
public record OutboundDefinition(@Nullable Integer writeBufferHighWaterMark,
                                 @Nullable Integer writeBufferLowWaterMark,
                                 @Nullable SlowClientPolicy slowClientPolicy) {

    public static final int DEFAULT_HIGH_WATER_MARK = 256 * 1024;
    public static final int DEFAULT_LOW_WATER_MARK = 64 * 1024;

    public OutboundDefinition {
        writeBufferHighWaterMark = writeBufferHighWaterMark == null ? DEFAULT_HIGH_WATER_MARK : writeBufferHighWaterMark;
        writeBufferLowWaterMark = writeBufferLowWaterMark == null ? Math.min(DEFAULT_LOW_WATER_MARK, writeBufferHighWaterMark) : writeBufferLowWaterMark;
        if (writeBufferLowWaterMark < 0 || writeBufferLowWaterMark > writeBufferHighWaterMark) {
            throw new ConfigurationException("outbound.writeBufferLowWaterMark must be between 0 and writeBufferHighWaterMark");
        }
        slowClientPolicy = slowClientPolicy == null ? SlowClientPolicy.DISCONNECT : slowClientPolicy;
    }

    public static OutboundDefinition defaults() {
        return new OutboundDefinition(null, null, null);
    }
}
