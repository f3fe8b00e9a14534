/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The one-byte discriminator that follows the length prefix of every control frame.
 */
public enum MessageKind {
    HELLO((byte) 1),
    COMMAND((byte) 2),
    RESULT((byte) 3),
    RESYNC_SESSION((byte) 4),
    DATA((byte) 5),
    STOPPING((byte) 6),
    SHUTDOWN((byte) 7),
    SESSION_OPENED((byte) 8),
    DISCONNECT((byte) 9),
    SESSION_UPDATE((byte) 10),
    RESYNC_FAILED((byte) 11),
    ANNOUNCE((byte) 12);

    private static final MessageKind[] BY_CODE = new MessageKind[16];

    static {
        for (MessageKind kind : values()) {
            BY_CODE[kind.code] = kind;
        }
    }

    private final byte code;

    MessageKind(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    /**
     * @param code wire code
     * @return the kind, or null if the code is not assigned
     */
    @Nullable
    static MessageKind fromCode(byte code) {
        return code > 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }
}
