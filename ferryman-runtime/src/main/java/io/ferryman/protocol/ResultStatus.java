/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

/**
 * Outcome of a lifecycle command.
 */
public enum ResultStatus {
    /** The command completed. */
    OK((byte) 0),
    /** The command was not applicable in the current state; nothing changed. */
    REJECTED((byte) 1),
    /** The command was attempted and failed, or timed out. */
    ERROR((byte) 2);

    private final byte code;

    ResultStatus(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    static ResultStatus fromCode(byte code) {
        for (ResultStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown result status " + code);
    }
}
