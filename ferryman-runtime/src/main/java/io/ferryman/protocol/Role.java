/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

/**
 * Who is on the other end of a control connection, as announced in {@link ControlMessage.Hello}.
 */
public enum Role {
    ENGINE((byte) 1),
    LAUNCHER((byte) 2);

    private final byte code;

    Role(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    static Role fromCode(byte code) {
        for (Role role : values()) {
            if (role.code == code) {
                return role;
            }
        }
        throw new IllegalArgumentException("unknown role code " + code);
    }
}
