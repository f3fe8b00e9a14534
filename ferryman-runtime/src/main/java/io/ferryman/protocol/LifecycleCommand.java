/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.util.Locale;

/**
 * Operator commands a launcher may send to the gateway.
 */
public enum LifecycleCommand {
    START((byte) 1),
    STOP((byte) 2),
    RELOAD((byte) 3),
    STATUS((byte) 4);

    private final byte code;

    LifecycleCommand(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public String commandName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param name command name, case insensitive
     * @return the command
     * @throws IllegalArgumentException if the name is not a lifecycle command
     */
    public static LifecycleCommand parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    static LifecycleCommand fromCode(byte code) {
        for (LifecycleCommand command : values()) {
            if (command.code == code) {
                return command;
            }
        }
        throw new IllegalArgumentException("unknown command code " + code);
    }
}
