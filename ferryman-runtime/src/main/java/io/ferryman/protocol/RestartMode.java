/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.util.Locale;

/**
 * Whether an engine stop or start is one half of a reload, with sessions carried across,
 * or a cold stop or start.
 */
public enum RestartMode {
    RELOAD,
    COLD;

    /**
     * @param reason the reason carried by a {@code Shutdown} message, which is the name of
     *        the lifecycle command that caused it
     */
    public static RestartMode fromShutdownReason(String reason) {
        return LifecycleCommand.RELOAD.commandName().equals(reason) ? RELOAD : COLD;
    }

    /**
     * Parses the value the gateway hands a spawned engine, case-insensitively.
     *
     * @throws IllegalArgumentException for anything but {@code reload} or {@code cold}
     */
    public static RestartMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
