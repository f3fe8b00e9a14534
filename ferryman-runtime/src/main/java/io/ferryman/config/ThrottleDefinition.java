/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Per-session input limits applied before anything is routed to the engine.
 *
 * @param maxCommandsPerSecond commands accepted per session per second, 0 to disable
 * @param maxInputLength longest accepted input in bytes, 0 to disable
 * @param commandRateNotice shown when input is discarded for exceeding the rate
 * @param inputLengthNotice shown when input is discarded for its length
 */
public record ThrottleDefinition(@Nullable Integer maxCommandsPerSecond,
                                 @Nullable Integer maxInputLength,
                                 @Nullable String commandRateNotice,
                                 @Nullable String inputLengthNotice) {

    public static final int DEFAULT_MAX_COMMANDS_PER_SECOND = 80;
    public static final int DEFAULT_MAX_INPUT_LENGTH = 6000;

    public ThrottleDefinition {
        maxCommandsPerSecond = nonNegative(maxCommandsPerSecond, DEFAULT_MAX_COMMANDS_PER_SECOND, "maxCommandsPerSecond");
        maxInputLength = nonNegative(maxInputLength, DEFAULT_MAX_INPUT_LENGTH, "maxInputLength");
        commandRateNotice = commandRateNotice == null ? "You entered commands too fast. Wait a moment and try again." : commandRateNotice;
        inputLengthNotice = inputLengthNotice == null ? "Your input was too long and has been discarded." : inputLengthNotice;
    }

    public static ThrottleDefinition defaults() {
        return new ThrottleDefinition(null, null, null, null);
    }

    public static ThrottleDefinition disabled() {
        return new ThrottleDefinition(0, 0, null, null);
    }

    private static int nonNegative(@Nullable Integer value, int fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            throw new ConfigurationException("throttle." + field + " must not be negative, got " + value);
        }
        return value;
    }
}
