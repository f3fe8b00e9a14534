/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.util.Objects;

/**
 * The answer to a {@link LifecycleCommand}.
 *
 * @param status outcome
 * @param detail human readable detail; for {@code status} a JSON document
 */
public record CommandResult(ResultStatus status, String detail) {

    public CommandResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(detail, "detail");
    }

    public static CommandResult ok(String detail) {
        return new CommandResult(ResultStatus.OK, detail);
    }

    public static CommandResult rejected(String detail) {
        return new CommandResult(ResultStatus.REJECTED, detail);
    }

    public static CommandResult error(String detail) {
        return new CommandResult(ResultStatus.ERROR, detail);
    }

    public boolean isOk() {
        return status == ResultStatus.OK;
    }
}
