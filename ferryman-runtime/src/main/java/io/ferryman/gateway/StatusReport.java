/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Answer to the {@code status} lifecycle command, sent to the launcher as JSON.
 *
 * @param engine engine state: ABSENT, STARTING, RUNNING or STOPPING
 * @param sessions open sessions
 * @param authenticatedSessions sessions bound to an account
 * @param enginePid pid of the attached or starting engine, when known
 * @param engineUptimeSeconds seconds since the engine attached, when running
 * @param gatewayUptimeSeconds seconds since the gateway started
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusReport(String engine,
                           int sessions,
                           int authenticatedSessions,
                           @Nullable Long enginePid,
                           @Nullable Long engineUptimeSeconds,
                           long gatewayUptimeSeconds) {
}
