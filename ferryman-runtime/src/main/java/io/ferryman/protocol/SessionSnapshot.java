/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Wire view of a gateway session, sent to an engine when the session opens or when the
 * engine is resynchronised after attaching.
 *
 * @param sessionId stable session id
 * @param protocol name of the wire protocol the client connected with
 * @param remoteAddress client address, for display and logging
 * @param connectedAtMillis epoch millis of the socket accept
 * @param accountId authenticated account, or null while anonymous
 * @param puppetRef bound puppet, or null while unbound
 * @param capabilities negotiated capabilities
 */
public record SessionSnapshot(long sessionId,
                              String protocol,
                              String remoteAddress,
                              long connectedAtMillis,
                              @Nullable String accountId,
                              @Nullable String puppetRef,
                              Map<String, String> capabilities) {

    public SessionSnapshot {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        capabilities = Map.copyOf(capabilities);
    }

    public boolean isAuthenticated() {
        return accountId != null;
    }
}
