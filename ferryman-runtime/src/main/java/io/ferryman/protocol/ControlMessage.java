/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sealed hierarchy of the messages exchanged over a control channel.
 * Lifecycle messages and session-tagged data share one connection; every
 * session-scoped message carries its session id so the receiver can demultiplex it.
 *
 * <pre>
 *   launcher ──Hello(LAUNCHER)──► gateway
 *   launcher ──Command─────────► gateway ──Result──► launcher
 *
 *   engine ──Hello(ENGINE)─────► gateway
 *   engine ◄──ResyncSession*──── gateway        (one per open session)
 *   engine ◄──SessionOpened───── gateway        (client connected while attached)
 *   engine ◄──Data────────────►  gateway        (session I/O multiplex)
 *   engine ◄──Disconnect──────►  gateway
 *   engine ──SessionUpdate─────► gateway        (login, puppet, capabilities)
 *   engine ──ResyncFailed──────► gateway
 *   engine ──Announce──────────► gateway
 *   engine ◄──Shutdown────────── gateway        ("please stop")
 *   engine ──Stopping──────────► gateway
 * </pre>
 */
public sealed interface ControlMessage permits
        ControlMessage.Hello,
        ControlMessage.Command,
        ControlMessage.Result,
        ControlMessage.ResyncSession,
        ControlMessage.Data,
        ControlMessage.Stopping,
        ControlMessage.Shutdown,
        ControlMessage.SessionOpened,
        ControlMessage.Disconnect,
        ControlMessage.SessionUpdate,
        ControlMessage.ResyncFailed,
        ControlMessage.Announce {

    MessageKind kind();

    /**
     * First message on every control connection.
     */
    record Hello(Role role, long pid) implements ControlMessage {
        public Hello {
            Objects.requireNonNull(role, "role");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.HELLO;
        }
    }

    record Command(LifecycleCommand command) implements ControlMessage {
        public Command {
            Objects.requireNonNull(command, "command");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.COMMAND;
        }
    }

    record Result(CommandResult result) implements ControlMessage {
        public Result {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.RESULT;
        }
    }

    record ResyncSession(SessionSnapshot session) implements ControlMessage {
        public ResyncSession {
            Objects.requireNonNull(session, "session");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.RESYNC_SESSION;
        }
    }

    /**
     * Session input (gateway to engine) or output (engine to gateway).
     */
    record Data(long sessionId, byte[] payload) implements ControlMessage {
        public Data {
            Objects.requireNonNull(payload, "payload");
        }

        public static Data text(long sessionId, String text) {
            return new Data(sessionId, text.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public MessageKind kind() {
            return MessageKind.DATA;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Data other
                    && sessionId == other.sessionId
                    && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(sessionId) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return "Data[sessionId=" + sessionId + ", payload=" + payload.length + " bytes]";
        }
    }

    /**
     * Sent by an engine that is about to go away. {@code clean} distinguishes an orderly
     * shutdown from an engine that knows it is about to crash or be killed.
     */
    record Stopping(boolean clean) implements ControlMessage {
        @Override
        public MessageKind kind() {
            return MessageKind.STOPPING;
        }
    }

    record Shutdown(String reason) implements ControlMessage {
        public Shutdown {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.SHUTDOWN;
        }
    }

    record SessionOpened(SessionSnapshot session) implements ControlMessage {
        public SessionOpened {
            Objects.requireNonNull(session, "session");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.SESSION_OPENED;
        }
    }

    /**
     * From the gateway: the client went away. From the engine: close this client.
     */
    record Disconnect(long sessionId, String reason) implements ControlMessage {
        public Disconnect {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.DISCONNECT;
        }
    }

    /**
     * Engine-driven change to a session. A null {@code accountId} means anonymous and a
     * null {@code puppetRef} means unbound; {@code capabilities} are merged into the
     * existing set.
     */
    record SessionUpdate(long sessionId,
                         @Nullable String accountId,
                         @Nullable String puppetRef,
                         Map<String, String> capabilities)
            implements ControlMessage {
        public SessionUpdate {
            capabilities = Map.copyOf(capabilities);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.SESSION_UPDATE;
        }
    }

    record ResyncFailed(long sessionId, String detail) implements ControlMessage {
        public ResyncFailed {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.RESYNC_FAILED;
        }
    }

    record Announce(String message) implements ControlMessage {
        public Announce {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.ANNOUNCE;
        }
    }
}
