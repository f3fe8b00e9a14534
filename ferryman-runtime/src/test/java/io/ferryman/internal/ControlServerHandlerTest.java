/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.netty.channel.Channel;
import io.netty.channel.embedded.EmbeddedChannel;

import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.protocol.Role;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ControlServerHandlerTest {

    @Mock
    private EngineStateMachine stateMachine;

    @Mock
    private SessionRouter router;

    private final List<LifecycleCommand> received = new ArrayList<>();
    private final List<CompletableFuture<CommandResult>> answers = new ArrayList<>();

    private EmbeddedChannel channel() {
        return new EmbeddedChannel(new ControlServerHandler(stateMachine, router, command -> {
            received.add(command);
            CompletableFuture<CommandResult> answer = new CompletableFuture<>();
            answers.add(answer);
            return answer;
        }));
    }

    private EngineLink attachAs(EmbeddedChannel channel, long pid) {
        EngineLink link = new EngineLink(1, pid, channel, Instant.now());
        when(stateMachine.attachEngine(any(Channel.class), eq(pid))).thenReturn(link);
        channel.writeInbound(new ControlMessage.Hello(Role.ENGINE, pid));
        return link;
    }

    // ==================== Handshake ====================

    @Test
    void firstMessageMustBeHello() {
        EmbeddedChannel channel = channel();

        channel.writeInbound(new ControlMessage.Command(LifecycleCommand.STATUS));

        assertFalse(channel.isActive());
        assertTrue(received.isEmpty());
        verifyNoInteractions(stateMachine);
    }

    @Test
    void engineRefused_getsRejectionAndIsClosed() {
        EmbeddedChannel channel = channel();
        when(stateMachine.attachEngine(any(Channel.class), eq(9L))).thenReturn(null);

        channel.writeInbound(new ControlMessage.Hello(Role.ENGINE, 9));

        assertEquals(new ControlMessage.Result(CommandResult.rejected(EngineStateMachine.ALREADY_ATTACHED)), channel.readOutbound());
        assertFalse(channel.isActive());
    }

    // ==================== Engine connection ====================

    @Test
    void engineMessages_reachRouterAndStateMachine() {
        EmbeddedChannel channel = channel();
        EngineLink link = attachAs(channel, 7);
        ControlMessage.SessionUpdate update = new ControlMessage.SessionUpdate(3, "alice", "#1", Map.of());

        channel.writeInbound(ControlMessage.Data.text(3, "hi"));
        channel.writeInbound(update);
        channel.writeInbound(new ControlMessage.ResyncFailed(4, "gone"));
        channel.writeInbound(new ControlMessage.Announce("Server restarting"));
        channel.writeInbound(new ControlMessage.Disconnect(5, "quit"));
        channel.writeInbound(new ControlMessage.Stopping(true));

        verify(router).routeOutbound(eq(3L), aryEq("hi".getBytes(StandardCharsets.UTF_8)));
        verify(router).sessionUpdated(update);
        verify(router).resyncFailed(4, "gone");
        verify(router).announce("Server restarting");
        verify(router).disconnectClient(5, "quit");
        verify(stateMachine).engineStopping(link, true);
    }

    @Test
    void engineConnectionClosed_detachesEngine() {
        EmbeddedChannel channel = channel();
        EngineLink link = attachAs(channel, 7);

        channel.close();

        verify(stateMachine).engineDisconnected(link);
    }

    // ==================== Launcher connection ====================

    @Test
    void launcherCommands_answeredInOrder() {
        EmbeddedChannel channel = channel();
        channel.writeInbound(new ControlMessage.Hello(Role.LAUNCHER, 1));

        channel.writeInbound(new ControlMessage.Command(LifecycleCommand.RELOAD));
        channel.writeInbound(new ControlMessage.Command(LifecycleCommand.STATUS));

        assertEquals(List.of(LifecycleCommand.RELOAD), received);
        answers.get(0).complete(CommandResult.ok("engine reloaded (pid 8)"));
        assertEquals(List.of(LifecycleCommand.RELOAD, LifecycleCommand.STATUS), received);
        answers.get(1).complete(CommandResult.ok("{}"));

        assertEquals(new ControlMessage.Result(CommandResult.ok("engine reloaded (pid 8)")), channel.readOutbound());
        assertEquals(new ControlMessage.Result(CommandResult.ok("{}")), channel.readOutbound());
        assertNull(channel.readOutbound());
        verifyNoInteractions(stateMachine);
    }

    @Test
    void failedCommand_answeredWithError() {
        EmbeddedChannel channel = channel();
        channel.writeInbound(new ControlMessage.Hello(Role.LAUNCHER, 1));

        channel.writeInbound(new ControlMessage.Command(LifecycleCommand.START));
        answers.get(0).completeExceptionally(new IllegalStateException("gateway not started"));

        assertEquals(new ControlMessage.Result(CommandResult.error("gateway not started")), channel.readOutbound());
    }
}
