/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;

import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.protocol.Role;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Gateway side of one control connection. The peer identifies itself with {@code Hello};
 * an engine connection then carries session traffic, a launcher connection carries
 * lifecycle commands answered in the order they were sent.
 *
 * <p>A framing error closes this connection only. If the connection belonged to the
 * attached engine, closing it detaches that engine.</p>
 */
public class ControlServerHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlServerHandler.class);

    private final EngineStateMachine stateMachine;
    private final SessionRouter router;
    private final Function<LifecycleCommand, CompletableFuture<CommandResult>> commands;

    private @Nullable Role role;
    private @Nullable EngineLink link;
    private CompletableFuture<?> lastCommand = CompletableFuture.completedFuture(null);

    public ControlServerHandler(EngineStateMachine stateMachine,
                                SessionRouter router,
                                Function<LifecycleCommand, CompletableFuture<CommandResult>> commands) {
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.router = Objects.requireNonNull(router, "router");
        this.commands = Objects.requireNonNull(commands, "commands");
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ControlMessage message)) {
            ctx.fireChannelRead(msg);
            return;
        }
        if (role == null) {
            onFirstMessage(ctx, message);
        }
        else if (role == Role.ENGINE) {
            onEngineMessage(ctx, message);
        }
        else {
            onLauncherMessage(ctx, message);
        }
    }

    private void onFirstMessage(ChannelHandlerContext ctx, ControlMessage message) {
        if (!(message instanceof ControlMessage.Hello hello)) {
            LOGGER.warn("{}: Expected Hello but received {}, closing", ctx.channel().remoteAddress(), message.kind());
            ctx.close();
            return;
        }
        role = hello.role();
        if (hello.role() == Role.LAUNCHER) {
            LOGGER.debug("{}: Launcher connected (pid {})", ctx.channel().remoteAddress(), hello.pid());
            return;
        }
        link = stateMachine.attachEngine(ctx.channel(), hello.pid());
        if (link == null) {
            ctx.writeAndFlush(new ControlMessage.Result(CommandResult.rejected(EngineStateMachine.ALREADY_ATTACHED)))
                    .addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void onEngineMessage(ChannelHandlerContext ctx, ControlMessage message) {
        EngineLink current = link;
        if (current == null) {
            return;
        }
        if (message instanceof ControlMessage.Data data) {
            router.routeOutbound(data.sessionId(), data.payload());
        }
        else if (message instanceof ControlMessage.Stopping stopping) {
            stateMachine.engineStopping(current, stopping.clean());
        }
        else if (message instanceof ControlMessage.Disconnect disconnect) {
            router.disconnectClient(disconnect.sessionId(), disconnect.reason());
        }
        else if (message instanceof ControlMessage.SessionUpdate update) {
            router.sessionUpdated(update);
        }
        else if (message instanceof ControlMessage.ResyncFailed failed) {
            router.resyncFailed(failed.sessionId(), failed.detail());
        }
        else if (message instanceof ControlMessage.Announce announce) {
            router.announce(announce.message());
        }
        else {
            LOGGER.warn("{}: Ignoring unexpected {} from engine", ctx.channel().remoteAddress(), message.kind());
        }
    }

    private void onLauncherMessage(ChannelHandlerContext ctx, ControlMessage message) {
        if (!(message instanceof ControlMessage.Command command)) {
            LOGGER.warn("{}: Ignoring unexpected {} from launcher", ctx.channel().remoteAddress(), message.kind());
            return;
        }
        LOGGER.info("Lifecycle command {} from {}", command.command().commandName(), ctx.channel().remoteAddress());
        lastCommand = lastCommand
                .handle((ignored, error) -> null)
                .thenCompose(ignored -> commands.apply(command.command()))
                .whenComplete((result, error) -> {
                    CommandResult reply = error == null ? result : CommandResult.error(String.valueOf(unwrap(error).getMessage()));
                    if (ctx.channel().isActive()) {
                        ctx.writeAndFlush(new ControlMessage.Result(reply));
                    }
                });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        EngineLink current = link;
        if (current != null) {
            stateMachine.engineDisconnected(current);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            LOGGER.warn("{}: Closing control connection after framing error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        }
        else {
            LOGGER.warn("{}: Closing control connection after error: {}", ctx.channel().remoteAddress(), cause.getMessage());
        }
        LOGGER.debug("{}: Control connection error detail", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
