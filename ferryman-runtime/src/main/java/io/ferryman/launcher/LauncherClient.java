/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.launcher;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlChannels;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.LifecycleCommand;
import io.ferryman.protocol.Role;
import io.ferryman.service.HostPort;

/**
 * Sends one lifecycle command to a running gateway and waits for its answer.
 *
 * <p>Failures never surface as exceptions: an unreachable gateway, a dropped connection or
 * a timeout all complete the future with an {@code ERROR} result. A timeout does not undo
 * the command; the gateway may still finish the transition.</p>
 */
public class LauncherClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LauncherClient.class);

    public static final String NOT_REACHABLE = "gateway not reachable";

    private final HostPort gateway;
    private final int maxFrameSizeBytes;
    private final EventLoopGroup group = new NioEventLoopGroup(1);

    public LauncherClient(HostPort gateway, int maxFrameSizeBytes) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.maxFrameSizeBytes = maxFrameSizeBytes;
    }

    /**
     * @param command the lifecycle command
     * @param timeout how long to wait for the answer, including connecting
     * @return the gateway's answer
     */
    public CompletableFuture<CommandResult> execute(LifecycleCommand command, Duration timeout) {
        CompletableFuture<CommandResult> result = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(1, Math.min(timeout.toMillis(), 10_000)))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ControlChannels.configure(ch.pipeline(), maxFrameSizeBytes, false);
                        ch.pipeline().addLast("launcherHandler", new ResultHandler(result));
                    }
                });

        LOGGER.debug("Sending {} to gateway at {}", command.commandName(), gateway);
        bootstrap.connect(gateway.toSocketAddress()).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                String reason = future.cause() != null ? future.cause().getMessage() : "connect failed";
                result.complete(CommandResult.error(NOT_REACHABLE + " at " + gateway + ": " + reason));
                return;
            }
            Channel channel = future.channel();
            channel.write(new ControlMessage.Hello(Role.LAUNCHER, ProcessHandle.current().pid()));
            channel.writeAndFlush(new ControlMessage.Command(command));
            result.whenComplete((r, e) -> channel.close());
        });

        group.schedule(() -> result.complete(CommandResult.error("timed out after " + timeout + " waiting for " + command.commandName()
                + "; the gateway may still complete it")),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        return result;
    }

    /**
     * @return process exit status for {@code result}: 0 for OK, 2 for REJECTED, 1 for ERROR
     */
    public static int exitCode(CommandResult result) {
        switch (result.status()) {
            case OK:
                return 0;
            case REJECTED:
                return 2;
            default:
                return 1;
        }
    }

    @Override
    public void close() {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private static final class ResultHandler extends ChannelInboundHandlerAdapter {
        private final CompletableFuture<CommandResult> result;

        private ResultHandler(CompletableFuture<CommandResult> result) {
            this.result = result;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (msg instanceof ControlMessage.Result answer) {
                result.complete(answer.result());
            }
            else {
                LOGGER.warn("Ignoring unexpected {} from gateway", msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.complete(CommandResult.error("gateway closed the connection before answering"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.complete(CommandResult.error("control connection failed: " + cause.getMessage()));
            ctx.close();
        }
    }
}
