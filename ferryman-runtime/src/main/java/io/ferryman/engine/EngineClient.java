/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import io.ferryman.protocol.CommandResult;
import io.ferryman.protocol.ControlChannels;
import io.ferryman.protocol.ControlMessage;
import io.ferryman.protocol.RestartMode;
import io.ferryman.protocol.Role;
import io.ferryman.service.HostPort;
import io.ferryman.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The engine's control connection to the gateway.
 *
 * <p>{@link #connect()} dials the gateway, retrying with exponential backoff until the
 * startup deadline, then introduces itself with {@code Hello}. From then on the gateway
 * drives: it resyncs sessions, forwards input, and eventually asks the engine to shut down.</p>
 *
 * <p>{@link #closeFuture()} completes when the connection is gone, with {@code true} only if
 * the engine shut down cleanly at the gateway's request.</p>
 */
public class EngineClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineClient.class);

    public static final Duration INITIAL_BACKOFF = Duration.ofMillis(100);
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_STARTUP_DEADLINE = Duration.ofSeconds(30);

    private final HostPort gateway;
    private final EngineRuntime runtime;
    private final int maxFrameSizeBytes;
    private final Duration startupDeadline;
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final CompletableFuture<Boolean> closed = new CompletableFuture<>();

    private volatile @Nullable Channel channel;
    private volatile boolean cleanShutdown;

    public EngineClient(HostPort gateway, EngineRuntime runtime, int maxFrameSizeBytes, Duration startupDeadline) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.maxFrameSizeBytes = maxFrameSizeBytes;
        this.startupDeadline = Objects.requireNonNull(startupDeadline, "startupDeadline");
    }

    // ==================== Connect ====================

    /**
     * @return completes once Hello has been sent, or exceptionally with an {@link IOException}
     *         if the gateway could not be reached before the startup deadline
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> connected = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) MAX_BACKOFF.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ControlChannels.configure(ch.pipeline(), maxFrameSizeBytes, false);
                        ch.pipeline().addLast("engineHandler", new EngineControlHandler(EngineClient.this, runtime));
                    }
                });
        long deadline = System.nanoTime() + startupDeadline.toNanos();
        attempt(bootstrap, connected, deadline, INITIAL_BACKOFF, 1);
        return connected;
    }

    private void attempt(Bootstrap bootstrap, CompletableFuture<Void> connected, long deadline, Duration backoff, int attempt) {
        bootstrap.connect(gateway.toSocketAddress()).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                Channel ch = future.channel();
                channel = ch;
                runtime.bind(this::send);
                ch.writeAndFlush(new ControlMessage.Hello(Role.ENGINE, ProcessHandle.current().pid()));
                LOGGER.info("Connected to gateway at {} after {} attempt(s)", gateway, attempt);
                scheduleIdleSweeps();
                connected.complete(null);
                return;
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                connected.completeExceptionally(new IOException("gateway at " + gateway + " not reachable after " + attempt + " attempts", future.cause()));
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
                return;
            }
            LOGGER.debug("Gateway at {} not reachable yet ({}), retrying in {}", gateway, future.cause().getMessage(), backoff);
            long delayNanos = Math.min(backoff.toNanos(), remainingNanos);
            Duration next = backoff.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff.multipliedBy(2);
            group.schedule(() -> attempt(bootstrap, connected, deadline, next, attempt + 1), delayNanos, TimeUnit.NANOSECONDS);
        });
    }

    private void scheduleIdleSweeps() {
        SessionPolicy policy = runtime.policy();
        if (!policy.limitsIdleTime()) {
            return;
        }
        long intervalMillis = policy.idleSweepInterval().toMillis();
        LOGGER.debug("Disconnecting sessions idle for more than {}, checking every {} ms", policy.idleTimeout(), intervalMillis);
        group.scheduleAtFixedRate(() -> runtime.disconnectIdleSessions(System.nanoTime()), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    // ==================== Engine to gateway ====================

    @VisibleForTesting
    void send(ControlMessage message) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            LOGGER.debug("Dropping {}, not connected to the gateway", message.kind());
            return;
        }
        ch.writeAndFlush(message, ch.voidPromise());
    }

    // ==================== Gateway-driven events ====================

    /**
     * The gateway asked this engine to stop. Drains, runs the stop hook for the restart mode
     * the reason names, flushes, announces a clean stop and closes. Runs on its own thread as
     * draining blocks.
     */
    void shutdownRequested(String reason) {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        RestartMode mode = RestartMode.fromShutdownReason(reason);
        LOGGER.info("Gateway requested shutdown: {}", reason);
        Thread thread = new Thread(() -> {
            boolean clean = runtime.shutdown(mode);
            cleanShutdown = clean;
            Channel ch = channel;
            if (ch != null && ch.isActive()) {
                ch.writeAndFlush(new ControlMessage.Stopping(clean)).addListener(ChannelFutureListener.CLOSE);
            }
            else {
                closed.complete(clean);
            }
        }, "engine-shutdown");
        thread.start();
    }

    void rejected(CommandResult result) {
        LOGGER.error("Gateway refused this engine: {} {}", result.status(), result.detail());
        stopping.set(true);
    }

    void connectionClosed() {
        if (!stopping.get()) {
            LOGGER.error("Lost connection to the gateway at {}", gateway);
        }
        closed.complete(cleanShutdown);
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * Registers a JVM shutdown hook that, unless the engine already shut down at the
     * gateway's request, tells the gateway this engine is going away uncleanly.
     */
    public void installShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::onJvmExit, "engine-exit-hook"));
    }

    @VisibleForTesting
    void onJvmExit() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new ControlMessage.Stopping(false)).awaitUninterruptibly(1, TimeUnit.SECONDS);
        }
    }

    // ==================== Lifecycle ====================

    public CompletableFuture<Boolean> closeFuture() {
        return closed;
    }

    @Override
    public void close() {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    }
}
