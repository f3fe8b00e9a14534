/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.internal;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.TooLongFrameException;

import io.ferryman.config.SlowClientPolicy;
import io.ferryman.internal.util.Metrics;
import io.ferryman.net.WireProtocol;
import io.ferryman.session.Capabilities;
import io.ferryman.session.ClientConnection;
import io.ferryman.session.Session;
import io.ferryman.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Handles one client socket, after the {@link WireProtocol} decoders have turned the byte
 * stream into input frames.
 *
 * <p>The session is created when the channel becomes active or, for protocols with a
 * handshake, when the protocol reports it is ready. Input arriving before that is
 * discarded.</p>
 *
 * <p>Outbound delivery may be called from any thread. When the channel's outbound buffer is
 * above its high water mark the configured {@link SlowClientPolicy} applies.</p>
 */
public class ClientFrontendHandler
        extends ChannelInboundHandlerAdapter
        implements ClientConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientFrontendHandler.class);

    private final WireProtocol protocol;
    private final SessionRouter router;
    private final SlowClientPolicy slowClientPolicy;
    private final Counter slowClientCounter = Metrics.outboundDiscardedCounter("slow");
    private final Counter closedClientCounter = Metrics.outboundDiscardedCounter("closed");

    private volatile @Nullable Channel channel;
    private volatile @Nullable Session session;

    public ClientFrontendHandler(WireProtocol protocol, SessionRouter router, SlowClientPolicy slowClientPolicy) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.router = Objects.requireNonNull(router, "router");
        this.slowClientPolicy = Objects.requireNonNull(slowClientPolicy, "slowClientPolicy");
    }

    @VisibleForTesting
    @Nullable
    Session session() {
        return session;
    }

    // ==================== Inbound ====================

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        this.channel = ctx.channel();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        if (protocol.readyOnActive()) {
            register(ctx);
        }
        super.channelActive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (session == null && protocol.isReadyEvent(evt)) {
            register(ctx);
        }
        super.userEventTriggered(ctx, evt);
    }

    private void register(ChannelHandlerContext ctx) {
        this.session = router.acceptClient(protocol.name(), remoteAddress(ctx.channel()), protocol.defaultCapabilities(), this);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof ByteBuf buf)) {
            ctx.fireChannelRead(msg);
            return;
        }
        byte[] input;
        try {
            input = ByteBufUtil.getBytes(buf);
        }
        finally {
            buf.release();
        }
        Session current = session;
        if (current == null) {
            LOGGER.debug("{}: Discarding {} bytes received before the session was established", ctx.channel(), input.length);
            return;
        }
        router.routeInbound(current, input);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Session current = session;
        if (current != null) {
            router.clientClosed(current, "connection closed");
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Session current = session;
        Object id = current != null ? current.id() : ctx.channel();
        if (cause instanceof TooLongFrameException && current != null) {
            LOGGER.debug("{}: Oversized input discarded: {}", id, cause.getMessage());
            router.inputTooLong(current);
            return;
        }
        if (cause instanceof IOException) {
            LOGGER.debug("{}: Client connection error: {}", id, cause.getMessage());
        }
        else {
            LOGGER.warn("{}: Closing client connection after error: {}", id, cause.getMessage());
            LOGGER.debug("{}: Client connection error detail", id, cause);
        }
        ctx.close();
    }

    // ==================== ClientConnection ====================

    @Override
    public void deliver(byte[] payload) {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            closedClientCounter.increment();
            return;
        }
        if (!ch.isWritable()) {
            slowClientCounter.increment();
            if (slowClientPolicy == SlowClientPolicy.DISCONNECT) {
                LOGGER.warn("{}: Client is not keeping up with output, disconnecting", sessionLabel());
                ch.close();
            }
            else {
                LOGGER.debug("{}: Client is not keeping up with output, dropping {} bytes", sessionLabel(), payload.length);
            }
            return;
        }
        ch.writeAndFlush(Unpooled.wrappedBuffer(payload), ch.voidPromise());
    }

    @Override
    public void sendNotice(String text) {
        Session current = session;
        Capabilities capabilities = current != null ? current.capabilities() : protocol.defaultCapabilities();
        deliver(protocol.formatNotice(text, capabilities));
    }

    @Override
    public void close(String reason) {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        LOGGER.debug("{}: Closing client connection: {}", sessionLabel(), reason);
        if (ch.isActive()) {
            ch.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
        }
        else {
            ch.close();
        }
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    private Object sessionLabel() {
        Session current = session;
        return current != null ? current.id() : String.valueOf(channel);
    }

    private static String remoteAddress(Channel channel) {
        SocketAddress socketAddress = channel.remoteAddress();
        if (socketAddress instanceof InetSocketAddress inetSocketAddress) {
            return inetSocketAddress.getAddress().getHostAddress() + ":" + inetSocketAddress.getPort();
        }
        else {
            return String.valueOf(socketAddress);
        }
    }
}
