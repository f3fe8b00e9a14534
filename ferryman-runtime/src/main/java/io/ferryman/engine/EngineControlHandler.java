/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.engine;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import io.ferryman.protocol.ControlMessage;

/**
 * Engine end of the control connection: decoded gateway messages in, calls on
 * {@link EngineRuntime} and {@link EngineClient} out.
 */
class EngineControlHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(EngineControlHandler.class);

    private final EngineClient client;
    private final EngineRuntime runtime;

    EngineControlHandler(EngineClient client, EngineRuntime runtime) {
        this.client = client;
        this.runtime = runtime;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof ControlMessage.Data data) {
            runtime.onInbound(data.sessionId(), data.payload());
        }
        else if (msg instanceof ControlMessage.ResyncSession resync) {
            runtime.onSessionAttach(resync.session(), true);
        }
        else if (msg instanceof ControlMessage.SessionOpened opened) {
            runtime.onSessionAttach(opened.session(), false);
        }
        else if (msg instanceof ControlMessage.Disconnect disconnect) {
            runtime.onSessionClosed(disconnect.sessionId(), disconnect.reason());
        }
        else if (msg instanceof ControlMessage.Shutdown shutdown) {
            client.shutdownRequested(shutdown.reason());
        }
        else if (msg instanceof ControlMessage.Result result) {
            if (!result.result().isOk()) {
                client.rejected(result.result());
            }
        }
        else if (msg instanceof ControlMessage message) {
            LOGGER.warn("Ignoring unexpected {} from gateway", message.kind());
        }
        else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        client.connectionClosed();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            LOGGER.debug("Control connection error: {}", cause.getMessage());
        }
        else {
            LOGGER.warn("Closing control connection after error: {}", cause.getMessage());
            LOGGER.debug("Control connection error detail", cause);
        }
        ctx.close();
    }
}
