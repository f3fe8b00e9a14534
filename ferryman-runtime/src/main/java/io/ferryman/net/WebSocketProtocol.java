/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.net;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.handler.codec.MessageToMessageEncoder;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import io.ferryman.session.Capabilities;

/**
 * Browser clients over websocket. Each text frame is one unit of input and each unit of
 * output becomes one text frame. The session is only created once the HTTP upgrade has
 * completed.
 */
public class WebSocketProtocol implements WireProtocol {

    public static final String NAME = "websocket";

    private static final int MAX_HTTP_CONTENT_LENGTH = 64 * 1024;
    private static final TextFrameDecoder DECODER = new TextFrameDecoder();
    private static final TextFrameEncoder ENCODER = new TextFrameEncoder();

    private final String path;

    public WebSocketProtocol(String path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Capabilities defaultCapabilities() {
        // the web client renders its own markup, not ANSI
        return Capabilities.of(StandardCharsets.UTF_8, false, Capabilities.DEFAULT_SCREEN_WIDTH);
    }

    @Override
    public void configurePipeline(ChannelPipeline pipeline) {
        pipeline.addLast("httpCodec", new HttpServerCodec());
        pipeline.addLast("httpAggregator", new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));
        pipeline.addLast("websocket", new WebSocketServerProtocolHandler(path, null, true));
        pipeline.addLast("textFrameDecoder", DECODER);
        pipeline.addLast("textFrameEncoder", ENCODER);
    }

    @Override
    public boolean readyOnActive() {
        return false;
    }

    @Override
    public boolean isReadyEvent(Object userEvent) {
        return userEvent instanceof WebSocketServerProtocolHandler.HandshakeComplete;
    }

    @Override
    public byte[] formatNotice(String text, Capabilities capabilities) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public String path() {
        return path;
    }

    @Sharable
    static class TextFrameDecoder extends MessageToMessageDecoder<TextWebSocketFrame> {
        @Override
        protected void decode(ChannelHandlerContext ctx, TextWebSocketFrame frame, List<Object> out) {
            out.add(frame.content().retain());
        }
    }

    @Sharable
    static class TextFrameEncoder extends MessageToMessageEncoder<ByteBuf> {
        @Override
        protected void encode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out) {
            out.add(new TextWebSocketFrame(msg.retain()));
        }
    }
}
