/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes a {@link ControlMessage} as {@code int32 length | uint8 kind | body}.
 * The length counts the kind byte and the body.
 */
@Sharable
public class ControlFrameEncoder extends MessageToByteEncoder<ControlMessage> {

    public ControlFrameEncoder() {
        super(ControlMessage.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, ControlMessage msg, ByteBuf out) {
        encode(msg, out);
    }

    static void encode(ControlMessage msg, ByteBuf out) {
        int lengthIndex = out.writerIndex();
        out.writeInt(0);
        out.writeByte(msg.kind().code());
        if (msg instanceof ControlMessage.Hello hello) {
            out.writeByte(hello.role().code());
            out.writeLong(hello.pid());
        }
        else if (msg instanceof ControlMessage.Command command) {
            out.writeByte(command.command().code());
        }
        else if (msg instanceof ControlMessage.Result result) {
            out.writeByte(result.result().status().code());
            WireFormat.writeString(out, result.result().detail());
        }
        else if (msg instanceof ControlMessage.ResyncSession resync) {
            WireFormat.writeSnapshot(out, resync.session());
        }
        else if (msg instanceof ControlMessage.Data data) {
            out.writeLong(data.sessionId());
            WireFormat.writeBytes(out, data.payload());
        }
        else if (msg instanceof ControlMessage.Stopping stopping) {
            out.writeBoolean(stopping.clean());
        }
        else if (msg instanceof ControlMessage.Shutdown shutdown) {
            WireFormat.writeString(out, shutdown.reason());
        }
        else if (msg instanceof ControlMessage.SessionOpened opened) {
            WireFormat.writeSnapshot(out, opened.session());
        }
        else if (msg instanceof ControlMessage.Disconnect disconnect) {
            out.writeLong(disconnect.sessionId());
            WireFormat.writeString(out, disconnect.reason());
        }
        else if (msg instanceof ControlMessage.SessionUpdate update) {
            out.writeLong(update.sessionId());
            WireFormat.writeOptionalString(out, update.accountId());
            WireFormat.writeOptionalString(out, update.puppetRef());
            WireFormat.writeMap(out, update.capabilities());
        }
        else if (msg instanceof ControlMessage.ResyncFailed failed) {
            out.writeLong(failed.sessionId());
            WireFormat.writeString(out, failed.detail());
        }
        else if (msg instanceof ControlMessage.Announce announce) {
            WireFormat.writeString(out, announce.message());
        }
        else {
            throw new IllegalArgumentException("unsupported message " + msg);
        }
        out.setInt(lengthIndex, out.writerIndex() - lengthIndex - WireFormat.LENGTH_FIELD_BYTES);
    }
}
