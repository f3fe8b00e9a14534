/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;

/**
 * Reads {@code int32 length | uint8 kind | body} frames into {@link ControlMessage}s.
 *
 * <p>A frame whose declared length exceeds {@code maxFrameSizeBytes} raises
 * {@link FrameOversizedException}; an unknown kind, a truncated body or trailing bytes raise
 * {@link CorruptedFrameException}. Either way the stream can no longer be trusted and the
 * owning handler is expected to close the channel.</p>
 */
public class ControlFrameDecoder extends ByteToMessageDecoder {

    private final int maxFrameSizeBytes;

    public ControlFrameDecoder(int maxFrameSizeBytes) {
        if (maxFrameSizeBytes < 1) {
            throw new IllegalArgumentException("maxFrameSizeBytes must be positive");
        }
        this.maxFrameSizeBytes = maxFrameSizeBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= WireFormat.LENGTH_FIELD_BYTES) {
            int frameStart = in.readerIndex();
            int frameLength = in.getInt(frameStart);
            if (frameLength < 1) {
                throw new CorruptedFrameException("invalid frame length " + frameLength);
            }
            if (frameLength > maxFrameSizeBytes) {
                throw new FrameOversizedException(maxFrameSizeBytes, frameLength);
            }
            if (in.readableBytes() < WireFormat.LENGTH_FIELD_BYTES + frameLength) {
                return;
            }
            in.skipBytes(WireFormat.LENGTH_FIELD_BYTES);
            ByteBuf frame = in.readSlice(frameLength);
            out.add(decodeFrame(frame));
        }
    }

    static ControlMessage decodeFrame(ByteBuf frame) {
        byte code = frame.readByte();
        MessageKind kind = MessageKind.fromCode(code);
        if (kind == null) {
            throw new CorruptedFrameException("unknown message kind " + code);
        }
        ControlMessage message;
        try {
            message = decodeBody(kind, frame);
        }
        catch (IllegalArgumentException e) {
            throw new CorruptedFrameException("invalid " + kind + " frame: " + e.getMessage(), e);
        }
        if (frame.isReadable()) {
            throw new CorruptedFrameException(frame.readableBytes() + " unexpected trailing bytes in " + kind + " frame");
        }
        return message;
    }

    private static ControlMessage decodeBody(MessageKind kind, ByteBuf frame) {
        switch (kind) {
            case HELLO:
                return new ControlMessage.Hello(Role.fromCode(WireFormat.readByte(frame)), WireFormat.readLong(frame));
            case COMMAND:
                return new ControlMessage.Command(LifecycleCommand.fromCode(WireFormat.readByte(frame)));
            case RESULT:
                ResultStatus status = ResultStatus.fromCode(WireFormat.readByte(frame));
                return new ControlMessage.Result(new CommandResult(status, WireFormat.readString(frame)));
            case RESYNC_SESSION:
                return new ControlMessage.ResyncSession(WireFormat.readSnapshot(frame));
            case DATA:
                return new ControlMessage.Data(WireFormat.readLong(frame), WireFormat.readBytes(frame));
            case STOPPING:
                return new ControlMessage.Stopping(WireFormat.readBoolean(frame));
            case SHUTDOWN:
                return new ControlMessage.Shutdown(WireFormat.readString(frame));
            case SESSION_OPENED:
                return new ControlMessage.SessionOpened(WireFormat.readSnapshot(frame));
            case DISCONNECT:
                return new ControlMessage.Disconnect(WireFormat.readLong(frame), WireFormat.readString(frame));
            case SESSION_UPDATE:
                long sessionId = WireFormat.readLong(frame);
                String accountId = WireFormat.readOptionalString(frame);
                String puppetRef = WireFormat.readOptionalString(frame);
                return new ControlMessage.SessionUpdate(sessionId, accountId, puppetRef, WireFormat.readMap(frame));
            case RESYNC_FAILED:
                return new ControlMessage.ResyncFailed(WireFormat.readLong(frame), WireFormat.readString(frame));
            case ANNOUNCE:
                return new ControlMessage.Announce(WireFormat.readString(frame));
            default:
                throw new CorruptedFrameException("unhandled message kind " + kind);
        }
    }
}
