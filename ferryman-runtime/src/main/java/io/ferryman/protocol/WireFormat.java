/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.protocol;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.CorruptedFrameException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Primitive encodings shared by the control frame encoder and decoder.
 * <ul>
 *   <li>string: int32 byte length, UTF-8 bytes</li>
 *   <li>optional string: presence byte (0/1), then a string when present</li>
 *   <li>bytes: int32 length, raw bytes</li>
 *   <li>string map: uint16 entry count, then key/value strings</li>
 * </ul>
 * Reads are bounds checked against the frame; a short frame is a {@link CorruptedFrameException}.
 */
final class WireFormat {

    static final int LENGTH_FIELD_BYTES = 4;
    static final int MAX_MAP_ENTRIES = 0xFFFF;

    private WireFormat() {
    }

    static void writeString(ByteBuf out, String value) {
        int lengthIndex = out.writerIndex();
        out.writeInt(0);
        int written = out.writeCharSequence(value, StandardCharsets.UTF_8);
        out.setInt(lengthIndex, written);
    }

    static void writeOptionalString(ByteBuf out, @Nullable String value) {
        if (value == null) {
            out.writeByte(0);
        }
        else {
            out.writeByte(1);
            writeString(out, value);
        }
    }

    static void writeBytes(ByteBuf out, byte[] value) {
        out.writeInt(value.length);
        out.writeBytes(value);
    }

    static void writeMap(ByteBuf out, Map<String, String> map) {
        if (map.size() > MAX_MAP_ENTRIES) {
            throw new IllegalArgumentException("too many map entries: " + map.size());
        }
        out.writeShort(map.size());
        for (Map.Entry<String, String> entry : map.entrySet()) {
            writeString(out, entry.getKey());
            writeString(out, entry.getValue());
        }
    }

    static void writeSnapshot(ByteBuf out, SessionSnapshot snapshot) {
        out.writeLong(snapshot.sessionId());
        writeString(out, snapshot.protocol());
        writeString(out, snapshot.remoteAddress());
        out.writeLong(snapshot.connectedAtMillis());
        writeOptionalString(out, snapshot.accountId());
        writeOptionalString(out, snapshot.puppetRef());
        writeMap(out, snapshot.capabilities());
    }

    static byte readByte(ByteBuf in) {
        require(in, 1);
        return in.readByte();
    }

    static long readLong(ByteBuf in) {
        require(in, 8);
        return in.readLong();
    }

    static boolean readBoolean(ByteBuf in) {
        return readByte(in) != 0;
    }

    static String readString(ByteBuf in) {
        int length = readLength(in);
        return in.readCharSequence(length, StandardCharsets.UTF_8).toString();
    }

    @Nullable
    static String readOptionalString(ByteBuf in) {
        byte present = readByte(in);
        if (present == 0) {
            return null;
        }
        if (present != 1) {
            throw new CorruptedFrameException("invalid presence flag " + present);
        }
        return readString(in);
    }

    static byte[] readBytes(ByteBuf in) {
        int length = readLength(in);
        byte[] bytes = new byte[length];
        in.readBytes(bytes);
        return bytes;
    }

    static Map<String, String> readMap(ByteBuf in) {
        require(in, 2);
        int entries = in.readUnsignedShort();
        Map<String, String> map = new LinkedHashMap<>(Math.max(4, entries * 2));
        for (int i = 0; i < entries; i++) {
            map.put(readString(in), readString(in));
        }
        return map;
    }

    static SessionSnapshot readSnapshot(ByteBuf in) {
        long sessionId = readLong(in);
        String protocol = readString(in);
        String remoteAddress = readString(in);
        long connectedAt = readLong(in);
        String accountId = readOptionalString(in);
        String puppetRef = readOptionalString(in);
        Map<String, String> capabilities = readMap(in);
        return new SessionSnapshot(sessionId, protocol, remoteAddress, connectedAt, accountId, puppetRef, capabilities);
    }

    private static int readLength(ByteBuf in) {
        require(in, 4);
        int length = in.readInt();
        if (length < 0) {
            throw new CorruptedFrameException("negative field length " + length);
        }
        require(in, length);
        return length;
    }

    private static void require(ByteBuf in, int bytes) {
        if (in.readableBytes() < bytes) {
            throw new CorruptedFrameException("truncated frame: needed " + bytes + " bytes, " + in.readableBytes() + " remaining");
        }
    }
}
