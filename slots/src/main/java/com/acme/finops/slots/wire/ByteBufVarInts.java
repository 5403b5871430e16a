package com.acme.finops.slots.wire;

import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * {@link VarInts} over Netty buffers. Reads consume from {@code readerIndex},
 * writes append at {@code writerIndex}.
 */
public final class ByteBufVarInts {
    private ByteBufVarInts() {
    }

    /**
     * Reads one varint and advances the reader index past it. On failure the
     * reader index is left unchanged.
     */
    public static long read(ByteBuf buf) throws WireException {
        Objects.requireNonNull(buf, "buf");
        int start = buf.readerIndex();
        int readable = buf.readableBytes();
        if (readable == 0) {
            throw new WireException(WireErrorCode.EMPTY_INPUT, start, "No bytes left for varint");
        }
        int len = VarInts.decodedLength(buf.getByte(start));
        if (readable < len) {
            throw new WireException(WireErrorCode.TRUNCATED_VARINT, start,
                "Varint needs " + len + " bytes, " + readable + " available");
        }

        long value;
        if (len == VarInts.MAX_LENGTH) {
            value = buf.getLong(start + 1);
        } else {
            int valueMask = 0xFF >>> len;
            value = buf.getByte(start) & valueMask;
            for (int i = 1; i < len; i++) {
                value = (value << 8) | buf.getUnsignedByte(start + i);
            }
        }
        buf.readerIndex(start + len);
        return value;
    }

    public static long readSigned(ByteBuf buf) throws WireException {
        return VarInts.zigzagDecode(read(buf));
    }

    /**
     * Appends {@code value}, growing the buffer if needed.
     *
     * @return number of bytes written
     */
    public static int write(ByteBuf buf, long value) {
        Objects.requireNonNull(buf, "buf");
        int len = VarInts.encodedLength(value);
        byte[] scratch = new byte[VarInts.MAX_LENGTH];
        VarInts.encode(value, scratch, 0);
        buf.writeBytes(scratch, 0, len);
        return len;
    }

    public static int writeSigned(ByteBuf buf, long value) {
        return write(buf, VarInts.zigzagEncode(value));
    }
}
