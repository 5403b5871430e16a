package com.acme.finops.slots.wire;

import java.util.Objects;

/**
 * Prefix-length variable-length encoding of unsigned 64-bit integers.
 *
 * <p>The number of leading one bits in the first byte is the number of bytes that
 * follow it. The remaining bits of the first byte are the most significant value
 * bits; the following bytes carry the rest, big-endian.
 *
 * <pre>
 * 0xxxxxxx                      1 byte    7 bits
 * 10xxxxxx +1                   2 bytes  14 bits
 * 110xxxxx +2                   3 bytes  21 bits
 * ...
 * 11111110 +7                   8 bytes  56 bits
 * 11111111 +8                   9 bytes  64 bits (first byte carries no value bits)
 * </pre>
 *
 * <p>Example: 456 has 9 significant bits, so it takes two bytes:
 * {@code 1000_0001 1100_1000}.
 *
 * <p>Values are {@code long}s interpreted as unsigned. {@link #zigzagEncode} maps
 * signed values of small magnitude to small unsigned ones first.
 */
public final class VarInts {
    public static final int MAX_LENGTH = 9;

    private VarInts() {
    }

    /** Number of bytes {@link #encode} writes for {@code value}. */
    public static int encodedLength(long value) {
        int bitLength = Long.SIZE - Long.numberOfLeadingZeros(value);
        if (bitLength <= 7) {
            return 1;
        }
        if (bitLength > 56) {
            return MAX_LENGTH;
        }
        return (bitLength + 6) / 7;
    }

    /** Total varint length announced by its first byte, 1 to 9. */
    public static int decodedLength(byte first) {
        // leading ones of the byte == leading zeros of its complement, within 8 bits
        return Integer.numberOfLeadingZeros(~first & 0xFF) - 24 + 1;
    }

    /**
     * Writes {@code value} at {@code dst[offset]}.
     *
     * @return number of bytes written
     * @throws IndexOutOfBoundsException if {@code dst} has no room for the encoding
     */
    public static int encode(long value, byte[] dst, int offset) {
        Objects.requireNonNull(dst, "dst");
        int len = encodedLength(value);
        Objects.checkFromIndexSize(offset, len, dst.length);

        if (len == 1) {
            dst[offset] = (byte) value;
            return 1;
        }
        if (len == MAX_LENGTH) {
            dst[offset] = (byte) 0xFF;
            writeBigEndian(value, dst, offset + 1, 8);
            return MAX_LENGTH;
        }

        int prefix = (0xFF << (9 - len)) & 0xFF;
        int valueMask = 0xFF >>> len;
        writeBigEndian(value, dst, offset, len);
        dst[offset] = (byte) ((dst[offset] & valueMask) | prefix);
        return len;
    }

    /** Encodes into a fresh array of exactly {@link #encodedLength(long)} bytes. */
    public static byte[] encode(long value) {
        byte[] out = new byte[encodedLength(value)];
        encode(value, out, 0);
        return out;
    }

    /**
     * Reads one varint starting at {@code src[offset]}, never reading at or past {@code limit}.
     *
     * @throws WireException if the input ends before the varint does
     */
    public static long decode(byte[] src, int offset, int limit) throws WireException {
        Objects.requireNonNull(src, "src");
        Objects.checkFromToIndex(offset, limit, src.length);
        if (offset >= limit) {
            throw new WireException(WireErrorCode.EMPTY_INPUT, offset, "No bytes left for varint");
        }
        int len = decodedLength(src[offset]);
        if (limit - offset < len) {
            throw new WireException(WireErrorCode.TRUNCATED_VARINT, offset,
                "Varint needs " + len + " bytes, " + (limit - offset) + " available");
        }
        return decodeUnchecked(src, offset, len);
    }

    public static long decode(byte[] src) throws WireException {
        return decode(src, 0, src.length);
    }

    /**
     * Decodes a varint whose length is already known (see {@link #decodedLength}).
     * A wrong {@code len} yields a wrong value, never an out-of-bounds read beyond
     * {@code offset + len}.
     */
    public static long decodeUnchecked(byte[] src, int offset, int len) {
        if (len < 1 || len > MAX_LENGTH) {
            throw new IllegalArgumentException("Varint length must be in [1, 9], got " + len);
        }
        if (len == MAX_LENGTH) {
            return readBigEndian(src, offset + 1, 8);
        }
        // len 8 leaves no value bits in the first byte
        int valueMask = 0xFF >>> len;
        long value = src[offset] & valueMask;
        for (int i = 1; i < len; i++) {
            value = (value << 8) | (src[offset + i] & 0xFFL);
        }
        return value;
    }

    public static long zigzagEncode(long value) {
        return (value << 1) ^ (value >> 63);
    }

    public static long zigzagDecode(long encoded) {
        return (encoded >>> 1) ^ -(encoded & 1);
    }

    private static void writeBigEndian(long value, byte[] dst, int offset, int len) {
        for (int i = len - 1; i >= 0; i--) {
            dst[offset + i] = (byte) value;
            value >>>= 8;
        }
    }

    private static long readBigEndian(byte[] src, int offset, int len) {
        long value = 0L;
        for (int i = 0; i < len; i++) {
            value = (value << 8) | (src[offset + i] & 0xFFL);
        }
        return value;
    }
}
