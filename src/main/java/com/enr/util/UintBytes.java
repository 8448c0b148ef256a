package com.enr.util;

import com.enr.error.EnrException;
import com.enr.error.ErrorType;

/**
 * Utility class for the minimal big-endian form of unsigned integers used by RLP.
 * Zero has an empty encoding; any other value is written without leading zero bytes.
 */
public final class UintBytes {

    private static final int MAX_UINT_LEN = 8;

    private UintBytes() {} // utility class

    /**
     * Calculate the number of bytes needed to encode the given value.
     * @param value the value to encode (treated as unsigned)
     * @return the number of bytes needed, 0 for zero
     */
    public static int encodedLength(long value) {
        return (Long.SIZE - Long.numberOfLeadingZeros(value) + 7) / 8;
    }

    /**
     * Write the minimal big-endian form of {@code value} into {@code dst} at {@code offset}.
     * @return the number of bytes written
     */
    public static int encode(long value, byte[] dst, int offset) {
        int length = encodedLength(value);
        for (int i = length - 1; i >= 0; i--) {
            dst[offset + i] = (byte) value;
            value >>>= 8;
        }
        return length;
    }

    /**
     * Encode {@code value} into a new array of minimal length.
     */
    public static byte[] toByteArray(long value) {
        byte[] out = new byte[encodedLength(value)];
        encode(value, out, 0);
        return out;
    }

    /**
     * Decode a big-endian unsigned integer of {@code length} bytes.
     * Leading zero bytes are rejected since they make the encoding non-canonical.
     * @throws EnrException if the value is longer than 8 bytes or has a leading zero
     */
    public static long decode(byte[] src, int offset, int length) throws EnrException {
        if (length > MAX_UINT_LEN) {
            throw new EnrException(ErrorType.UINT_OVERFLOW,
                    "rlp: uint overflow, " + length + " bytes");
        }
        if (length > 0 && src[offset] == 0) {
            throw new EnrException(ErrorType.NON_CANONICAL_INTEGER,
                    "rlp: non-canonical integer (leading zero bytes)");
        }
        long result = 0;
        for (int i = 0; i < length; i++) {
            result = (result << 8) | (src[offset + i] & 0xFF);
        }
        return result;
    }
}
