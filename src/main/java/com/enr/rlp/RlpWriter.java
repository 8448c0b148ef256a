package com.enr.rlp;

import com.enr.util.UintBytes;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Growable buffer that writes values in recursive length prefix (RLP) encoding.
 * <p>
 * Lists are written by calling {@link #startList()}, writing the elements, then
 * {@link #endList()}. The list header is inserted when the list is closed, once its
 * payload size is known. Lists may nest.
 * <p>
 * Not thread-safe.
 */
@SuppressWarnings("UnusedReturnValue")
public final class RlpWriter {

    static final int STRING_OFFSET = 0x80;
    static final int LIST_OFFSET = 0xC0;
    static final int SHORT_SIZE_LIMIT = 55;

    private static final int DEFAULT_CAPACITY = 64;

    private byte[] buffer;
    private int position;
    // payload start of every list not yet closed
    private final IntArrayList openLists = new IntArrayList();

    public RlpWriter() {
        this(DEFAULT_CAPACITY);
    }

    public RlpWriter(int initialCapacity) {
        this.buffer = new byte[Math.max(16, initialCapacity)];
    }

    /**
     * Write a byte string. A single byte below 0x80 is written as itself.
     */
    public RlpWriter writeBytes(byte[] value) {
        Objects.requireNonNull(value, "Bytes cannot be null");
        if (value.length == 1 && (value[0] & 0xFF) < STRING_OFFSET) {
            ensureCapacity(1);
            buffer[position++] = value[0];
            return this;
        }
        ensureCapacity(headerLength(value.length) + value.length);
        position += putHeader(position, STRING_OFFSET, value.length);
        System.arraycopy(value, 0, buffer, position, value.length);
        position += value.length;
        return this;
    }

    /**
     * Write the UTF-8 bytes of {@code value} as a byte string.
     */
    public RlpWriter writeString(String value) {
        Objects.requireNonNull(value, "String cannot be null");
        return writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Write an unsigned integer as its minimal big-endian byte string.
     * Negative values are treated as unsigned 64-bit integers.
     */
    public RlpWriter writeUint(long value) {
        if (value == 0) {
            ensureCapacity(1);
            buffer[position++] = (byte) STRING_OFFSET;
        } else if (value > 0 && value < STRING_OFFSET) {
            ensureCapacity(1);
            buffer[position++] = (byte) value;
        } else {
            int length = UintBytes.encodedLength(value);
            ensureCapacity(1 + length);
            buffer[position++] = (byte) (STRING_OFFSET + length);
            position += UintBytes.encode(value, buffer, position);
        }
        return this;
    }

    /**
     * Append bytes that are already RLP-encoded. The caller is responsible for
     * {@code encoded} holding exactly one well-formed value.
     */
    public RlpWriter writeRaw(byte[] encoded) {
        Objects.requireNonNull(encoded, "Encoded value cannot be null");
        ensureCapacity(encoded.length);
        System.arraycopy(encoded, 0, buffer, position, encoded.length);
        position += encoded.length;
        return this;
    }

    /**
     * Open a list. Everything written until the matching {@link #endList()} becomes its payload.
     */
    public RlpWriter startList() {
        openLists.push(position);
        return this;
    }

    /**
     * Close the innermost open list and prepend its header.
     * @throws IllegalStateException if no list is open
     */
    public RlpWriter endList() {
        if (openLists.isEmpty()) {
            throw new IllegalStateException("endList() without matching startList()");
        }
        int start = openLists.popInt();
        int payload = position - start;
        int header = headerLength(payload);
        ensureCapacity(header);
        System.arraycopy(buffer, start, buffer, start + header, payload);
        putHeader(start, LIST_OFFSET, payload);
        position += header;
        return this;
    }

    /**
     * Number of bytes written so far.
     */
    public int size() {
        return position;
    }

    /**
     * Copy of the encoded output.
     * @throws IllegalStateException if a list is still open
     */
    public byte[] toByteArray() {
        if (!openLists.isEmpty()) {
            throw new IllegalStateException(openLists.size() + " list(s) still open");
        }
        return Arrays.copyOf(buffer, position);
    }

    static int headerLength(int size) {
        return size <= SHORT_SIZE_LIMIT ? 1 : 1 + UintBytes.encodedLength(size);
    }

    private int putHeader(int at, int offset, int size) {
        if (size <= SHORT_SIZE_LIMIT) {
            buffer[at] = (byte) (offset + size);
            return 1;
        }
        int sizeLength = UintBytes.encodedLength(size);
        buffer[at] = (byte) (offset + SHORT_SIZE_LIMIT + sizeLength);
        UintBytes.encode(size, buffer, at + 1);
        return 1 + sizeLength;
    }

    private void ensureCapacity(int additionalBytes) {
        int requiredCapacity = position + additionalBytes;
        if (requiredCapacity <= buffer.length) return;

        // 1.5x growth, aligned to 64 bytes
        int newCapacity = Math.max(requiredCapacity, (buffer.length * 3) / 2);
        newCapacity = (newCapacity + 63) & ~63;
        buffer = Arrays.copyOf(buffer, newCapacity);
    }
}
