package com.enr.rlp;

import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.util.UintBytes;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads RLP-encoded values from a byte array.
 * <p>
 * Every read checks that the value is canonically encoded and that it fits inside the
 * enclosing list, or the input when not inside a list. A failed read leaves the reader
 * at the start of the offending value.
 * <p>
 * Not thread-safe. The input array is not copied and must not change while being read.
 */
public final class RlpReader {

    private final byte[] input;
    private final int end;
    private int position;
    // end offset of every list entered but not yet exited
    private final IntArrayList listEnds = new IntArrayList();

    public RlpReader(byte[] input) {
        this(input, 0, Objects.requireNonNull(input, "Input cannot be null").length);
    }

    public RlpReader(byte[] input, int offset, int length) {
        Objects.requireNonNull(input, "Input cannot be null");
        if (offset < 0 || length < 0 || offset + length > input.length) {
            throw new IllegalArgumentException("Invalid offset/length");
        }
        this.input = input;
        this.position = offset;
        this.end = offset + length;
    }

    @Value
    private static class Header {
        RlpKind kind;
        int headerSize;
        int contentSize;
    }

    /**
     * Kind of the next value, without consuming it.
     */
    public RlpKind peekKind() throws EnrException {
        return readHeader().getKind();
    }

    /**
     * Read a byte string.
     */
    public byte[] readBytes() throws EnrException {
        var header = readHeader();
        switch (header.getKind()) {
            case BYTE:
                return new byte[]{input[position++]};
            case STRING:
                int start = position + header.getHeaderSize();
                checkCanonicalSingleByte(header, start);
                byte[] out = Arrays.copyOfRange(input, start, start + header.getContentSize());
                position = start + header.getContentSize();
                return out;
            default:
                throw expectedString();
        }
    }

    /**
     * Read a byte string that must be exactly {@code width} bytes long.
     */
    public byte[] readFixedBytes(int width) throws EnrException {
        var header = readHeader();
        switch (header.getKind()) {
            case BYTE:
                if (width != 1) {
                    throw wrongSize(1, width);
                }
                return new byte[]{input[position++]};
            case STRING:
                if (header.getContentSize() != width) {
                    throw wrongSize(header.getContentSize(), width);
                }
                int start = position + header.getHeaderSize();
                checkCanonicalSingleByte(header, start);
                position = start + width;
                return Arrays.copyOfRange(input, start, start + width);
            default:
                throw expectedString();
        }
    }

    /**
     * Read a byte string and decode it as UTF-8.
     */
    public String readString() throws EnrException {
        return new String(readBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Read an unsigned integer of at most 16 bits.
     */
    public int readUint16() throws EnrException {
        return (int) readUint(16);
    }

    /**
     * Read an unsigned integer of at most 64 bits. Values above {@link Long#MAX_VALUE}
     * come back negative and should be handled with the {@code Long.*Unsigned} methods.
     */
    public long readUint64() throws EnrException {
        return readUint(64);
    }

    /**
     * Enter the list at the current position. Subsequent reads return its elements
     * until {@link #exitList()} is called.
     * @return the payload size of the list in bytes
     */
    public int enterList() throws EnrException {
        var header = readHeader();
        if (header.getKind() != RlpKind.LIST) {
            throw new EnrException(ErrorType.EXPECTED_LIST, "rlp: expected List");
        }
        position += header.getHeaderSize();
        listEnds.push(position + header.getContentSize());
        return header.getContentSize();
    }

    /**
     * Whether the innermost entered list has elements left.
     * @throws IllegalStateException if no list has been entered
     */
    public boolean hasMoreInList() {
        if (listEnds.isEmpty()) {
            throw new IllegalStateException("Not inside a list");
        }
        return position < listEnds.topInt();
    }

    /**
     * Leave the innermost list. All of its elements must have been read.
     * @throws IllegalStateException if no list has been entered
     */
    public void exitList() throws EnrException {
        if (listEnds.isEmpty()) {
            throw new IllegalStateException("Not inside a list");
        }
        if (position != listEnds.topInt()) {
            throw new EnrException(ErrorType.NOT_AT_END_OF_LIST,
                    "rlp: exitList called with " + (listEnds.topInt() - position) + " bytes left in list");
        }
        listEnds.popInt();
    }

    /**
     * Read a list whose elements are all byte strings, decoded as UTF-8.
     */
    public List<String> readStringList() throws EnrException {
        enterList();
        var list = new ArrayList<String>();
        while (hasMoreInList()) {
            list.add(readString());
        }
        exitList();
        return list;
    }

    /**
     * Read the complete encoding of the next value, header included, without interpreting it.
     */
    public byte[] readRaw() throws EnrException {
        var header = readHeader();
        int total = header.getHeaderSize() + header.getContentSize();
        byte[] out = Arrays.copyOfRange(input, position, position + total);
        position += total;
        return out;
    }

    /**
     * Whether all input has been consumed. Only meaningful outside of lists.
     */
    public boolean isAtEnd() {
        return listEnds.isEmpty() && position >= end;
    }

    /**
     * Check that the input held exactly one value and that it has been read completely.
     * @throws IllegalStateException if a list is still entered
     */
    public void finish() throws EnrException {
        if (!listEnds.isEmpty()) {
            throw new IllegalStateException(listEnds.size() + " list(s) not exited");
        }
        if (position < end) {
            throw new EnrException(ErrorType.TRAILING_DATA,
                    "rlp: input contains more than one value (" + (end - position) + " trailing bytes)");
        }
    }

    private long readUint(int maxBits) throws EnrException {
        var header = readHeader();
        switch (header.getKind()) {
            case BYTE:
                int b = input[position] & 0xFF;
                if (b == 0) {
                    throw new EnrException(ErrorType.NON_CANONICAL_INTEGER,
                            "rlp: non-canonical integer (leading zero bytes)");
                }
                position++;
                return b;
            case STRING:
                int size = header.getContentSize();
                if (size > maxBits / 8) {
                    throw new EnrException(ErrorType.UINT_OVERFLOW,
                            "rlp: input string too long for uint" + maxBits);
                }
                int start = position + header.getHeaderSize();
                long value = UintBytes.decode(input, start, size);
                if (size == 1 && value < RlpWriter.STRING_OFFSET) {
                    throw nonCanonicalSize();
                }
                position = start + size;
                return value;
            default:
                throw expectedString();
        }
    }

    private Header readHeader() throws EnrException {
        int limit = limit();
        if (position >= limit) {
            if (!listEnds.isEmpty()) {
                throw new EnrException(ErrorType.END_OF_LIST, "rlp: end of list");
            }
            throw new EnrException(ErrorType.UNEXPECTED_EOF, "rlp: unexpected end of input");
        }
        int prefix = input[position] & 0xFF;
        Header header;
        if (prefix < RlpWriter.STRING_OFFSET) {
            header = new Header(RlpKind.BYTE, 0, 1);
        } else if (prefix <= RlpWriter.STRING_OFFSET + RlpWriter.SHORT_SIZE_LIMIT) {
            header = new Header(RlpKind.STRING, 1, prefix - RlpWriter.STRING_OFFSET);
        } else if (prefix < RlpWriter.LIST_OFFSET) {
            int sizeLength = prefix - RlpWriter.STRING_OFFSET - RlpWriter.SHORT_SIZE_LIMIT;
            header = new Header(RlpKind.STRING, 1 + sizeLength, readLongSize(sizeLength, limit));
        } else if (prefix <= RlpWriter.LIST_OFFSET + RlpWriter.SHORT_SIZE_LIMIT) {
            header = new Header(RlpKind.LIST, 1, prefix - RlpWriter.LIST_OFFSET);
        } else {
            int sizeLength = prefix - RlpWriter.LIST_OFFSET - RlpWriter.SHORT_SIZE_LIMIT;
            header = new Header(RlpKind.LIST, 1 + sizeLength, readLongSize(sizeLength, limit));
        }
        if ((long) position + header.getHeaderSize() + header.getContentSize() > limit) {
            throw tooLarge();
        }
        return header;
    }

    private int readLongSize(int sizeLength, int limit) throws EnrException {
        if (position + 1 + sizeLength > limit) {
            throw tooLarge();
        }
        if (input[position + 1] == 0) {
            throw nonCanonicalSize();
        }
        if (sizeLength > 4) {
            throw new EnrException(ErrorType.VALUE_TOO_LARGE, "rlp: size prefix of " + sizeLength + " bytes");
        }
        long size = UintBytes.decode(input, position + 1, sizeLength);
        if (size > Integer.MAX_VALUE) {
            throw new EnrException(ErrorType.VALUE_TOO_LARGE, "rlp: value of " + size + " bytes");
        }
        if (size <= RlpWriter.SHORT_SIZE_LIMIT) {
            throw nonCanonicalSize();
        }
        return (int) size;
    }

    private void checkCanonicalSingleByte(Header header, int start) throws EnrException {
        if (header.getContentSize() == 1 && (input[start] & 0xFF) < RlpWriter.STRING_OFFSET) {
            throw nonCanonicalSize();
        }
    }

    private int limit() {
        return listEnds.isEmpty() ? end : listEnds.topInt();
    }

    private EnrException tooLarge() {
        if (!listEnds.isEmpty()) {
            return new EnrException(ErrorType.ELEMENT_TOO_LARGE, "rlp: element is larger than containing list");
        }
        return new EnrException(ErrorType.VALUE_TOO_LARGE, "rlp: value size exceeds available input length");
    }

    private static EnrException nonCanonicalSize() {
        return new EnrException(ErrorType.NON_CANONICAL_SIZE, "rlp: non-canonical size information");
    }

    private static EnrException expectedString() {
        return new EnrException(ErrorType.EXPECTED_STRING, "rlp: expected String or Byte");
    }

    private static EnrException wrongSize(int actual, int expected) {
        return new EnrException(ErrorType.WRONG_SIZE,
                "rlp: input value has wrong size " + actual + ", want " + expected);
    }
}
