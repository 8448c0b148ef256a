package com.enr.rlp;

import com.enr.error.EnrException;
import com.enr.error.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encodes and decodes values of one Java type to and from RLP.
 * Standard codecs for the shapes node records use are provided as constants.
 */
public interface ValueCodec<T> {
    void encode(T value, RlpWriter writer) throws EnrException;
    T decode(RlpReader reader) throws EnrException;

    /**
     * Encode {@code value} on its own.
     */
    default byte[] toBytes(T value) throws EnrException {
        var writer = new RlpWriter();
        encode(value, writer);
        return writer.toByteArray();
    }

    /**
     * Decode {@code input}, which must hold exactly one value.
     */
    default T fromBytes(byte[] input) throws EnrException {
        var reader = new RlpReader(input);
        T value = decode(reader);
        reader.finish();
        return value;
    }

    ValueCodec<Integer> UINT16 = new ValueCodec<>() {
        @Override
        public void encode(Integer value, RlpWriter writer) throws EnrException {
            Objects.requireNonNull(value, "Value cannot be null");
            if (value < 0 || value > 0xFFFF) {
                throw new EnrException(ErrorType.UINT_OVERFLOW, "Value out of range for uint16: " + value);
            }
            writer.writeUint(value);
        }

        @Override
        public Integer decode(RlpReader reader) throws EnrException {
            return reader.readUint16();
        }
    };

    /**
     * Unsigned 64-bit integers held in a {@code long}; negative values stand for the upper half of the range.
     */
    ValueCodec<Long> UINT64 = new ValueCodec<>() {
        @Override
        public void encode(Long value, RlpWriter writer) {
            writer.writeUint(Objects.requireNonNull(value, "Value cannot be null"));
        }

        @Override
        public Long decode(RlpReader reader) throws EnrException {
            return reader.readUint64();
        }
    };

    ValueCodec<String> STRING = new ValueCodec<>() {
        @Override
        public void encode(String value, RlpWriter writer) {
            writer.writeString(value);
        }

        @Override
        public String decode(RlpReader reader) throws EnrException {
            return reader.readString();
        }
    };

    ValueCodec<byte[]> BYTES = new ValueCodec<>() {
        @Override
        public void encode(byte[] value, RlpWriter writer) {
            writer.writeBytes(value);
        }

        @Override
        public byte[] decode(RlpReader reader) throws EnrException {
            return reader.readBytes();
        }
    };

    ValueCodec<List<String>> STRING_LIST = listOf(STRING);

    /**
     * Codec for a list whose elements all use {@code element}.
     */
    static <T> ValueCodec<List<T>> listOf(ValueCodec<T> element) {
        Objects.requireNonNull(element, "Element codec cannot be null");
        return new ValueCodec<>() {
            @Override
            public void encode(List<T> value, RlpWriter writer) throws EnrException {
                Objects.requireNonNull(value, "List cannot be null");
                writer.startList();
                for (T item : value) {
                    element.encode(item, writer);
                }
                writer.endList();
            }

            @Override
            public List<T> decode(RlpReader reader) throws EnrException {
                reader.enterList();
                var list = new ArrayList<T>();
                while (reader.hasMoreInList()) {
                    list.add(element.decode(reader));
                }
                reader.exitList();
                return list;
            }
        };
    }
}
