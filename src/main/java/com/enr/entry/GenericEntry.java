package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import com.enr.rlp.ValueCodec;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Attaches a value of any codec-supported type to an arbitrary key.
 * <p>
 * Usage:
 * <pre>
 *   builder.set(GenericEntry.of("eth2", forkDigest, ValueCodec.BYTES));
 *   byte[] digest = record.load(GenericEntry.decoder("eth2", ValueCodec.BYTES)).getValue();
 * </pre>
 * The value is checked only by its codec. Equality compares key and value, array values
 * by content.
 */
@Getter
public final class GenericEntry<T> implements Entry {
    private final String key;
    private final T value;
    private final ValueCodec<T> codec;

    private GenericEntry(String key, T value, ValueCodec<T> codec) {
        this.key = checkKey(key);
        this.value = Objects.requireNonNull(value, "Value cannot be null");
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
    }

    public static <T> GenericEntry<T> of(String key, T value, ValueCodec<T> codec) {
        return new GenericEntry<>(key, value, codec);
    }

    /**
     * Decoder producing a new {@code GenericEntry} for {@code key} from the encoded value.
     */
    public static <T> EntryDecoder<GenericEntry<T>> decoder(String key, ValueCodec<T> codec) {
        checkKey(key);
        Objects.requireNonNull(codec, "Codec cannot be null");
        return new EntryDecoder<>() {
            @Override
            public String getEnrKey() {
                return key;
            }

            @Override
            public GenericEntry<T> decode(RlpReader reader) throws EnrException {
                return new GenericEntry<>(key, codec.decode(reader), codec);
            }
        };
    }

    @Override
    public String getEnrKey() {
        return key;
    }

    @Override
    public void encode(RlpWriter writer) throws EnrException {
        codec.encode(value, writer);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GenericEntry)) return false;
        var that = (GenericEntry<?>) obj;
        return key.equals(that.key) && Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new Object[]{key, value});
    }

    @Override
    public String toString() {
        String text = Arrays.deepToString(new Object[]{value});
        return key + "=" + text.substring(1, text.length() - 1);
    }

    private static String checkKey(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be empty");
        }
        return key;
    }
}
