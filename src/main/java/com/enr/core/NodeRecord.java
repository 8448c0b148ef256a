package com.enr.core;

import com.enr.Constants;
import com.enr.entry.Entry;
import com.enr.entry.EntryDecoder;
import com.enr.entry.EntryType;
import com.enr.entry.RawEntry;
import com.enr.error.EnrException;
import com.enr.error.ErrorType;
import com.enr.error.KeyException;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import com.enr.util.IpBytes;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * An immutable, unsigned node record: a sequence number and a set of key/value pairs
 * kept in ascending key order, each value stored in its encoded form.
 * <p>
 * Typed access goes through entries. Usage:
 * <pre>
 *   var record = NodeRecord.builder()
 *       .seq(1)
 *       .set(IdEntry.V4)
 *       .set(new Ipv4AddrEntry(InetAddress.getByName("192.0.2.1")))
 *       .set(PortEntry.udp(30303))
 *       .build();
 *
 *   int udp = record.load(PortEntry.Udp.DECODER).getPort();
 * </pre>
 * Wire form: the RLP list {@code [seq, k1, v1, k2, v2, ...]}, keys being well-formed UTF-8
 * sorted by their encoded bytes.
 * Signing is the job of an identity scheme and not done here.
 */
@Slf4j
public final class NodeRecord {
    /**
     * Orders keys by their UTF-8 bytes, compared unsigned, which is the order they take on the wire.
     */
    public static final Comparator<String> KEY_ORDER =
            (a, b) -> Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final long seq;
    private final SortedMap<String, byte[]> pairs;

    private NodeRecord(long seq, TreeMap<String, byte[]> pairs) {
        this.seq = seq;
        this.pairs = Collections.unmodifiableSortedMap(pairs);
    }

    public static Builder builder() {
        return new Builder(0, new TreeMap<>(KEY_ORDER));
    }

    /**
     * A builder starting from this record's sequence number and pairs.
     */
    public Builder toBuilder() {
        return new Builder(seq, new TreeMap<>(pairs));
    }

    /**
     * Sequence number, unsigned.
     */
    public long getSeq() {
        return seq;
    }

    public int size() {
        return pairs.size();
    }

    public boolean has(String key) {
        return pairs.containsKey(key);
    }

    /**
     * Keys present in the record, in {@link #KEY_ORDER}.
     */
    public Set<String> keys() {
        return pairs.keySet();
    }

    /**
     * The encoded value stored under {@code key}.
     */
    public Optional<byte[]> getEncodedValue(String key) {
        byte[] value = pairs.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    /**
     * Decode the entry stored under the decoder's key.
     * @throws KeyException for a missing key (see {@link KeyException#isNotFound(Throwable)}),
     *                      or wrapping the failure if the stored value does not decode
     */
    public <T extends Entry> T load(EntryDecoder<T> decoder) throws KeyException {
        Objects.requireNonNull(decoder, "Decoder cannot be null");
        String key = decoder.getEnrKey();
        byte[] encoded = pairs.get(key);
        if (encoded == null) {
            throw KeyException.notFound(key);
        }
        try {
            var reader = new RlpReader(encoded);
            T entry = decoder.decode(reader);
            reader.finish();
            return entry;
        } catch (EnrException e) {
            throw new KeyException(key, e);
        }
    }

    /**
     * All pairs as entries, in key order. Well-known keys are decoded to their types;
     * others, and well-known keys whose value fails to decode, are returned as {@link RawEntry}.
     */
    public List<Entry> entries() {
        var result = new ArrayList<Entry>(pairs.size());
        for (var pair : pairs.entrySet()) {
            try {
                result.add(EntryType.decode(pair.getKey(), pair.getValue()));
            } catch (EnrException e) {
                log.debug("Value of key '{}' does not decode, keeping it raw: {}", pair.getKey(), e.getMessage());
                result.add(new RawEntry(pair.getKey(), pair.getValue()));
            }
        }
        return result;
    }

    /**
     * Encode the record.
     * @throws EnrException if the encoding exceeds {@link Constants#SIZE_LIMIT}
     */
    public byte[] encode() throws EnrException {
        var writer = new RlpWriter();
        writer.startList();
        writer.writeUint(seq);
        for (var pair : pairs.entrySet()) {
            writer.writeString(pair.getKey());
            writer.writeRaw(pair.getValue());
        }
        writer.endList();
        if (writer.size() > Constants.SIZE_LIMIT) {
            throw new EnrException(ErrorType.RECORD_TOO_LARGE,
                    "record size " + writer.size() + " exceeds limit of " + Constants.SIZE_LIMIT + " bytes");
        }
        return writer.toByteArray();
    }

    /**
     * Decode a record produced by {@link #encode()}. Keys must be unique and in ascending order.
     */
    public static NodeRecord decode(byte[] input) throws EnrException {
        Objects.requireNonNull(input, "Input cannot be null");
        if (input.length > Constants.SIZE_LIMIT) {
            throw new EnrException(ErrorType.RECORD_TOO_LARGE,
                    "record size " + input.length + " exceeds limit of " + Constants.SIZE_LIMIT + " bytes");
        }
        var reader = new RlpReader(input);
        reader.enterList();
        long seq = reader.readUint64();
        var pairs = new TreeMap<String, byte[]>(KEY_ORDER);
        byte[] previous = null;
        while (reader.hasMoreInList()) {
            byte[] keyBytes = reader.readBytes();
            String key = decodeKey(keyBytes);
            byte[] value = reader.readRaw();
            if (previous != null) {
                int cmp = Arrays.compareUnsigned(keyBytes, previous);
                if (cmp == 0) {
                    throw new EnrException(ErrorType.DUPLICATE_KEY, "record contains duplicate key \"" + key + "\"");
                }
                if (cmp < 0) {
                    throw new EnrException(ErrorType.KEYS_NOT_SORTED, "record key/value pairs are not sorted by key");
                }
            }
            pairs.put(key, value);
            previous = keyBytes;
        }
        reader.exitList();
        reader.finish();
        return new NodeRecord(seq, pairs);
    }

    private static String decodeKey(byte[] keyBytes) throws EnrException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(keyBytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EnrException(ErrorType.INVALID_KEY, "record key is not valid UTF-8: 0x" + IpBytes.hex(keyBytes), e);
        }
    }

    private static void checkKey(String key) throws EnrException {
        if (key.isEmpty()) {
            throw new EnrException(ErrorType.INVALID_KEY, "record key is empty");
        }
        try {
            StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(key));
        } catch (CharacterCodingException e) {
            throw new EnrException(ErrorType.INVALID_KEY, "record key is not valid Unicode", e);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NodeRecord)) return false;
        var that = (NodeRecord) obj;
        if (seq != that.seq || !pairs.keySet().equals(that.pairs.keySet())) {
            return false;
        }
        for (var pair : pairs.entrySet()) {
            if (!Arrays.equals(pair.getValue(), that.pairs.get(pair.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(seq);
        for (var pair : pairs.entrySet()) {
            result = 31 * result + pair.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(pair.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "NodeRecord{seq=" + Long.toUnsignedString(seq) + ", entries=" + entries() + "}";
    }

    /**
     * Collects entries for a {@link NodeRecord}. Setting a key that is already present
     * replaces its value. Not thread-safe.
     */
    public static final class Builder {
        private long seq;
        private final TreeMap<String, byte[]> pairs;

        private Builder(long seq, TreeMap<String, byte[]> pairs) {
            this.seq = seq;
            this.pairs = pairs;
        }

        public Builder seq(long seq) {
            this.seq = seq;
            return this;
        }

        /**
         * Encode {@code entry} and store it under its key.
         * @throws KeyException wrapping the failure if the entry does not encode;
         *                      the builder is left unchanged in that case
         */
        public Builder set(Entry entry) throws KeyException {
            Objects.requireNonNull(entry, "Entry cannot be null");
            String key = entry.getEnrKey();
            var writer = new RlpWriter();
            try {
                checkKey(key);
                entry.encode(writer);
            } catch (EnrException e) {
                throw new KeyException(key, e);
            }
            if (pairs.put(key, writer.toByteArray()) != null) {
                log.debug("Replacing value of key '{}'", key);
            }
            return this;
        }

        public Builder remove(String key) {
            pairs.remove(key);
            return this;
        }

        public NodeRecord build() {
            return new NodeRecord(seq, new TreeMap<>(pairs));
        }
    }
}
