package com.enr.entry;

import com.enr.rlp.RlpWriter;
import com.enr.util.IpBytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * An entry under a key this library has no type for, kept as its encoded value.
 * Encoding writes the stored bytes back verbatim.
 */
@EqualsAndHashCode
public final class RawEntry implements Entry {
    @Getter
    private final String key;
    private final byte[] encoded;

    /**
     * @param encoded the complete RLP encoding of one value; not validated here
     */
    public RawEntry(String key, byte[] encoded) {
        this.key = Objects.requireNonNull(key, "Key cannot be null");
        this.encoded = Objects.requireNonNull(encoded, "Encoded value cannot be null").clone();
    }

    public byte[] getEncoded() {
        return encoded.clone();
    }

    @Override
    public String getEnrKey() {
        return key;
    }

    @Override
    public void encode(RlpWriter writer) {
        writer.writeRaw(encoded);
    }

    @Override
    public String toString() {
        return key + "=0x" + IpBytes.hex(encoded);
    }
}
