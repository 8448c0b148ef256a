package com.enr.entry;

import com.enr.Constants;
import com.enr.error.EnrException;
import com.enr.rlp.RlpReader;
import com.enr.rlp.RlpWriter;
import lombok.Value;

import java.util.Objects;

/**
 * The "id" key: name of the identity scheme the record is signed with.
 * The name is not checked here; interpreting it is up to the scheme implementation.
 */
@Value
public class IdEntry implements Entry {
    public static final String KEY = "id";

    /** The default identity scheme. */
    public static final IdEntry V4 = new IdEntry(Constants.ID_V4);

    public static final EntryDecoder<IdEntry> DECODER = new EntryDecoder<>() {
        @Override
        public String getEnrKey() {
            return KEY;
        }

        @Override
        public IdEntry decode(RlpReader reader) throws EnrException {
            return new IdEntry(reader.readString());
        }
    };

    String scheme;

    public IdEntry(String scheme) {
        this.scheme = Objects.requireNonNull(scheme, "Scheme cannot be null");
    }

    @Override
    public String getEnrKey() {
        return KEY;
    }

    @Override
    public void encode(RlpWriter writer) {
        writer.writeString(scheme);
    }

    @Override
    public String toString() {
        return KEY + "=" + scheme;
    }
}
