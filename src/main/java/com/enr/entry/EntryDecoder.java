package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.rlp.RlpReader;

/**
 * Reads one kind of {@link Entry} from the encoded value stored under its key.
 */
public interface EntryDecoder<T extends Entry> {
    /**
     * @return the record key whose value this decoder reads.
     */
    String getEnrKey();

    /**
     * Decode and validate a value. Returns a new entry and never modifies caller state.
     */
    T decode(RlpReader reader) throws EnrException;
}
