package com.enr.entry;

import com.enr.error.EnrException;
import com.enr.rlp.RlpWriter;

/**
 * A typed, named field of a node record.
 * <p>
 * To define a new kind of entry, implement this interface and provide an
 * {@link EntryDecoder} for reading it back. The key name is part of the wire format
 * and must never change for a given type.
 */
public interface Entry {
    /**
     * @return the record key this entry is stored under.
     */
    String getEnrKey();

    /**
     * Write the entry's value, validating it first. Nothing is written when validation fails.
     */
    void encode(RlpWriter writer) throws EnrException;
}
