package com.enr.rlp;

/**
 * The three shapes an RLP value can take on the wire.
 */
public enum RlpKind {
    /** A single byte below 0x80, encoded as itself. */
    BYTE,
    /** A length-prefixed byte string. */
    STRING,
    /** A length-prefixed concatenation of encoded values. */
    LIST
}
