package com.enr.error;

/**
 * Types of errors that can occur while encoding, decoding or loading record entries.
 */
public enum ErrorType {
    // codec framing
    UNEXPECTED_EOF,
    VALUE_TOO_LARGE,
    ELEMENT_TOO_LARGE,
    END_OF_LIST,
    NOT_AT_END_OF_LIST,
    EXPECTED_STRING,
    EXPECTED_LIST,
    NON_CANONICAL_SIZE,
    NON_CANONICAL_INTEGER,
    UINT_OVERFLOW,
    WRONG_SIZE,
    TRAILING_DATA,

    // entry validation
    INVALID_IP_ADDRESS,
    ADDRESS_FAMILY_MISMATCH,
    INVALID_CLIENT_INFO,

    // record container
    KEY_NOT_FOUND,
    INVALID_KEY,
    KEYS_NOT_SORTED,
    DUPLICATE_KEY,
    RECORD_TOO_LARGE
}
