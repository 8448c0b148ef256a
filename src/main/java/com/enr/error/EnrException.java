package com.enr.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Checked failure raised while encoding, decoding or loading node record values.
 * <p>
 * Callers branch on {@link #getErrorType()}; messages are for humans and carry the
 * offending value where one is known, e.g. {@code invalid IPv4 address: ?0102}.
 * Errors tied to a particular record key are raised as {@link KeyException}.
 */
@Getter
public class EnrException extends Exception {
    private final ErrorType errorType;

    public EnrException(ErrorType errorType, String message) {
        this(errorType, message, null);
    }

    /**
     * @param cause the lower-level failure, typically another {@code EnrException}
     *              or a JDK exception raised while building a value
     */
    public EnrException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type cannot be null");
    }

    /**
     * Whether this error, or the {@code EnrException} it wraps, is of {@code type}.
     */
    public boolean is(ErrorType type) {
        if (errorType == type) {
            return true;
        }
        var cause = getCause();
        return cause instanceof EnrException && cause != this && ((EnrException) cause).is(type);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorType + "]: " + getMessage();
    }
}
