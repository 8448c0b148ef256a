package com.enr.error;

import lombok.Getter;

import java.util.Objects;

/**
 * An error tied to a single record key.
 * <p>
 * The cause is either the not-found marker, meaning the key is absent from the record,
 * or the failure that occurred while encoding or decoding the key's value. Use
 * {@link #isNotFound(Throwable)} to tell the two apart.
 */
@Getter
public class KeyException extends EnrException {
    private final String key;

    public KeyException(String key, EnrException cause) {
        super(Objects.requireNonNull(cause, "Cause cannot be null").getErrorType(),
                formatMessage(key, cause), cause);
        this.key = Objects.requireNonNull(key, "Key cannot be null");
    }

    /**
     * Creates the error reported when {@code key} has no value in a record.
     */
    public static KeyException notFound(String key) {
        return new KeyException(key, new NotFound());
    }

    @Override
    public synchronized EnrException getCause() {
        return (EnrException) super.getCause();
    }

    /**
     * Reports whether this error means the key is missing from the record.
     */
    public boolean isNotFound() {
        return getCause() instanceof NotFound;
    }

    /**
     * Reports whether {@code error}, or any error in its cause chain, is a {@link KeyException}
     * signalling a missing key.
     */
    public static boolean isNotFound(Throwable error) {
        for (var current = error; current != null; current = current.getCause()) {
            if (current instanceof KeyException) {
                return ((KeyException) current).isNotFound();
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String formatMessage(String key, EnrException cause) {
        if (cause instanceof NotFound) {
            return String.format("missing ENR key \"%s\"", key);
        }
        return String.format("ENR key \"%s\": %s", key, cause.getMessage());
    }

    // marker cause, created only by notFound
    private static final class NotFound extends EnrException {
        private NotFound() {
            super(ErrorType.KEY_NOT_FOUND, "not found");
        }
    }
}
