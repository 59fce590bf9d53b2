package io.mediaplatform.spi;

/**
 * Unchecked wrapper for storage failures (SQL errors, lost connections).
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
