package org.socionics.ipdb;

/**
 * Base exception for personality store operations.
 *
 * <p>All store exceptions extend this class, making it easy to catch every
 * store-related error in one place. Checked JDBC and IO exceptions are wrapped
 * in {@link StorageException} and never leak from the public API.</p>
 */
public class IpdbException extends RuntimeException {

    /**
     * Create a new exception with a message.
     *
     * @param message error message
     */
    public IpdbException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a message and cause.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public IpdbException(String message, Throwable cause) {
        super(message, cause);
    }
}
