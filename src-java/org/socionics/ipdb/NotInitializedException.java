package org.socionics.ipdb;

/**
 * Thrown when an operation is attempted before {@link PersonalityStore#initialize()}
 * completed, or after the store was closed.
 */
public class NotInitializedException extends IpdbException {

    public NotInitializedException(String message) {
        super(message);
    }
}
