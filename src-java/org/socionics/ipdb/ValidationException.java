package org.socionics.ipdb;

/**
 * Thrown when input has the wrong shape or range: an empty name, a confidence
 * outside [0, 1], an unknown type code. Raised before any write is attempted.
 */
public class ValidationException extends IpdbException {

    public ValidationException(String message) {
        super(message);
    }
}
