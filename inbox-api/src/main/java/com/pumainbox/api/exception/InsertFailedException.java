package com.pumainbox.api.exception;

/**
 * Raised when the database rejects an inbox insert. The message carries the
 * driver's own message so it can be returned to the caller.
 */
public class InsertFailedException extends RuntimeException {

    public InsertFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
