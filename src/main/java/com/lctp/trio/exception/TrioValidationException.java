package com.lctp.trio.exception;

/**
 * Trio composition does not satisfy the category rules.
 */
public class TrioValidationException extends ContestException {
    public TrioValidationException() {
        super();
    }

    public TrioValidationException(String message) {
        super(message);
    }

    public TrioValidationException(String message, Throwable e) {
        super(message, e);
    }
}
