package com.lctp.trio.exception;

/**
 * Stored data cannot produce a coherent batch, the whole batch is rolled back.
 */
public class ConsistencyException extends ContestException {
    public ConsistencyException() {
        super();
    }

    public ConsistencyException(String message) {
        super(message);
    }

    public ConsistencyException(String message, Throwable e) {
        super(message, e);
    }
}
