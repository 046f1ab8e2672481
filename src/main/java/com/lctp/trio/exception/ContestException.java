package com.lctp.trio.exception;

public class ContestException extends RuntimeException {
    public ContestException() {
        super();
    }

    public ContestException(String message) {
        super(message);
    }

    public ContestException(String message, Throwable e) {
        super(message, e);
    }
}
