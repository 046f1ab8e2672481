package com.lctp.trio.exception;

public class DrawException extends ContestException {
    public DrawException() {
        super();
    }

    public DrawException(String message) {
        super(message);
    }

    public DrawException(String message, Throwable e) {
        super(message, e);
    }
}
