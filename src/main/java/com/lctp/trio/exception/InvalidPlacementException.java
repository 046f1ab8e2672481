package com.lctp.trio.exception;

public class InvalidPlacementException extends ContestException {
    public InvalidPlacementException() {
        super();
    }

    public InvalidPlacementException(String message) {
        super(message);
    }

    public InvalidPlacementException(String message, Throwable e) {
        super(message, e);
    }
}
