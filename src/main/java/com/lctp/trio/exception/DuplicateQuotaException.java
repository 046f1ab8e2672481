package com.lctp.trio.exception;

public class DuplicateQuotaException extends ContestException {
    public DuplicateQuotaException() {
        super();
    }

    public DuplicateQuotaException(String message) {
        super(message);
    }

    public DuplicateQuotaException(String message, Throwable e) {
        super(message, e);
    }
}
