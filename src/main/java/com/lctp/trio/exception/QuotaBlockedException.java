package com.lctp.trio.exception;

public class QuotaBlockedException extends ContestException {
    public QuotaBlockedException() {
        super();
    }

    public QuotaBlockedException(String message) {
        super(message);
    }

    public QuotaBlockedException(String message, Throwable e) {
        super(message, e);
    }
}
