package com.lctp.trio.exception;

/**
 * Business-level outcome: the competitor has no runs left for the event/category.
 */
public class QuotaExhaustedException extends ContestException {
    public QuotaExhaustedException() {
        super();
    }

    public QuotaExhaustedException(String message) {
        super(message);
    }

    public QuotaExhaustedException(String message, Throwable e) {
        super(message, e);
    }
}
