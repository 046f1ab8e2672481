package com.lctp.trio.exception;

public class UnknownCategoryTypeException extends ContestException {

    public UnknownCategoryTypeException(String type) {
        super("Unknown category type: " + type);
    }

    public UnknownCategoryTypeException(String type, Throwable e) {
        super("Unknown category type: " + type, e);
    }
}
