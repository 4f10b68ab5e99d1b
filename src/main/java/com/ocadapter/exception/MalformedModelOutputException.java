package com.ocadapter.exception;

public class MalformedModelOutputException extends AdapterException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
