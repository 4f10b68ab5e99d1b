package com.ocadapter.exception;

/**
 * OpenCode could not allocate a session, so the exchange never started.
 */
public class SessionCreateException extends AdapterException {

    public SessionCreateException(String message) {
        super(message);
    }

    public SessionCreateException(String message, Throwable cause) {
        super(message, cause);
    }
}
