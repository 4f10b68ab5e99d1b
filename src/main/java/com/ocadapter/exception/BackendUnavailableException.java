package com.ocadapter.exception;

/**
 * The OpenCode client has not been opened (or was already closed).
 */
public class BackendUnavailableException extends AdapterException {

    public BackendUnavailableException(String message) {
        super(message);
    }
}
