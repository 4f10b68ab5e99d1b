package com.ocadapter.exception;

/**
 * Base type for failures raised while turning a chat request into a decision.
 */
public class AdapterException extends RuntimeException {

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
