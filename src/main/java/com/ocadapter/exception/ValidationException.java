package com.ocadapter.exception;

public class ValidationException extends AdapterException {

    public ValidationException(String message) {
        super(message);
    }
}
