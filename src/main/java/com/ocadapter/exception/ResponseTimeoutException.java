package com.ocadapter.exception;

import java.time.Duration;

public class ResponseTimeoutException extends AdapterException {

    public ResponseTimeoutException(String sessionId, Duration timeout) {
        super("OpenCode response timeout after " + timeout.toMillis() + "ms (session " + sessionId + ")");
    }
}
