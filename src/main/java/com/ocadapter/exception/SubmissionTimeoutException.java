package com.ocadapter.exception;

import java.time.Duration;

public class SubmissionTimeoutException extends AdapterException {

    public SubmissionTimeoutException(String sessionId, Duration timeout) {
        super("Prompt submission for session " + sessionId + " timed out after " + timeout.toMillis() + "ms");
    }
}
