package com.ocadapter.service.impl.dto;

import java.time.Duration;

/**
 * Per-exchange knobs. Submission and cleanup timeouts are process-wide and live in
 * {@link com.ocadapter.config.AdapterProperties.Session}.
 */
public record ExchangeOptions(String sessionTitle, Duration responseTimeout, Duration pollInterval) {

    public ExchangeOptions withResponseTimeout(Duration timeout) {
        return new ExchangeOptions(sessionTitle, timeout, pollInterval);
    }

    public ExchangeOptions withSessionTitle(String title) {
        return new ExchangeOptions(title, responseTimeout, pollInterval);
    }
}
