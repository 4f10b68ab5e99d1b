package com.ocadapter.service.impl.fallback;

import com.ocadapter.model.UnifiedResponse;
import org.springframework.lang.Nullable;

/**
 * Result of one decision stage: either it produced a response, or it declined and the next
 * stage runs.
 */
public sealed interface StageOutcome permits StageOutcome.Produced, StageOutcome.Declined {

    record Produced(UnifiedResponse response) implements StageOutcome {
    }

    /**
     * @param cause the failure behind the decline, {@code null} when the stage simply did not apply
     */
    record Declined(String reason, @Nullable Throwable cause) implements StageOutcome {
    }

    static StageOutcome produced(UnifiedResponse response) {
        return new Produced(response);
    }

    static StageOutcome declined(String reason) {
        return new Declined(reason, null);
    }

    static StageOutcome failed(String reason, Throwable cause) {
        return new Declined(reason, cause);
    }
}
