package com.ocadapter.service.impl.fallback;

import com.ocadapter.service.impl.dto.DecisionContext;
import reactor.core.publisher.Mono;

/**
 * One step of the decision chain. Stages report ordinary failures as
 * {@link StageOutcome.Declined}; an error signal is reserved for failures that must reach the
 * caller.
 */
public interface DecisionStage {

    String name();

    Mono<StageOutcome> attempt(DecisionContext context);
}
