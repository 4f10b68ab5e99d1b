package com.ocadapter.service.impl.fallback;

import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.service.impl.dto.DecisionContext;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs stages strictly in order and returns the first produced response; when every stage
 * declines the terminal stage answers.
 */
@Slf4j
public class FallbackChain {

    private final List<DecisionStage> stages;
    private final TerminalStage terminal;

    public FallbackChain(List<DecisionStage> stages, TerminalStage terminal) {
        this.stages = List.copyOf(stages);
        this.terminal = terminal;
    }

    public Mono<UnifiedResponse> run(DecisionContext context) {
        return attempt(0, context);
    }

    private Mono<UnifiedResponse> attempt(int index, DecisionContext context) {
        if (index >= stages.size()) {
            return Mono.fromSupplier(() -> {
                UnifiedResponse response = terminal.respond(context);
                log.info("[FALLBACK] {} produced action={}", terminal.name(), response.action().wireName());
                return response;
            });
        }
        DecisionStage stage = stages.get(index);
        return Mono.defer(() -> stage.attempt(context))
                .defaultIfEmpty(StageOutcome.declined("stage completed without an outcome"))
                .flatMap(outcome -> {
                    if (outcome instanceof StageOutcome.Produced produced) {
                        if (index > 0) {
                            log.info("[FALLBACK] {} produced action={}", stage.name(), produced.response().action().wireName());
                        }
                        return Mono.just(produced.response());
                    }
                    StageOutcome.Declined declined = (StageOutcome.Declined) outcome;
                    if (declined.cause() != null) {
                        log.warn("[FALLBACK] {} failed: {} ({})", stage.name(), declined.reason(), declined.cause().toString());
                    } else {
                        log.debug("[FALLBACK] {} skipped: {}", stage.name(), declined.reason());
                    }
                    return attempt(index + 1, context);
                });
    }
}
