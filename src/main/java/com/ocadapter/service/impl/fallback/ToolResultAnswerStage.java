package com.ocadapter.service.impl.fallback;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.service.impl.DecisionPromptComposer;
import com.ocadapter.service.impl.SessionExchange;
import com.ocadapter.service.impl.dto.DecisionContext;
import com.ocadapter.service.impl.dto.ExchangeOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * When the conversation ends in a tool result, asks the model for a short answer derived from
 * that result alone. If that exchange fails or comes back blank, the tool result itself is the
 * answer, so a trailing tool result always ends the chain here.
 */
@Component
@Slf4j
public class ToolResultAnswerStage implements DecisionStage {

    private final SessionExchange exchange;
    private final DecisionPromptComposer composer;
    private final AdapterProperties properties;

    public ToolResultAnswerStage(SessionExchange exchange,
                                 DecisionPromptComposer composer,
                                 AdapterProperties properties) {
        this.exchange = exchange;
        this.composer = composer;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "tool-result-answer";
    }

    @Override
    public Mono<StageOutcome> attempt(DecisionContext context) {
        if (!context.hasToolResult()) {
            return Mono.just(StageOutcome.declined("no tool result in conversation"));
        }
        return Mono.defer(() -> exchange.exchange(composer.answerPrompt(context), context.userMessage(), options()))
                .map(result -> {
                    String answer = result.content().trim();
                    if (answer.isEmpty()) {
                        log.warn("[FALLBACK] {} got an empty answer; returning the tool result", name());
                        return toolResultAnswer(context);
                    }
                    return StageOutcome.produced(UnifiedResponse.answer(answer));
                })
                .onErrorResume(error -> {
                    log.warn("[FALLBACK] {} failed: {}; returning the tool result", name(), error.toString());
                    return Mono.just(toolResultAnswer(context));
                });
    }

    private static StageOutcome toolResultAnswer(DecisionContext context) {
        return StageOutcome.produced(UnifiedResponse.answer(context.toolResultText()));
    }

    private ExchangeOptions options() {
        AdapterProperties.Decision decision = properties.getDecision();
        return exchange.defaultOptions()
                .withSessionTitle(decision.getAnswerSessionTitle())
                .withResponseTimeout(Duration.ofMillis(decision.getAnswerResponseTimeoutMs()));
    }
}
