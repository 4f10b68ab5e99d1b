package com.ocadapter.service.impl.fallback;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.exception.SessionCreateException;
import com.ocadapter.service.impl.DecisionPromptComposer;
import com.ocadapter.service.impl.ModelOutputParser;
import com.ocadapter.service.impl.SessionExchange;
import com.ocadapter.service.impl.dto.DecisionContext;
import com.ocadapter.service.impl.dto.ExchangeOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Asks the model for a decision in one exchange and parses its reply.
 *
 * <p>Timeouts, malformed output and backend errors decline so the chain can degrade. A session
 * that cannot be created, or a client that is not connected, is propagated.</p>
 */
@Component
@Slf4j
public class PrimaryDecisionStage implements DecisionStage {

    private final SessionExchange exchange;
    private final DecisionPromptComposer composer;
    private final ModelOutputParser parser;
    private final AdapterProperties properties;

    public PrimaryDecisionStage(SessionExchange exchange,
                                DecisionPromptComposer composer,
                                ModelOutputParser parser,
                                AdapterProperties properties) {
        this.exchange = exchange;
        this.composer = composer;
        this.parser = parser;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "primary-decision";
    }

    @Override
    public Mono<StageOutcome> attempt(DecisionContext context) {
        return Mono.defer(() -> {
            String prompt = composer.decisionPrompt(context);
            log.debug("Decision prompt built length={} hasToolResult={} tools={}",
                    prompt.length(), context.hasToolResult(), context.tools().size());
            if (log.isTraceEnabled()) {
                log.trace("Decision prompt:\n{}", prompt);
            }
            return exchange.exchange(DecisionPromptComposer.DECISION_SYSTEM_PROMPT, prompt, options())
                    .map(result -> {
                        log.debug("Raw model decision elapsedMs={} content={}", result.elapsedMs(), result.content());
                        return StageOutcome.produced(parser.parse(result.content()));
                    });
        }).onErrorResume(this::isRecoverable, error -> Mono.just(StageOutcome.failed("decision exchange failed", error)));
    }

    private boolean isRecoverable(Throwable error) {
        return !(error instanceof SessionCreateException) && !(error instanceof BackendUnavailableException);
    }

    private ExchangeOptions options() {
        AdapterProperties.Decision decision = properties.getDecision();
        return exchange.defaultOptions()
                .withSessionTitle(decision.getSessionTitle())
                .withResponseTimeout(Duration.ofMillis(decision.getResponseTimeoutMs()));
    }
}
