package com.ocadapter.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocadapter.context.ConversationWindows;
import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.model.ConversationContext;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.Role;
import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.opencode.OpencodeClient;
import com.ocadapter.service.ResponseEngine;
import com.ocadapter.service.impl.dto.DecisionContext;
import com.ocadapter.service.impl.fallback.ApologyResponder;
import com.ocadapter.service.impl.fallback.FallbackChain;
import com.ocadapter.service.impl.fallback.PrimaryDecisionStage;
import com.ocadapter.service.impl.fallback.QueryToolHeuristicStage;
import com.ocadapter.service.impl.fallback.ToolResultAnswerStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Decides between calling a tool, answering from a tool result and chatting.
 *
 * <p>The primary decision comes from a single OpenCode exchange. If it fails in any recoverable
 * way the request degrades through: an answer generated from the trailing tool result, a
 * zero-argument call to the catalog's context tool for information questions, and finally an
 * apology in the user's language.</p>
 */
@Service
@Slf4j
public class UnifiedResponseEngine implements ResponseEngine {

    private final OpencodeClient client;
    private final ObjectMapper mapper;
    private final FallbackChain chain;

    public UnifiedResponseEngine(OpencodeClient client,
                                 ObjectMapper mapper,
                                 PrimaryDecisionStage primaryDecision,
                                 ToolResultAnswerStage toolResultAnswer,
                                 QueryToolHeuristicStage queryToolHeuristic,
                                 ApologyResponder apology) {
        this.client = client;
        this.mapper = mapper;
        this.chain = new FallbackChain(List.of(primaryDecision, toolResultAnswer, queryToolHeuristic), apology);
    }

    @Override
    public Mono<UnifiedResponse> generate(ConversationContext context) {
        return Mono.defer(() -> {
            if (!client.isOpen()) {
                return Mono.error(new BackendUnavailableException("OpenCode client not connected"));
            }
            DecisionContext decision = inspect(context);
            log.debug("Generating response historySize={} hasToolResult={} userMessage='{}'",
                    context.history().size(), decision.hasToolResult(), decision.userMessage());
            return chain.run(decision)
                    .doOnNext(response -> log.debug("Engine decided action={}", response.action().wireName()));
        });
    }

    DecisionContext inspect(ConversationContext context) {
        Optional<ConversationMessage> tail = context.history().last()
                .filter(message -> message.role() == Role.TOOL);
        String toolResultText = tail.map(message -> effectiveToolResult(message.content())).orElse("");
        if (tail.isPresent()) {
            log.debug("Trailing tool result: {}", abbreviate(tail.get().content()));
        }
        return new DecisionContext(
                context.systemContext(),
                context.history(),
                context.tools(),
                ConversationWindows.lastUserMessage(context.history()),
                tail.isPresent(),
                toolResultText);
    }

    /**
     * Uses the {@code result} field of a JSON tool payload when it has a truthy value, otherwise
     * the raw content.
     */
    String effectiveToolResult(String content) {
        try {
            JsonNode root = mapper.readTree(content);
            JsonNode result = root == null ? null : root.get("result");
            if (isTruthy(result)) {
                return result.isTextual() ? result.asText() : result.toString();
            }
        } catch (Exception e) {
            log.trace("Tool result is not JSON, using raw content: {}", e.getMessage());
        }
        return content;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0.0d;
        }
        return true;
    }

    private static String abbreviate(String value) {
        return value.length() <= 500 ? value : value.substring(0, 500);
    }
}
