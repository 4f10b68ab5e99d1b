package com.ocadapter.service.impl;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.context.ConversationContextBuilder;
import com.ocadapter.context.ConversationWindows;
import com.ocadapter.exception.ValidationException;
import com.ocadapter.model.ConversationContext;
import com.ocadapter.ollama.OllamaWireAdapter;
import com.ocadapter.ollama.dto.OllamaChatRequest;
import com.ocadapter.ollama.dto.OllamaChatResponse;
import com.ocadapter.service.ChatService;
import com.ocadapter.service.ResponseEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;

@Service
@Slf4j
public class ChatServiceImpl implements ChatService {

    private final ConversationContextBuilder contextBuilder;
    private final ResponseEngine engine;
    private final ToolCallValidator toolCallValidator;
    private final OllamaWireAdapter wireAdapter;
    private final AdapterProperties properties;
    private final Clock clock;

    public ChatServiceImpl(ConversationContextBuilder contextBuilder,
                           ResponseEngine engine,
                           ToolCallValidator toolCallValidator,
                           OllamaWireAdapter wireAdapter,
                           AdapterProperties properties,
                           Clock clock) {
        this.contextBuilder = contextBuilder;
        this.engine = engine;
        this.toolCallValidator = toolCallValidator;
        this.wireAdapter = wireAdapter;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Mono<OllamaChatResponse> chat(OllamaChatRequest request) {
        return Mono.defer(() -> {
            long startMillis = clock.millis();
            if (request == null || request.getMessages() == null || request.getMessages().isEmpty()) {
                return Mono.error(new ValidationException("messages field is required and must not be empty"));
            }
            ConversationContext context = contextBuilder.build(
                    wireAdapter.toConversationMessages(request.getMessages()),
                    wireAdapter.toToolDefinitions(request.getTools()));
            if (!ConversationWindows.hasUserMessage(context.history())) {
                return Mono.error(new ValidationException("At least one user message is required"));
            }

            String model = resolveModel(request);
            ConversationWindows.RoleCounts counts = ConversationWindows.countByRole(context.history());
            log.info("Chat request model={} messages={} (user={} assistant={} tool={}) tools={} systemContextLength={}",
                    model, counts.total(), counts.user(), counts.assistant(), counts.tool(),
                    context.tools().size(), context.systemContext().length());

            return engine.generate(context)
                    .map(response -> toolCallValidator.validate(response, context.tools()))
                    .map(response -> wireAdapter.toChatResponse(response, model, clock.millis() - startMillis))
                    .doOnNext(response -> log.info("Chat response model={} toolCalls={} elapsedMs={}",
                            model,
                            response.getMessage().getToolCalls() == null ? 0 : response.getMessage().getToolCalls().size(),
                            response.getTotalDuration() / 1_000_000L));
        });
    }

    private String resolveModel(OllamaChatRequest request) {
        return StringUtils.hasText(request.getModel()) ? request.getModel() : properties.getModel().getId();
    }
}
