package com.ocadapter.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocadapter.exception.ValidationException;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.JsonValue;
import com.ocadapter.model.Role;
import com.ocadapter.model.ToolDefinition;
import com.ocadapter.model.ToolInvocation;
import com.ocadapter.model.ToolParameter;
import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.ollama.dto.OllamaChatResponse;
import com.ocadapter.ollama.dto.OllamaMessage;
import com.ocadapter.ollama.dto.OllamaTool;
import com.ocadapter.ollama.dto.OllamaToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless mapping between the Ollama wire format and the adapter's internal types.
 */
@Component
@Slf4j
public class OllamaWireAdapter {

    static final String ROLE_ASSISTANT = "assistant";
    static final String DONE_REASON = "stop";
    static final long NANOS_PER_MILLI = 1_000_000L;

    private final ObjectMapper mapper;
    private final Clock clock;

    public OllamaWireAdapter(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public List<ConversationMessage> toConversationMessages(@Nullable List<OllamaMessage> messages) {
        if (messages == null) {
            return List.of();
        }
        List<ConversationMessage> converted = new ArrayList<>(messages.size());
        for (OllamaMessage message : messages) {
            if (message == null) {
                continue;
            }
            Role role = Role.fromWire(message.getRole())
                    .orElseThrow(() -> new ValidationException("Unsupported message role: " + message.getRole()));
            converted.add(new ConversationMessage(role, message.getContent(), toInvocations(message.getToolCalls())));
        }
        return converted;
    }

    public List<ToolDefinition> toToolDefinitions(@Nullable List<OllamaTool> tools) {
        if (tools == null) {
            return List.of();
        }
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (OllamaTool tool : tools) {
            if (tool == null || tool.getFunction() == null) {
                continue;
            }
            OllamaTool.Function function = tool.getFunction();
            definitions.add(new ToolDefinition(function.getName(), function.getDescription(),
                    toParameters(function.getParameters())));
        }
        return definitions;
    }

    public OllamaChatResponse toChatResponse(UnifiedResponse response, String model, long elapsedMs) {
        long durationNanos = elapsedMs * NANOS_PER_MILLI;
        return OllamaChatResponse.builder()
                .model(model)
                .createdAt(clock.instant().toString())
                .message(toAssistantMessage(response))
                .done(true)
                .doneReason(DONE_REASON)
                .totalDuration(durationNanos)
                .evalCount(1)
                .evalDuration(durationNanos)
                .build();
    }

    public OllamaChatResponse toErrorResponse(String errorMessage, String model) {
        return OllamaChatResponse.builder()
                .model(model)
                .createdAt(clock.instant().toString())
                .message(OllamaMessage.builder()
                        .role(ROLE_ASSISTANT)
                        .content("Error: " + errorMessage)
                        .build())
                .done(true)
                .doneReason(DONE_REASON)
                .totalDuration(0L)
                .build();
    }

    OllamaMessage toAssistantMessage(UnifiedResponse response) {
        if (response instanceof UnifiedResponse.ToolCall toolCall) {
            OllamaToolCall call = OllamaToolCall.builder()
                    .function(OllamaToolCall.Function.builder()
                            .name(toolCall.toolName())
                            .arguments(JsonValue.toObjectNode(toolCall.arguments()))
                            .build())
                    .build();
            return OllamaMessage.builder()
                    .role(ROLE_ASSISTANT)
                    .content("")
                    .toolCalls(List.of(call))
                    .build();
        }
        String content = response instanceof UnifiedResponse.Answer answer
                ? answer.content()
                : ((UnifiedResponse.Chat) response).content();
        return OllamaMessage.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .build();
    }

    private List<ToolInvocation> toInvocations(@Nullable List<OllamaToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        List<ToolInvocation> invocations = new ArrayList<>(toolCalls.size());
        for (OllamaToolCall call : toolCalls) {
            if (call == null || call.getFunction() == null) {
                continue;
            }
            invocations.add(new ToolInvocation(call.getFunction().getName(),
                    toArguments(call.getFunction().getArguments())));
        }
        return invocations;
    }

    /**
     * Arguments may arrive as an object or, from OpenAI-style clients, as a JSON string. Both end
     * up as a structured mapping; anything else becomes an empty mapping.
     */
    Map<String, JsonValue> toArguments(@Nullable JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (arguments.isObject()) {
            return JsonValue.objectOf(arguments);
        }
        if (arguments.isTextual()) {
            try {
                return JsonValue.objectOf(mapper.readTree(arguments.asText()));
            } catch (Exception e) {
                log.warn("Ignoring tool call arguments that are not a JSON object: {}", e.getMessage());
            }
        }
        return Map.of();
    }

    private Map<String, ToolParameter> toParameters(@Nullable OllamaTool.Parameters parameters) {
        Map<String, ToolParameter> result = new LinkedHashMap<>();
        if (parameters == null || parameters.getProperties() == null) {
            return result;
        }
        List<String> required = parameters.getRequired() == null ? List.of() : parameters.getRequired();
        parameters.getProperties().forEach((name, schema) -> {
            String type = textOrNull(schema, "type");
            String description = textOrNull(schema, "description");
            String itemType = schema == null ? null : textOrNull(schema.path("items"), "type");
            result.put(name, new ToolParameter(type, required.contains(name), description, itemType));
        });
        return result;
    }

    private static @Nullable String textOrNull(@Nullable JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isEmpty() ? value.asText() : null;
    }
}
