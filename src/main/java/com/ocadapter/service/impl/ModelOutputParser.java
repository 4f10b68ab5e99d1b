package com.ocadapter.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocadapter.exception.MalformedModelOutputException;
import com.ocadapter.model.JsonValue;
import com.ocadapter.model.UnifiedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns free-form model text into a {@link UnifiedResponse}.
 *
 * <p>Markdown fences are stripped, the first balanced JSON object is located by a brace scan
 * that understands string literals, and the object is validated against the three decision
 * shapes. Anything that does not fit raises {@link MalformedModelOutputException}.</p>
 */
@Component
@Slf4j
public class ModelOutputParser {

    // ```json, ```JSON, bare ``` and the line break that follows
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?[ \\t]*\\r?\\n?");

    private final ObjectMapper mapper;

    public ModelOutputParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public UnifiedResponse parse(String raw) {
        String cleaned = stripCodeFences(raw);
        ObjectSpan first = findObject(cleaned, 0)
                .orElseThrow(() -> new MalformedModelOutputException("No JSON object found in model output"));
        if (findObject(cleaned, first.end()).isPresent()) {
            log.warn("Model output contains more than one JSON object; using the first. output={}", abbreviate(cleaned));
        }

        JsonNode root;
        try {
            root = mapper.readTree(cleaned.substring(first.start(), first.end()));
        } catch (JsonProcessingException e) {
            throw new MalformedModelOutputException("Model output is not valid JSON", e);
        }

        JsonNode actionNode = root.path("action");
        UnifiedResponse.Action action = actionNode.isTextual()
                ? UnifiedResponse.Action.fromWire(actionNode.asText()).orElse(null)
                : null;
        if (action == null) {
            throw new MalformedModelOutputException("Invalid response action: " + actionNode);
        }

        return switch (action) {
            case TOOL_CALL -> toToolCall(root);
            case ANSWER -> UnifiedResponse.answer(requireContent(root, action));
            case CHAT -> UnifiedResponse.chat(requireContent(root, action));
        };
    }

    String stripCodeFences(String raw) {
        if (raw == null) {
            return "";
        }
        return CODE_FENCE.matcher(raw.trim()).replaceAll("").trim();
    }

    /**
     * Finds the first balanced {@code {...}} starting at or after {@code from}. Braces inside
     * string literals are ignored.
     */
    Optional<ObjectSpan> findObject(String text, int from) {
        int start = text.indexOf('{', from);
        if (start < 0) {
            return Optional.empty();
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return Optional.of(new ObjectSpan(start, i + 1));
                }
            }
        }
        return Optional.empty();
    }

    private UnifiedResponse toToolCall(JsonNode root) {
        JsonNode name = root.path("tool_name");
        if (!name.isTextual() || name.asText().isBlank()) {
            throw new MalformedModelOutputException("tool_call without tool_name");
        }
        JsonNode arguments = root.get("arguments");
        Map<String, JsonValue> args;
        if (arguments == null || arguments.isNull()) {
            args = Map.of();
        } else if (arguments.isObject()) {
            args = JsonValue.objectOf(arguments);
        } else {
            throw new MalformedModelOutputException("tool_call arguments must be an object");
        }
        return UnifiedResponse.toolCall(name.asText(), args);
    }

    private String requireContent(JsonNode root, UnifiedResponse.Action action) {
        JsonNode content = root.path("content");
        if (!content.isTextual()) {
            throw new MalformedModelOutputException(action.wireName() + " without string content");
        }
        return content.asText();
    }

    private static String abbreviate(String value) {
        return value.length() <= 500 ? value : value.substring(0, 500) + "...";
    }

    record ObjectSpan(int start, int end) {
    }
}
