package com.ocadapter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The decision produced for one request: call a tool, answer from a tool result, or chat.
 */
public sealed interface UnifiedResponse
        permits UnifiedResponse.ToolCall, UnifiedResponse.Answer, UnifiedResponse.Chat {

    String UNKNOWN_TOOL = "unknown";

    Action action();

    enum Action {
        TOOL_CALL("tool_call"),
        ANSWER("answer"),
        CHAT("chat");

        private final String wireName;

        Action(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<Action> fromWire(String value) {
            if (value == null) {
                return Optional.empty();
            }
            for (Action action : values()) {
                if (action.wireName.equals(value)) {
                    return Optional.of(action);
                }
            }
            return Optional.empty();
        }
    }

    record ToolCall(String toolName, Map<String, JsonValue> arguments) implements UnifiedResponse {
        public ToolCall {
            arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        @Override
        public Action action() {
            return Action.TOOL_CALL;
        }
    }

    record Answer(String content) implements UnifiedResponse {
        public Answer {
            content = content == null ? "" : content;
        }

        @Override
        public Action action() {
            return Action.ANSWER;
        }
    }

    record Chat(String content) implements UnifiedResponse {
        public Chat {
            content = content == null ? "" : content;
        }

        @Override
        public Action action() {
            return Action.CHAT;
        }
    }

    static ToolCall toolCall(String toolName, Map<String, JsonValue> arguments) {
        return new ToolCall(toolName, arguments);
    }

    static Answer answer(String content) {
        return new Answer(content);
    }

    static Chat chat(String content) {
        return new Chat(content);
    }
}
