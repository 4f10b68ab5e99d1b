package com.ocadapter.model;

import java.util.List;

/**
 * Per-request input to the response engine.
 */
public record ConversationContext(String systemContext, ConversationHistory history, List<ToolDefinition> tools) {

    public ConversationContext {
        systemContext = systemContext == null ? "" : systemContext;
        history = history == null ? ConversationHistory.empty() : history;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
