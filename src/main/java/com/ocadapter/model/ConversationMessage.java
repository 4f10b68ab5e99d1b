package com.ocadapter.model;

import java.util.List;

public record ConversationMessage(Role role, String content, List<ToolInvocation> toolCalls) {

    public ConversationMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ConversationMessage of(Role role, String content) {
        return new ConversationMessage(role, content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
