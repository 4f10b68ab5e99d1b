package com.ocadapter.service.impl.dto;

import com.ocadapter.model.ConversationHistory;
import com.ocadapter.model.ToolDefinition;

import java.util.List;

/**
 * Everything the decision stages read: the request context plus what tail inspection found.
 */
public record DecisionContext(String systemContext,
                              ConversationHistory history,
                              List<ToolDefinition> tools,
                              String userMessage,
                              boolean hasToolResult,
                              String toolResultText) {

    public DecisionContext {
        systemContext = systemContext == null ? "" : systemContext;
        tools = tools == null ? List.of() : List.copyOf(tools);
        userMessage = userMessage == null ? "" : userMessage;
        toolResultText = toolResultText == null ? "" : toolResultText;
    }
}
