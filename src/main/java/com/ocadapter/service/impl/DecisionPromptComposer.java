package com.ocadapter.service.impl;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.context.ConversationWindows;
import com.ocadapter.model.ToolDefinition;
import com.ocadapter.model.ToolParameter;
import com.ocadapter.service.impl.dto.DecisionContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the prompt texts sent to OpenCode: the main decision prompt and the narrow
 * answer-from-tool-result prompt used by the fallback chain.
 */
@Component
public class DecisionPromptComposer {

    public static final String DECISION_SYSTEM_PROMPT =
            "You are an intelligent assistant. Respond with valid JSON only.";

    private static final String DECISION_POLICY = """
            DECIDE HOW TO RESPOND:
            1. ACTION request (turn on/off, open/close, set, adjust, lock/unlock, 開/關/設定/打開)
               -> TOOL_CALL with the matching tool.
            2. QUERY request (is X on?, what is the status?, 是...嗎?, 狀態)
               - a tool result is available and answers it -> ANSWER with that information
               - otherwise -> TOOL_CALL a Get*/Query*/Context tool to fetch it
            3. CHAT request (greeting, thanks, small talk, general questions) -> CHAT

            PRIORITY RULES:
            - If the last message is a tool result that answers the request, return ANSWER.
              Do NOT call the same tool again right after it ran.
            - If the request needs an action or information you do not have, return TOOL_CALL.
            - Otherwise return CHAT.
            - Never assume device or resource state carried over from earlier turns. Earlier
              results may be stale: when in doubt, query again or invoke the action again.
            - Follow-up requests with pronouns (turn it on, 打開它, 關掉它) refer to the device
              named in the recent conversation.

            Respond with ONE JSON object and nothing else. No markdown, no code fences, no prose.

            Shapes:
            {"action": "tool_call", "tool_name": "<tool name>", "arguments": {...}}
            {"action": "answer", "content": "<answer in the user's language>"}
            {"action": "chat", "content": "<reply in the user's language>"}

            Examples:
            User: "turn on the kitchen light"
            -> {"action": "tool_call", "tool_name": "HassTurnOn", "arguments": {"area": "Kitchen", "domain": ["light"]}}
            [tool result: "Kitchen light turned on"]
            -> {"action": "answer", "content": "The kitchen light is on now."}
            User: "客廳的燈是開著的嗎"
            -> {"action": "tool_call", "tool_name": "GetLiveContext", "arguments": {}}
            User: "thanks!"
            -> {"action": "chat", "content": "You're welcome!"}""";

    private final AdapterProperties properties;

    public DecisionPromptComposer(AdapterProperties properties) {
        this.properties = properties;
    }

    public String decisionPrompt(DecisionContext context) {
        int window = Math.max(1, properties.getDecision().getRecentWindow());
        String recent = ConversationWindows.recentWindow(context.history(), window);

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an intelligent assistant that decides how to respond to user requests.\n\n");
        prompt.append("Available Context:\n").append(context.systemContext()).append('\n');
        if (!recent.isEmpty()) {
            prompt.append("\nRecent Conversation Context:\n").append(recent).append('\n');
        }
        if (context.hasToolResult()) {
            prompt.append("\nTool Result:\n").append(context.toolResultText()).append('\n');
        }
        prompt.append("\nAvailable Tools:\n").append(formatTools(context.tools())).append("\n\n");
        prompt.append("User Request: \"").append(context.userMessage()).append("\"\n\n");
        prompt.append(DECISION_POLICY).append("\n\n");
        prompt.append("Now analyze the conversation and respond with the appropriate JSON.");
        if (context.hasToolResult()) {
            prompt.append("\nNote: a tool result is available. Check whether it answers the user's request.");
        }
        return prompt.toString();
    }

    public String answerPrompt(DecisionContext context) {
        return (context.systemContext() + "\n\n"
                + "User asked: \"" + context.userMessage() + "\"\n\n"
                + "Tool returned this result:\n" + context.toolResultText() + "\n\n"
                + "Write a natural language answer of one or two sentences that answers the user's "
                + "question from the tool result, using exactly the same language as the user's message.\n\n"
                + "Reply with the answer only:").trim();
    }

    /**
     * Numbered, human readable tool catalog. Each parameter renders as
     * {@code - name (required): type<itemType> - description}.
     */
    public String formatTools(List<ToolDefinition> tools) {
        if (tools.isEmpty()) {
            return "(no tools available)";
        }
        List<String> blocks = new ArrayList<>(tools.size());
        for (int i = 0; i < tools.size(); i++) {
            ToolDefinition tool = tools.get(i);
            StringBuilder block = new StringBuilder();
            block.append(i + 1).append(". ").append(tool.name()).append('\n');
            block.append("   Description: ").append(tool.description()).append('\n');
            block.append("   Parameters:");
            if (tool.parameters().isEmpty()) {
                block.append("\n   (no parameters)");
            }
            for (Map.Entry<String, ToolParameter> entry : tool.parameters().entrySet()) {
                ToolParameter parameter = entry.getValue();
                block.append("\n  - ").append(entry.getKey());
                if (parameter.required()) {
                    block.append(" (required)");
                }
                block.append(": ").append(parameter.type());
                if (parameter.itemType() != null) {
                    block.append('<').append(parameter.itemType()).append('>');
                }
                if (parameter.description() != null && !parameter.description().isEmpty()) {
                    block.append(" - ").append(parameter.description());
                }
            }
            blocks.add(block.toString());
        }
        return String.join("\n\n", blocks);
    }
}
