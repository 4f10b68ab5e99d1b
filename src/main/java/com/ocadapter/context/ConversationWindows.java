package com.ocadapter.context;

import com.ocadapter.model.ConversationHistory;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.Role;
import com.ocadapter.model.ToolInvocation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bounded, read-only views over a {@link ConversationHistory} used when composing prompts.
 */
public final class ConversationWindows {

    public static final int DEFAULT_WINDOW = 10;

    private ConversationWindows() {
    }

    /**
     * Content of the most recent user turn, or an empty string when there is none.
     */
    public static String lastUserMessage(ConversationHistory history) {
        List<ConversationMessage> messages = history.messages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == Role.USER) {
                return message.content();
            }
        }
        return "";
    }

    public static boolean hasUserMessage(ConversationHistory history) {
        return history.messages().stream().anyMatch(message -> message.role() == Role.USER);
    }

    public static String recentWindow(ConversationHistory history) {
        return recentWindow(history, DEFAULT_WINDOW, false);
    }

    public static String recentWindow(ConversationHistory history, int maxMessages) {
        return recentWindow(history, maxMessages, false);
    }

    /**
     * Renders the last {@code maxMessages} turns one per line. Single-turn histories render as an
     * empty string.
     */
    public static String recentWindow(ConversationHistory history, int maxMessages, boolean includeToolResults) {
        if (history.size() <= 1) {
            return "";
        }
        return history.tail(maxMessages).stream()
                .map(message -> renderLine(message, includeToolResults))
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    public static RoleCounts countByRole(ConversationHistory history) {
        int user = 0;
        int assistant = 0;
        int tool = 0;
        for (ConversationMessage message : history.messages()) {
            switch (message.role()) {
                case USER -> user++;
                case ASSISTANT -> assistant++;
                case TOOL -> tool++;
                default -> {
                }
            }
        }
        return new RoleCounts(user, assistant, tool, history.size());
    }

    private static String renderLine(ConversationMessage message, boolean includeToolResults) {
        return switch (message.role()) {
            case USER -> "User: " + message.content();
            case ASSISTANT -> renderAssistant(message);
            case TOOL -> includeToolResults ? message.content() : "";
            case SYSTEM -> "";
        };
    }

    private static String renderAssistant(ConversationMessage message) {
        if (message.hasToolCalls()) {
            ToolInvocation call = message.toolCalls().get(0);
            return "Assistant: [Executed " + call.name() + "(" + call.argumentsAsJson() + ")]";
        }
        return message.content().isEmpty() ? "" : "Assistant: " + message.content();
    }

    public record RoleCounts(int user, int assistant, int tool, int total) {
    }
}
