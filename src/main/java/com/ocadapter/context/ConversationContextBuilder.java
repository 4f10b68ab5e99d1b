package com.ocadapter.context;

import com.ocadapter.model.ConversationContext;
import com.ocadapter.model.ConversationHistory;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.Role;
import com.ocadapter.model.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the raw turns of a request into the system context and the conversation history.
 *
 * <p>Every non-system turn is kept verbatim and in order, including assistant tool calls and
 * tool results, so later windowing sees the full conversation.</p>
 */
@Component
@Slf4j
public class ConversationContextBuilder {

    public ConversationContext build(@Nullable List<ConversationMessage> messages,
                                     @Nullable List<ToolDefinition> tools) {
        StringBuilder systemContext = new StringBuilder();
        List<ConversationMessage> turns = new ArrayList<>();
        if (messages != null) {
            for (ConversationMessage message : messages) {
                if (message.role() == Role.SYSTEM) {
                    systemContext.append(message.content()).append('\n');
                } else {
                    turns.add(message);
                }
            }
        }
        List<ToolDefinition> catalog = tools == null ? List.of() : tools;
        log.debug("Built conversation context systemContextLength={} turns={} tools={}",
                systemContext.length(), turns.size(), catalog.size());
        return new ConversationContext(systemContext.toString().trim(), ConversationHistory.of(turns), catalog);
    }
}
