package com.ocadapter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable turns of one request, system messages excluded.
 *
 * <p>The history is never truncated; {@link #tail(int)} returns a bounded view without touching
 * the underlying turns.</p>
 */
public final class ConversationHistory {

    private static final ConversationHistory EMPTY = new ConversationHistory(List.of());

    private final List<ConversationMessage> messages;

    private ConversationHistory(List<ConversationMessage> messages) {
        this.messages = messages;
    }

    public static ConversationHistory of(List<ConversationMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return EMPTY;
        }
        return new ConversationHistory(Collections.unmodifiableList(new ArrayList<>(messages)));
    }

    public static ConversationHistory empty() {
        return EMPTY;
    }

    public List<ConversationMessage> messages() {
        return messages;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public Optional<ConversationMessage> last() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public List<ConversationMessage> tail(int maxMessages) {
        if (maxMessages <= 0) {
            return List.of();
        }
        int from = Math.max(0, messages.size() - maxMessages);
        return messages.subList(from, messages.size());
    }

    @Override
    public String toString() {
        return "ConversationHistory[size=" + messages.size() + "]";
    }
}
