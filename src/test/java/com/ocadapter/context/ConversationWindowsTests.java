package com.ocadapter.context;

import com.ocadapter.model.ConversationHistory;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.JsonValue;
import com.ocadapter.model.Role;
import com.ocadapter.model.ToolInvocation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationWindowsTests {

    @Test
    void lastUserMessageReturnsMostRecentUserTurn() {
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.USER, "Hello"),
                ConversationMessage.of(Role.ASSISTANT, "Hi!"),
                ConversationMessage.of(Role.USER, "How are you?"),
                ConversationMessage.of(Role.TOOL, "ignored")));

        assertThat(ConversationWindows.lastUserMessage(history)).isEqualTo("How are you?");
    }

    @Test
    void lastUserMessageIsEmptyWithoutUserTurns() {
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.ASSISTANT, "Hi!"),
                ConversationMessage.of(Role.TOOL, "done")));

        assertThat(ConversationWindows.lastUserMessage(history)).isEmpty();
        assertThat(ConversationWindows.lastUserMessage(ConversationHistory.empty())).isEmpty();
        assertThat(ConversationWindows.hasUserMessage(history)).isFalse();
    }

    @Test
    void recentWindowIsEmptyForSingleTurnHistories() {
        assertThat(ConversationWindows.recentWindow(ConversationHistory.empty())).isEmpty();
        assertThat(ConversationWindows.recentWindow(
                ConversationHistory.of(List.of(ConversationMessage.of(Role.USER, "turn on the light"))))).isEmpty();
    }

    @Test
    void recentWindowRendersToolCallsInsteadOfEmptyContent() {
        Map<String, JsonValue> args = new LinkedHashMap<>();
        args.put("area", new JsonValue.JsonString("Living Room"));
        args.put("brightness", new JsonValue.JsonNumber(new BigDecimal(80)));
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.USER, "turn on the light"),
                new ConversationMessage(Role.ASSISTANT, "", List.of(new ToolInvocation("HassTurnOn", args))),
                ConversationMessage.of(Role.TOOL, "Light turned on successfully"),
                ConversationMessage.of(Role.ASSISTANT, "")));

        String window = ConversationWindows.recentWindow(history, 10);

        assertThat(window).isEqualTo("User: turn on the light\n"
                + "Assistant: [Executed HassTurnOn({\"area\":\"Living Room\",\"brightness\":80})]");
    }

    @Test
    void recentWindowIncludesToolResultsWhenRequested() {
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.USER, "is the light on?"),
                ConversationMessage.of(Role.TOOL, "light: off")));

        assertThat(ConversationWindows.recentWindow(history, 10, true)).isEqualTo("User: is the light on?\nlight: off");
    }

    @Test
    void recentWindowKeepsOnlyTheLastMessagesWithoutTouchingHistory() {
        List<ConversationMessage> turns = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            turns.add(ConversationMessage.of(i % 2 == 1 ? Role.USER : Role.ASSISTANT, "m" + i));
        }
        ConversationHistory history = ConversationHistory.of(turns);

        String window = ConversationWindows.recentWindow(history, 3);

        assertThat(window).isEqualTo("Assistant: m10\nUser: m11\nAssistant: m12");
        assertThat(history.size()).isEqualTo(12);
    }

    @Test
    void recentWindowIsEmptyWhenNothingRenders() {
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.TOOL, "a"),
                ConversationMessage.of(Role.ASSISTANT, "")));

        assertThat(ConversationWindows.recentWindow(history)).isEmpty();
    }

    @Test
    void countByRoleCountsEachRole() {
        ConversationHistory history = ConversationHistory.of(List.of(
                ConversationMessage.of(Role.USER, "a"),
                ConversationMessage.of(Role.ASSISTANT, "b"),
                ConversationMessage.of(Role.TOOL, "c"),
                ConversationMessage.of(Role.USER, "d")));

        ConversationWindows.RoleCounts counts = ConversationWindows.countByRole(history);

        assertThat(counts).isEqualTo(new ConversationWindows.RoleCounts(2, 1, 1, 4));
    }
}
