package com.ocadapter.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ocadapter.OpencodeFixtures;
import com.ocadapter.config.AdapterProperties;
import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.exception.SessionCreateException;
import com.ocadapter.model.ConversationContext;
import com.ocadapter.model.ConversationHistory;
import com.ocadapter.model.ConversationMessage;
import com.ocadapter.model.JsonValue;
import com.ocadapter.model.Role;
import com.ocadapter.model.ToolDefinition;
import com.ocadapter.model.ToolInvocation;
import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.opencode.OpencodeClient;
import com.ocadapter.service.impl.dto.DecisionContext;
import com.ocadapter.service.impl.fallback.ApologyResponder;
import com.ocadapter.service.impl.fallback.PrimaryDecisionStage;
import com.ocadapter.service.impl.fallback.QueryToolHeuristicStage;
import com.ocadapter.service.impl.fallback.ToolResultAnswerStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.ocadapter.OpencodeFixtures.SESSION_ID;
import static com.ocadapter.OpencodeFixtures.assistantReply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UnifiedResponseEngineTests {

    private static final Duration BLOCK = Duration.ofSeconds(5);

    private static final List<ToolDefinition> HOME_TOOLS = List.of(
            new ToolDefinition("HassTurnOn", "Turns on a device", Map.of()),
            new ToolDefinition("GetLiveContext", "Current device states", Map.of()));

    private OpencodeClient client;
    private UnifiedResponseEngine engine;

    @BeforeEach
    void setUp() {
        AdapterProperties properties = OpencodeFixtures.fastProperties();
        ObjectMapper mapper = new ObjectMapper();
        client = OpencodeFixtures.openClient();
        SessionExchange exchange = new SessionExchange(client, properties);
        DecisionPromptComposer composer = new DecisionPromptComposer(properties);
        engine = new UnifiedResponseEngine(
                client,
                mapper,
                new PrimaryDecisionStage(exchange, composer, new ModelOutputParser(mapper), properties),
                new ToolResultAnswerStage(exchange, composer, properties),
                new QueryToolHeuristicStage(),
                new ApologyResponder());
    }

    @Test
    void modelToolDecisionIsReturned() {
        when(client.listMessages(SESSION_ID)).thenReturn(Mono.just(assistantReply(
                "{\"action\":\"tool_call\",\"tool_name\":\"HassTurnOn\",\"arguments\":{\"entity\":\"light.living_room\"}}")));

        UnifiedResponse response = engine.generate(context(HOME_TOOLS, user("turn on the light"))).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.toolCall("HassTurnOn",
                Map.of("entity", new JsonValue.JsonString("light.living_room"))));
        verify(client, times(1)).createSession(anyString());
        verify(client, times(1)).deleteSession(SESSION_ID);
    }

    @Test
    void modelAnswerAfterToolResultIsReturned() {
        when(client.listMessages(SESSION_ID)).thenReturn(Mono.just(assistantReply(
                "```json\n{\"action\":\"answer\",\"content\":\"The living room light is now on.\"}\n```")));

        UnifiedResponse response = engine.generate(afterToolResult("Light turned on successfully")).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.answer("The living room light is now on."));
    }

    @Test
    void failedDecisionWithToolResultFallsBackToGeneratedAnswer() {
        when(client.submitPrompt(anyString(), any())).thenReturn(
                Mono.error(new IllegalStateException("backend hiccup")),
                Mono.empty());
        when(client.listMessages(SESSION_ID)).thenReturn(Mono.just(assistantReply("  The light is on.  ")));

        UnifiedResponse response = engine.generate(afterToolResult("Light turned on successfully")).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.answer("The light is on."));
        verify(client, times(2)).createSession(anyString());
        verify(client, times(2)).deleteSession(SESSION_ID);
    }

    @Test
    void malformedDecisionWithToolResultFallsBackToGeneratedAnswer() {
        when(client.listMessages(SESSION_ID)).thenReturn(
                Mono.just(assistantReply("I think the light is on")),
                Mono.just(assistantReply("The light is on.")));

        UnifiedResponse response = engine.generate(afterToolResult("{\"result\":\"on\"}")).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.answer("The light is on."));
    }

    @Test
    void toolResultIsTheAnswerWhenEveryBackendCallFails() {
        when(client.submitPrompt(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("down")));

        UnifiedResponse action = engine.generate(afterToolResult("Light turned on successfully")).block(BLOCK);
        UnifiedResponse query = engine.generate(context(HOME_TOOLS,
                user("Is the light on?"),
                new ConversationMessage(Role.ASSISTANT, "", List.of(new ToolInvocation("GetLiveContext", Map.of()))),
                ConversationMessage.of(Role.TOOL, "Light turned on successfully"))).block(BLOCK);

        assertThat(action).isEqualTo(UnifiedResponse.answer("Light turned on successfully"));
        assertThat(query).isEqualTo(UnifiedResponse.answer("Light turned on successfully"));
    }

    @Test
    void blankGeneratedAnswerFallsBackToToolResultField() {
        when(client.listMessages(SESSION_ID)).thenReturn(
                Mono.just(assistantReply("not a decision")),
                Mono.just(assistantReply("   ")));

        UnifiedResponse response = engine.generate(afterToolResult("{\"result\":\"light: on\"}")).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.answer("light: on"));
    }

    @Test
    void failedDecisionOnQueryCallsContextTool() {
        when(client.submitPrompt(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("down")));

        UnifiedResponse response = engine.generate(context(HOME_TOOLS, user("Is the light on?"))).block(BLOCK);

        assertThat(response).isEqualTo(UnifiedResponse.toolCall("GetLiveContext", Map.of()));
    }

    @Test
    void totalFailureApologisesInUserLanguage() {
        when(client.submitPrompt(anyString(), any())).thenReturn(Mono.error(new IllegalStateException("down")));

        assertThat(engine.generate(context(HOME_TOOLS, user("hello"))).block(BLOCK))
                .isEqualTo(UnifiedResponse.chat("I'm unable to process this request right now. Please try again later."));
        assertThat(engine.generate(context(HOME_TOOLS, user("打開客廳的燈"))).block(BLOCK))
                .isEqualTo(UnifiedResponse.chat("我現在無法處理這個請求，請稍後再試。"));
        assertThat(engine.generate(context(HOME_TOOLS, user("電気をつけてください"))).block(BLOCK))
                .isEqualTo(UnifiedResponse.chat("申し訳ございませんが、現在このリクエストを処理できません。"));
    }

    @Test
    void responseTimeoutDegradesInsteadOfFailing() {
        when(client.listMessages(SESSION_ID)).thenReturn(Mono.just(List.of()));

        UnifiedResponse response = engine.generate(context(HOME_TOOLS, user("hello"))).block(BLOCK);

        assertThat(response).isInstanceOf(UnifiedResponse.Chat.class);
    }

    @Test
    void closedClientFailsBeforeAnySessionIsCreated() {
        when(client.isOpen()).thenReturn(false);

        assertThatThrownBy(() -> engine.generate(context(HOME_TOOLS, user("hello"))).block(BLOCK))
                .isInstanceOf(BackendUnavailableException.class);
        verify(client, never()).createSession(anyString());
    }

    @Test
    void sessionCreateFailureOfDecisionPropagates() {
        when(client.createSession(anyString())).thenReturn(Mono.error(new IllegalStateException("refused")));

        assertThatThrownBy(() -> engine.generate(context(HOME_TOOLS, user("hello"))).block(BLOCK))
                .isInstanceOf(SessionCreateException.class);
    }

    @Test
    void inspectDetectsTrailingToolResultAndLastUserMessage() {
        DecisionContext decision = engine.inspect(afterToolResult("{\"result\":\"Light turned on\"}"));

        assertThat(decision.hasToolResult()).isTrue();
        assertThat(decision.toolResultText()).isEqualTo("Light turned on");
        assertThat(decision.userMessage()).isEqualTo("turn on the light");
    }

    @Test
    void inspectIgnoresToolResultThatIsNotLast() {
        ConversationContext context = context(HOME_TOOLS,
                user("turn on the light"),
                ConversationMessage.of(Role.TOOL, "done"),
                user("thanks"));

        DecisionContext decision = engine.inspect(context);

        assertThat(decision.hasToolResult()).isFalse();
        assertThat(decision.toolResultText()).isEmpty();
        assertThat(decision.userMessage()).isEqualTo("thanks");
    }

    @Test
    void effectiveToolResultFallsBackToRawContent() {
        assertThat(engine.effectiveToolResult("plain text")).isEqualTo("plain text");
        assertThat(engine.effectiveToolResult("{\"result\":\"\"}")).isEqualTo("{\"result\":\"\"}");
        assertThat(engine.effectiveToolResult("{\"result\":false}")).isEqualTo("{\"result\":false}");
        assertThat(engine.effectiveToolResult("{\"result\":{\"state\":\"on\"}}")).isEqualTo("{\"state\":\"on\"}");
    }

    private static ConversationContext afterToolResult(String toolContent) {
        return context(HOME_TOOLS,
                user("turn on the light"),
                new ConversationMessage(Role.ASSISTANT, "", List.of(new ToolInvocation("HassTurnOn",
                        Map.of("entity", new JsonValue.JsonString("light.living_room"))))),
                ConversationMessage.of(Role.TOOL, toolContent));
    }

    private static ConversationMessage user(String content) {
        return ConversationMessage.of(Role.USER, content);
    }

    private static ConversationContext context(List<ToolDefinition> tools, ConversationMessage... messages) {
        return new ConversationContext("You control a smart home.", ConversationHistory.of(List.of(messages)), tools);
    }
}
