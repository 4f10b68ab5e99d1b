package com.ocadapter.opencode;

import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.opencode.dto.MessagePart;
import com.ocadapter.opencode.dto.ModelSelector;
import com.ocadapter.opencode.dto.PromptRequest;
import com.ocadapter.opencode.dto.SessionInfo;
import com.ocadapter.opencode.dto.SessionMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpencodeClientTests {

    private static final String BASE_URL = "http://opencode:7272";
    private static final Duration BLOCK = Duration.ofSeconds(2);

    private final List<ClientRequest> requests = new ArrayList<>();
    private Function<ClientRequest, ClientResponse> responder;
    private OpencodeClient client;

    @BeforeEach
    void setUp() {
        responder = request -> ClientResponse.create(HttpStatus.OK).build();
        WebClient webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(responder.apply(request));
                })
                .build();
        client = new OpencodeClient(webClient, BASE_URL);
        client.open();
    }

    @Test
    void createSessionPostsTitleAndReadsId() {
        responder = request -> json("{\"id\":\"ses_123\",\"title\":\"unified-response\",\"time\":{\"created\":1}}");

        SessionInfo session = client.createSession("unified-response").block(BLOCK);

        assertThat(session.getId()).isEqualTo("ses_123");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/session");
    }

    @Test
    void submitPromptPostsToSessionMessages() {
        PromptRequest prompt = PromptRequest.builder()
                .model(new ModelSelector("github-copilot", "gpt-4o"))
                .system("system")
                .parts(List.of(MessagePart.text("hello")))
                .build();

        client.submitPrompt("ses_1", prompt).block(BLOCK);

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/session/ses_1/message");
    }

    @Test
    void listMessagesReadsRolesAndParts() {
        responder = request -> json("[{\"info\":{\"id\":\"m1\",\"role\":\"user\"},\"parts\":[{\"type\":\"text\",\"text\":\"hi\"}]},"
                + "{\"info\":{\"id\":\"m2\",\"role\":\"assistant\",\"cost\":0},"
                + "\"parts\":[{\"type\":\"step-start\"},{\"type\":\"text\",\"text\":\"hello\",\"synthetic\":false}]}]");

        List<SessionMessage> messages = client.listMessages("ses_1").block(BLOCK);

        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).isAssistant()).isTrue();
        assertThat(messages.get(1).getParts()).extracting(MessagePart::getType).containsExactly("step-start", "text");
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.GET);
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/session/ses_1/message");
    }

    @Test
    void listMessagesOfFreshSessionIsEmpty() {
        responder = request -> json("[]");

        assertThat(client.listMessages("ses_1").block(BLOCK)).isEmpty();
    }

    @Test
    void deleteSessionSendsDelete() {
        client.deleteSession("ses_9").block(BLOCK);

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.DELETE);
        assertThat(requests.get(0).url().toString()).isEqualTo(BASE_URL + "/session/ses_9");
    }

    @Test
    void errorStatusSurfacesAsWebClientException() {
        responder = request -> ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build();

        assertThatThrownBy(() -> client.createSession("t").block(BLOCK))
                .isInstanceOf(WebClientResponseException.class);
    }

    @Test
    void closedClientFailsWithoutNetworkCall() {
        client.close();

        assertThat(client.isOpen()).isFalse();
        assertThatThrownBy(() -> client.createSession("t").block(BLOCK))
                .isInstanceOf(BackendUnavailableException.class);
        assertThatThrownBy(() -> client.deleteSession("ses_1").block(BLOCK))
                .isInstanceOf(BackendUnavailableException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void openAndCloseAreIdempotent() {
        client.open();
        assertThat(client.isOpen()).isTrue();
        client.close();
        client.close();
        assertThat(client.isOpen()).isFalse();
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
