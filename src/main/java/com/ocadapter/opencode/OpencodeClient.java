package com.ocadapter.opencode;

import com.ocadapter.exception.BackendUnavailableException;
import com.ocadapter.opencode.dto.CreateSessionRequest;
import com.ocadapter.opencode.dto.PromptRequest;
import com.ocadapter.opencode.dto.SessionInfo;
import com.ocadapter.opencode.dto.SessionMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Thin reactive wrapper over the four OpenCode session endpoints used by the adapter.
 *
 * <p>The handle has an explicit {@link #open()}/{@link #close()} lifecycle; any call made while
 * it is closed fails with {@link BackendUnavailableException} before touching the network.</p>
 */
@Slf4j
public class OpencodeClient {

    private static final ParameterizedTypeReference<List<SessionMessage>> MESSAGE_LIST_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final String baseUrl;
    private final AtomicBoolean open = new AtomicBoolean(false);

    public OpencodeClient(WebClient webClient, String baseUrl) {
        this.webClient = webClient;
        this.baseUrl = baseUrl;
    }

    public void open() {
        if (open.compareAndSet(false, true)) {
            log.info("OpenCode client opened baseUrl={}", baseUrl);
        }
    }

    public void close() {
        if (open.compareAndSet(true, false)) {
            log.info("OpenCode client closed baseUrl={}", baseUrl);
        }
    }

    public boolean isOpen() {
        return open.get();
    }

    public Mono<SessionInfo> createSession(String title) {
        return whenOpen(() -> webClient.post()
                .uri("/session")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CreateSessionRequest(title))
                .retrieve()
                .bodyToMono(SessionInfo.class)
                .doOnNext(session -> log.debug("Created OpenCode session id={} title={}", session.getId(), title)));
    }

    public Mono<Void> submitPrompt(String sessionId, PromptRequest request) {
        return whenOpen(() -> webClient.post()
                .uri("/session/{id}/message", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .toBodilessEntity()
                .doOnNext(response -> log.debug("Submitted prompt to session id={} status={}",
                        sessionId, response.getStatusCode()))
                .then());
    }

    public Mono<List<SessionMessage>> listMessages(String sessionId) {
        return whenOpen(() -> webClient.get()
                .uri("/session/{id}/message", sessionId)
                .retrieve()
                .bodyToMono(MESSAGE_LIST_TYPE)
                .defaultIfEmpty(List.of()));
    }

    public Mono<Void> deleteSession(String sessionId) {
        return whenOpen(() -> webClient.delete()
                .uri("/session/{id}", sessionId)
                .retrieve()
                .toBodilessEntity()
                .doOnNext(response -> log.debug("Deleted OpenCode session id={} status={}",
                        sessionId, response.getStatusCode()))
                .then());
    }

    private <T> Mono<T> whenOpen(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            if (!open.get()) {
                return Mono.error(new BackendUnavailableException(
                        "OpenCode client not connected (" + baseUrl + ")"));
            }
            return call.get();
        });
    }
}
