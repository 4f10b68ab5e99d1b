package com.ocadapter.service.impl;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.exception.AdapterException;
import com.ocadapter.exception.ResponseTimeoutException;
import com.ocadapter.exception.SessionCreateException;
import com.ocadapter.exception.SubmissionTimeoutException;
import com.ocadapter.opencode.OpencodeClient;
import com.ocadapter.opencode.dto.MessagePart;
import com.ocadapter.opencode.dto.ModelSelector;
import com.ocadapter.opencode.dto.PromptRequest;
import com.ocadapter.opencode.dto.SessionMessage;
import com.ocadapter.service.impl.dto.ExchangeOptions;
import com.ocadapter.service.impl.dto.ExchangeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs exactly one prompt/response round-trip against OpenCode: create a session, submit the
 * prompt, poll for the assistant reply, then delete the session.
 *
 * <p>Three timeouts apply and are never merged:</p>
 * <ul>
 *     <li>submission: guards the submit call alone, surfaces {@link SubmissionTimeoutException};</li>
 *     <li>response: bounds submission plus polling, surfaces {@link ResponseTimeoutException};</li>
 *     <li>cleanup: bounds the delete call, failures are only logged.</li>
 * </ul>
 * Session creation failures surface as {@link SessionCreateException}. Deletion runs once for
 * every created session whether the exchange completes, fails or is cancelled.
 */
@Component
@Slf4j
public class SessionExchange {

    private final OpencodeClient client;
    private final AdapterProperties properties;

    public SessionExchange(OpencodeClient client, AdapterProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public ExchangeOptions defaultOptions() {
        AdapterProperties.Session session = properties.getSession();
        return new ExchangeOptions(
                session.getDefaultTitle(),
                Duration.ofMillis(session.getResponseTimeoutMs()),
                Duration.ofMillis(session.getPollIntervalMs()));
    }

    public Mono<ExchangeResult> exchange(String systemPrompt, String userText, ExchangeOptions options) {
        return Mono.usingWhen(
                createSession(options.sessionTitle()),
                sessionId -> submitAndAwait(sessionId, systemPrompt, userText, options),
                this::deleteQuietly,
                (sessionId, error) -> deleteQuietly(sessionId),
                this::deleteQuietly);
    }

    private Mono<String> createSession(String title) {
        return client.createSession(title)
                .onErrorMap(error -> !(error instanceof AdapterException),
                        error -> new SessionCreateException("Failed to create OpenCode session", error))
                .flatMap(session -> StringUtils.hasText(session.getId())
                        ? Mono.just(session.getId())
                        : Mono.error(new SessionCreateException("OpenCode returned a session without id")))
                .switchIfEmpty(Mono.error(new SessionCreateException("OpenCode returned no session")));
    }

    private Mono<ExchangeResult> submitAndAwait(String sessionId,
                                                String systemPrompt,
                                                String userText,
                                                ExchangeOptions options) {
        Duration submitTimeout = Duration.ofMillis(properties.getSession().getSubmitTimeoutMs());
        AdapterProperties.Model model = properties.getModel();
        PromptRequest request = PromptRequest.builder()
                .model(new ModelSelector(model.getProvider(), model.getId()))
                .system(systemPrompt)
                .parts(List.of(MessagePart.text(userText)))
                .build();

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            log.debug("Submitting prompt session={} systemLength={} userLength={}",
                    sessionId, length(systemPrompt), length(userText));
            return client.submitPrompt(sessionId, request)
                    .timeout(submitTimeout)
                    .onErrorMap(TimeoutException.class, error -> new SubmissionTimeoutException(sessionId, submitTimeout))
                    .then(Mono.defer(() -> awaitReply(sessionId, startNanos, options)));
        });
    }

    private Mono<ExchangeResult> awaitReply(String sessionId, long startNanos, ExchangeOptions options) {
        Duration responseTimeout = options.responseTimeout();
        Duration remaining = responseTimeout.minusNanos(System.nanoTime() - startNanos);
        if (remaining.isNegative() || remaining.isZero()) {
            return Mono.error(new ResponseTimeoutException(sessionId, responseTimeout));
        }
        return Mono.defer(() -> client.listMessages(sessionId))
                .flatMap(messages -> Mono.justOrEmpty(latestAssistantText(messages)))
                .repeatWhenEmpty(attempts -> attempts
                        .doOnNext(attempt -> log.trace("No assistant reply yet session={} poll={}", sessionId, attempt + 1))
                        .delayElements(options.pollInterval()))
                .timeout(remaining)
                .onErrorMap(TimeoutException.class, error -> new ResponseTimeoutException(sessionId, responseTimeout))
                .map(text -> {
                    long elapsedMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
                    log.debug("Received assistant reply session={} length={} elapsedMs={}", sessionId, text.length(), elapsedMs);
                    return new ExchangeResult(text, elapsedMs);
                });
    }

    /**
     * Looks only at the newest assistant message and returns its first text part, if that part
     * carries any text.
     */
    static Optional<String> latestAssistantText(List<SessionMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        SessionMessage latest = null;
        for (SessionMessage message : messages) {
            if (message != null && message.isAssistant()) {
                latest = message;
            }
        }
        if (latest == null || latest.getParts() == null) {
            return Optional.empty();
        }
        return latest.getParts().stream()
                .filter(part -> part != null && MessagePart.TYPE_TEXT.equals(part.getType()))
                .findFirst()
                .map(MessagePart::getText)
                .filter(StringUtils::hasLength);
    }

    private Mono<Void> deleteQuietly(String sessionId) {
        Duration cleanupTimeout = Duration.ofMillis(properties.getSession().getCleanupTimeoutMs());
        return Mono.defer(() -> client.deleteSession(sessionId))
                .timeout(cleanupTimeout)
                .onErrorResume(error -> {
                    log.error("Failed to delete OpenCode session {}: {}", sessionId, error.toString());
                    return Mono.empty();
                });
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
