package com.ocadapter.controller;

import com.ocadapter.ollama.ModelMetadata;
import com.ocadapter.ollama.dto.OllamaChatRequest;
import com.ocadapter.ollama.dto.OllamaChatResponse;
import com.ocadapter.ollama.dto.OllamaShowResponse;
import com.ocadapter.ollama.dto.OllamaTagsResponse;
import com.ocadapter.ollama.dto.OllamaVersionResponse;
import com.ocadapter.opencode.OpencodeClient;
import com.ocadapter.service.ChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Ollama API")
@RestController
@RequiredArgsConstructor
@Slf4j
public class OllamaApiController {
    private final ChatService chatService;
    private final ModelMetadata modelMetadata;
    private final OpencodeClient opencodeClient;

    @PostMapping("/api/chat")
    @Operation(summary = "Chat (tool calling)", description = "Decides between a tool call, an answer and a chat reply.")
    public Mono<OllamaChatResponse> chat(@RequestBody OllamaChatRequest request) {
        log.debug("Handling /api/chat request model={} messageCount={} stream={}",
                request.getModel(), request.getMessages() != null ? request.getMessages().size() : 0, request.getStream());
        return chatService.chat(request)
                .doOnSuccess(response -> log.debug("chat succeeded model={} contentLength={}",
                        request.getModel(), response != null && response.getMessage().getContent() != null
                                ? response.getMessage().getContent().length() : 0))
                .doOnError(error -> log.error("chat failed model={}", request.getModel(), error));
    }

    @GetMapping("/api/tags")
    @Operation(summary = "List models")
    public OllamaTagsResponse tags() {
        return modelMetadata.tags();
    }

    @PostMapping("/api/show")
    @Operation(summary = "Show model information")
    public OllamaShowResponse show(@RequestBody(required = false) Map<String, Object> body) {
        log.debug("Handling /api/show request name={}", body != null ? body.get("name") : null);
        return modelMetadata.show();
    }

    @GetMapping("/api/version")
    @Operation(summary = "Adapter version")
    public OllamaVersionResponse version() {
        return modelMetadata.version();
    }

    @GetMapping("/health")
    @Operation(summary = "Health check")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("opencode", opencodeClient.isOpen() ? "connected" : "disconnected");
        body.put("ollama_compatible", true);
        return body;
    }
}
