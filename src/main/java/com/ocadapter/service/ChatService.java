package com.ocadapter.service;

import com.ocadapter.ollama.dto.OllamaChatRequest;
import com.ocadapter.ollama.dto.OllamaChatResponse;
import reactor.core.publisher.Mono;

public interface ChatService {

    Mono<OllamaChatResponse> chat(OllamaChatRequest request);
}
