package com.ocadapter.service;

import com.ocadapter.model.ConversationContext;
import com.ocadapter.model.UnifiedResponse;
import reactor.core.publisher.Mono;

public interface ResponseEngine {

    /**
     * Decides how to respond to the conversation. Emits exactly one response; errors only when
     * the backend is not connected or the decision session cannot be created.
     */
    Mono<UnifiedResponse> generate(ConversationContext context);
}
