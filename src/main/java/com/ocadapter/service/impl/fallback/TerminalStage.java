package com.ocadapter.service.impl.fallback;

import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.service.impl.dto.DecisionContext;

/**
 * Last stage of a chain. It cannot decline, which keeps the chain exhaustive.
 */
public interface TerminalStage {

    String name();

    UnifiedResponse respond(DecisionContext context);
}
