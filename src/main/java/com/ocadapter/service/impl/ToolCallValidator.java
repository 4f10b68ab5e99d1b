package com.ocadapter.service.impl;

import com.ocadapter.model.ToolDefinition;
import com.ocadapter.model.UnifiedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Rewrites tool calls naming a tool the caller never advertised to {@code unknown} with empty
 * arguments. Other responses pass through untouched.
 */
@Component
@Slf4j
public class ToolCallValidator {

    public UnifiedResponse validate(UnifiedResponse response, List<ToolDefinition> catalog) {
        if (!(response instanceof UnifiedResponse.ToolCall toolCall)) {
            return response;
        }
        String name = toolCall.toolName();
        if (UnifiedResponse.UNKNOWN_TOOL.equals(name)) {
            return response;
        }
        boolean advertised = catalog.stream().anyMatch(tool -> tool.name().equals(name));
        if (advertised) {
            return response;
        }
        log.warn("Model selected tool '{}' which is not in the catalog {}; replacing with '{}'",
                name, catalog.stream().map(ToolDefinition::name).toList(), UnifiedResponse.UNKNOWN_TOOL);
        return UnifiedResponse.toolCall(UnifiedResponse.UNKNOWN_TOOL, Map.of());
    }
}
