package com.ocadapter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool advertised by the caller for one request.
 */
public record ToolDefinition(String name, String description, Map<String, ToolParameter> parameters) {

    public ToolDefinition {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
