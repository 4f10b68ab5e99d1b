package com.ocadapter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool call recorded on an assistant turn. Arguments are always a structured mapping.
 */
public record ToolInvocation(String name, Map<String, JsonValue> arguments) {

    public ToolInvocation {
        name = name == null ? "" : name;
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public String argumentsAsJson() {
        return JsonValue.toObjectNode(arguments).toString();
    }
}
