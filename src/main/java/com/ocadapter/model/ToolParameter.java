package com.ocadapter.model;

import org.springframework.lang.Nullable;

public record ToolParameter(String type, boolean required, @Nullable String description, @Nullable String itemType) {

    public ToolParameter {
        type = type == null || type.isBlank() ? "any" : type;
    }
}
