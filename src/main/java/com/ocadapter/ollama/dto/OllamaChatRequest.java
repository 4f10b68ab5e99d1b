package com.ocadapter.ollama.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/chat}. {@code stream}, {@code format} and {@code options} are accepted
 * for compatibility; responses are never streamed.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaChatRequest {
    private String model;
    private List<OllamaMessage> messages;
    private Boolean stream;
    private List<OllamaTool> tools;
    private String format;
    private Map<String, Object> options;
}
