package com.ocadapter.ollama.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OllamaShowResponse {
    private String modelfile;
    private String parameters;
    private String template;
    private OllamaModelDetails details;
}
