package com.ocadapter.ollama.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OllamaModelDetails {
    @JsonProperty("parent_model")
    private String parentModel;
    private String format;
    private String family;
    private List<String> families;
    @JsonProperty("parameter_size")
    private String parameterSize;
    @JsonProperty("quantization_level")
    private String quantizationLevel;
}
