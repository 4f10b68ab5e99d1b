package com.ocadapter.ollama.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class OllamaTagsResponse {
    private List<Model> models;

    @Data
    @Builder
    public static class Model {
        private String name;
        private String model;
        @JsonProperty("modified_at")
        private String modifiedAt;
        private long size;
        private String digest;
        private OllamaModelDetails details;
    }
}
