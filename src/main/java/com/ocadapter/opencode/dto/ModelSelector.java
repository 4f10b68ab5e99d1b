package com.ocadapter.opencode.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelSelector {
    @JsonProperty("providerID")
    private String providerId;
    @JsonProperty("modelID")
    private String modelId;
}
