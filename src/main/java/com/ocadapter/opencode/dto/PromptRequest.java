package com.ocadapter.opencode.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptRequest {
    private ModelSelector model;
    private String system;
    private List<MessagePart> parts;
}
