package com.ocadapter.opencode.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One entry of a session's message list: metadata plus its content parts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionMessage {
    public static final String ROLE_ASSISTANT = "assistant";

    private Info info;
    private List<MessagePart> parts;

    public boolean isAssistant() {
        return info != null && ROLE_ASSISTANT.equals(info.getRole());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Info {
        private String id;
        private String role;
    }
}
