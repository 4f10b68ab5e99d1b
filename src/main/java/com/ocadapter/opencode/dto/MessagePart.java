package com.ocadapter.opencode.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessagePart {
    public static final String TYPE_TEXT = "text";

    private String type;
    private String text;

    public static MessagePart text(String text) {
        return new MessagePart(TYPE_TEXT, text);
    }
}
