package com.ocadapter.ollama;

import com.ocadapter.config.AdapterProperties;
import com.ocadapter.ollama.dto.OllamaModelDetails;
import com.ocadapter.ollama.dto.OllamaShowResponse;
import com.ocadapter.ollama.dto.OllamaTagsResponse;
import com.ocadapter.ollama.dto.OllamaVersionResponse;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Static model metadata reported by the Ollama discovery endpoints. Clients only need these to
 * accept the adapter as a model server; the values do not describe the real backend model.
 */
@Component
public class ModelMetadata {

    private static final String DIGEST = "ha-ai-proxy";

    private final AdapterProperties properties;
    private final Clock clock;

    public ModelMetadata(AdapterProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public OllamaTagsResponse tags() {
        String modelId = properties.getModel().getId();
        return OllamaTagsResponse.builder()
                .models(List.of(OllamaTagsResponse.Model.builder()
                        .name(modelId)
                        .model(modelId)
                        .modifiedAt(clock.instant().toString())
                        .size(0L)
                        .digest(DIGEST)
                        .details(details())
                        .build()))
                .build();
    }

    public OllamaShowResponse show() {
        return OllamaShowResponse.builder()
                .modelfile("# ha-ai proxy model\nFROM " + DIGEST)
                .parameters("temperature 0.7")
                .template("{{ .System }}\n{{ .Prompt }}")
                .details(details())
                .build();
    }

    public OllamaVersionResponse version() {
        return new OllamaVersionResponse(properties.getVersion());
    }

    private OllamaModelDetails details() {
        return OllamaModelDetails.builder()
                .format("gguf")
                .family("llama")
                .families(List.of("llama"))
                .parameterSize("70B")
                .quantizationLevel("Q4_0")
                .build();
    }
}
