package com.ocadapter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Central application properties for the adapter.
 *
 * <p>{@code opencode} locates the backend server, {@code model} selects the model OpenCode runs,
 * {@code session} holds the three independent timeout tiers of one exchange plus the poll
 * interval, and {@code decision} tunes the response engine.</p>
 */
@Data
@ConfigurationProperties(prefix = "adapter")
public class AdapterProperties {

    private String version = "0.1.0";

    private Model model = new Model();
    private Opencode opencode = new Opencode();
    private Session session = new Session();
    private Decision decision = new Decision();

    @Data
    public static class Model {
        private String provider = "github-copilot";
        private String id = "gpt-4o";
    }

    @Data
    public static class Opencode {
        private String url = "http://localhost";
        private int port = 7272;

        public String resolveBaseUrl() {
            return url + ":" + port;
        }
    }

    @Data
    public static class Session {
        private String defaultTitle = "ollama-opencode-session";
        private long submitTimeoutMs = 40_000;
        private long responseTimeoutMs = 30_000;
        private long pollIntervalMs = 300;
        private long cleanupTimeoutMs = 5_000;
    }

    @Data
    public static class Decision {
        private int recentWindow = 10;
        private String sessionTitle = "unified-response";
        private long responseTimeoutMs = 50_000;
        private String answerSessionTitle = "generate-answer";
        private long answerResponseTimeoutMs = 10_000;
    }
}
