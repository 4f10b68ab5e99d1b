package com.ocadapter.config;

import com.ocadapter.opencode.OpencodeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Owns the lifecycle of the single OpenCode client handle: opened when the context starts,
 * closed when it shuts down. Sessions are per exchange and never tied to the handle.
 */
@Configuration
@EnableConfigurationProperties(AdapterProperties.class)
@Slf4j
public class OpencodeClientConfig {

    @Bean(initMethod = "open", destroyMethod = "close")
    public OpencodeClient opencodeClient(WebClient opencodeWebClient, AdapterProperties properties) {
        String baseUrl = properties.getOpencode().resolveBaseUrl();
        log.info("Configuring OpenCode client baseUrl={} model={}/{}",
                baseUrl, properties.getModel().getProvider(), properties.getModel().getId());
        return new OpencodeClient(opencodeWebClient, baseUrl);
    }
}
