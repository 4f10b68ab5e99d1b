package com.ocadapter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Infrastructure beans shared by the OpenCode client and the wire mapping.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean
    public WebClient opencodeWebClient(AdapterProperties properties) {
        return WebClient.builder()
                .baseUrl(properties.getOpencode().resolveBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logOpencodeRequest())
                .filter(logOpencodeResponse())
                .build();
    }

    private static ExchangeFilterFunction logOpencodeRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("[OPENCODE-HTTP] -> {} {}", request.method(), request.url());
            return Mono.just(request);
        });
    }

    // non-2xx replies still reach the caller; this only records them
    private static ExchangeFilterFunction logOpencodeResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (response.statusCode().isError()) {
                log.warn("[OPENCODE-HTTP] <- status={}", response.statusCode().value());
            } else {
                log.debug("[OPENCODE-HTTP] <- status={}", response.statusCode().value());
            }
            return Mono.just(response);
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
