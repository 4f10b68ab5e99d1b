package com.ocadapter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class OllamaOpencodeAdapterApplication {

    public static void main(String[] args) {
        log.info("Starting ollama-opencode-adapter");
        SpringApplication.run(OllamaOpencodeAdapterApplication.class, args);
        log.info("ollama-opencode-adapter started");
    }

}
