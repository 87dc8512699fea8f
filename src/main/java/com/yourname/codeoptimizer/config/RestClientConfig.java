package com.yourname.codeoptimizer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Configures the RestClient used to reach Ollama. Local models can take a
 * long time to answer, so the read timeout is generous, but it is always set
 * so a hung inference call cannot hold a request thread forever.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient ollamaRestClient(
        @Value("${ollama.timeout.connect-seconds:5}") long connectSeconds,
        @Value("${ollama.timeout.read-seconds:120}") long readSeconds
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) Duration.ofSeconds(connectSeconds).toMillis());
        factory.setReadTimeout((int) Duration.ofSeconds(readSeconds).toMillis());

        return RestClient.builder()
            .requestFactory(factory)
            .build();
    }
}
