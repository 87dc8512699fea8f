package com.yourname.codeoptimizer.service;

import com.yourname.codeoptimizer.exception.ModelCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Map;

/**
 * {@link ModelClient} backed by Ollama's non-streaming generate endpoint.
 */
@Service
public class OllamaService implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaService.class);

    private final RestClient restClient;
    private final String apiUrl;

    public OllamaService(
        RestClient ollamaRestClient,
        @Value("${ollama.api.url}") String apiUrl
    ) {
        this.restClient = ollamaRestClient;
        this.apiUrl = apiUrl;
    }

    @Override
    public String generate(String model, String prompt) {
        Map<String, Object> body = Map.of(
            "model", model,
            "prompt", prompt,
            "stream", false
        );

        Map<?, ?> response;
        try {
            response = restClient.post()
                .uri(apiUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(Map.class);
        } catch (RestClientResponseException e) {
            log.warn("Ollama returned status={} for model {}", e.getStatusCode().value(), model);
            throw new ModelCallException(
                "Model server returned " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (ResourceAccessException e) {
            throw new ModelCallException("Model server unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ModelCallException("Model call failed: " + e.getMessage(), e);
        }

        return extractCompletion(response);
    }

    // -------------------------------------------------------------------------

    private String extractCompletion(Map<?, ?> response) {
        if (response == null) throw new ModelCallException("Empty Ollama response");

        if (!(response.get("response") instanceof String completion))
            throw new ModelCallException("Ollama response missing completion text");

        return completion;
    }
}
