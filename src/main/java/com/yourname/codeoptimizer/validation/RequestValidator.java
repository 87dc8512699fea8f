package com.yourname.codeoptimizer.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.codeoptimizer.model.OptimizationRequest;
import org.springframework.stereotype.Component;

/**
 * Validates the inbound optimize body before it reaches the service layer.
 * The body is read as a raw tree so that a non-string {@code code} is
 * rejected instead of being coerced to text by data binding.
 */
@Component
public class RequestValidator {

    static final String CODE_NOT_STRING = "`code` must be a string";
    static final String NOT_AN_OBJECT = "Request body must be a JSON object.";

    private final ObjectMapper objectMapper;

    public RequestValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses the body as JSON whatever content type it was sent with.
     * Throws IllegalArgumentException with a user-safe message on failure.
     */
    public OptimizationRequest validate(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new IllegalArgumentException(NOT_AN_OBJECT);
        }
        try {
            return validate(objectMapper.readTree(rawBody));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(NOT_AN_OBJECT, e);
        }
    }

    public OptimizationRequest validate(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException(NOT_AN_OBJECT);
        }

        JsonNode code = body.get("code");
        if (code == null || !code.isTextual()) {
            throw new IllegalArgumentException(CODE_NOT_STRING);
        }

        return new OptimizationRequest(language(body.get("language")), code.textValue());
    }

    // -------------------------------------------------------------------------

    private String language(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.textValue();
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
