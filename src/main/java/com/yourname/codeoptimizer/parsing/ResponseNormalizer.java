package com.yourname.codeoptimizer.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourname.codeoptimizer.model.OptimizationRequest;
import com.yourname.codeoptimizer.model.OptimizationResponse;
import org.springframework.stereotype.Component;

/**
 * Shapes an extracted model object into an {@link OptimizationResponse}.
 * Never fails: an absent field falls back to the request's own values or
 * to an empty default.
 */
@Component
public class ResponseNormalizer {

    private final SuggestionNormalizer suggestionNormalizer;
    private final MetricsNormalizer metricsNormalizer;

    public ResponseNormalizer(SuggestionNormalizer suggestionNormalizer, MetricsNormalizer metricsNormalizer) {
        this.suggestionNormalizer = suggestionNormalizer;
        this.metricsNormalizer = metricsNormalizer;
    }

    public OptimizationResponse normalize(JsonNode parsed, OptimizationRequest request) {
        return new OptimizationResponse(
            optimizedCode(parsed.get("optimized_code"), request.code()),
            suggestionNormalizer.normalize(parsed.get("suggestions")),
            metricsNormalizer.normalize(parsed.get("metrics"), request.language(), request.code())
        );
    }

    private static String optimizedCode(JsonNode node, String original) {
        if (node == null || node.isNull() || node.isMissingNode()) return original;
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
