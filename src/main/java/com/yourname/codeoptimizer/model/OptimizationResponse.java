package com.yourname.codeoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OptimizationResponse(
    @JsonProperty("optimized_code") String optimizedCode,
    List<Suggestion> suggestions,
    Metrics metrics
) {}
