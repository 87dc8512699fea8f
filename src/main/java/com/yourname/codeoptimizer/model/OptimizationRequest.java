package com.yourname.codeoptimizer.model;

/**
 * A validated optimization request. {@code code} is never null; {@code language}
 * is whatever the caller sent and may be null.
 */
public record OptimizationRequest(
    String language,
    String code
) {}
