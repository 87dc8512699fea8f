package com.yourname.codeoptimizer.model;

public record Suggestion(
    String id,
    String title,
    String detail
) {}
