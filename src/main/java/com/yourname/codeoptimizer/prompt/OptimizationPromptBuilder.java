package com.yourname.codeoptimizer.prompt;

import org.springframework.stereotype.Component;

/**
 * Builds the single text prompt sent to the model: a fixed instruction that
 * pins down the response shape, followed by the language and the code exactly
 * as the caller sent them.
 */
@Component
public class OptimizationPromptBuilder {

    static final String SYSTEM_INSTRUCTION = """
        You MUST reply with ONLY valid JSON.
        No explanations, no markdown, no backticks.

        Use this exact structure:
        {
          "optimized_code": "string",
          "suggestions": [
            {
              "id": "S1",
              "title": "short title",
              "detail": "full explanation"
            }
          ],
          "metrics": {
            "language": "string",
            "loc_before": 0,
            "loc_after": 0,
            "reduction": 0
          }
        }
        You MUST follow this structure.
        """;

    private static final String USER_TEMPLATE = """
        Optimize this code.

        Improve:
        - dead code removal
        - better naming
        - safer input handling
        - modularity
        - readability
        - unused variables
        - duplicate logic

        Language: %s

        Code:
        %s
        """;

    public String build(String language, String code) {
        return SYSTEM_INSTRUCTION + "\n" + USER_TEMPLATE.formatted(
            language == null ? "" : language,
            code == null ? "" : code
        );
    }
}
