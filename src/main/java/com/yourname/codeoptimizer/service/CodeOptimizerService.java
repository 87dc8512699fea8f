package com.yourname.codeoptimizer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourname.codeoptimizer.model.OptimizationRequest;
import com.yourname.codeoptimizer.model.OptimizationResponse;
import com.yourname.codeoptimizer.parsing.JsonExtractor;
import com.yourname.codeoptimizer.parsing.ResponseNormalizer;
import com.yourname.codeoptimizer.prompt.OptimizationPromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one optimization: prompt, single model call, extraction, normalization.
 * Failures propagate to the caller; nothing is retried.
 */
@Service
public class CodeOptimizerService {

    private static final Logger log = LoggerFactory.getLogger(CodeOptimizerService.class);

    private final ModelClient modelClient;
    private final OptimizationPromptBuilder promptBuilder;
    private final JsonExtractor jsonExtractor;
    private final ResponseNormalizer responseNormalizer;
    private final String modelName;

    public CodeOptimizerService(
        ModelClient modelClient,
        OptimizationPromptBuilder promptBuilder,
        JsonExtractor jsonExtractor,
        ResponseNormalizer responseNormalizer,
        @Value("${ollama.model}") String modelName
    ) {
        this.modelClient = modelClient;
        this.promptBuilder = promptBuilder;
        this.jsonExtractor = jsonExtractor;
        this.responseNormalizer = responseNormalizer;
        this.modelName = modelName;
    }

    public OptimizationResponse optimize(OptimizationRequest request) {
        String prompt = promptBuilder.build(request.language(), request.code());

        log.info("Requesting optimization from {} (language={}, {} chars)",
            modelName, request.language(), request.code().length());
        String raw = modelClient.generate(modelName, prompt);
        log.debug("Raw model output:\n{}", raw);

        JsonNode parsed = jsonExtractor.extract(raw);
        return responseNormalizer.normalize(parsed, request);
    }
}
