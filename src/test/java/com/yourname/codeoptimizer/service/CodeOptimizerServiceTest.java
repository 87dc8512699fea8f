package com.yourname.codeoptimizer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.codeoptimizer.exception.ExtractionException;
import com.yourname.codeoptimizer.exception.ModelCallException;
import com.yourname.codeoptimizer.model.OptimizationRequest;
import com.yourname.codeoptimizer.model.OptimizationResponse;
import com.yourname.codeoptimizer.parsing.JsonExtractor;
import com.yourname.codeoptimizer.parsing.MetricsNormalizer;
import com.yourname.codeoptimizer.parsing.ResponseNormalizer;
import com.yourname.codeoptimizer.parsing.SuggestionNormalizer;
import com.yourname.codeoptimizer.prompt.OptimizationPromptBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeOptimizerServiceTest {

    private final List<String> prompts = new ArrayList<>();

    @Test
    void optimizeSendsPromptToConfiguredModelAndNormalizesReply() {
        CodeOptimizerService service = serviceReturning((model, prompt) -> {
            assertThat(model).isEqualTo("qwen2.5-coder:7b");
            prompts.add(prompt);
            return "Here you go:\n{\"optimized_code\":\"x=1\",\"suggestions\":[{\"title\":\"t\"}]}";
        });

        OptimizationResponse response = service.optimize(new OptimizationRequest("python", "x = 1\n"));

        assertThat(prompts).singleElement().asString().contains("Language: python").contains("x = 1");
        assertThat(response.optimizedCode()).isEqualTo("x=1");
        assertThat(response.suggestions()).hasSize(1);
        assertThat(response.suggestions().get(0).id()).isEqualTo("S1");
        assertThat(response.metrics().locBefore()).isEqualTo(2);
    }

    @Test
    void optimizeCallsTheModelOnceAndPropagatesFailures() {
        int[] calls = {0};
        CodeOptimizerService service = serviceReturning((model, prompt) -> {
            calls[0]++;
            throw new ModelCallException("Model server unreachable: Connection refused");
        });

        assertThatThrownBy(() -> service.optimize(new OptimizationRequest("c", "int x;")))
            .isInstanceOf(ModelCallException.class);
        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    void optimizeFailsWhenReplyHasNoJson() {
        CodeOptimizerService service = serviceReturning((model, prompt) -> "I cannot help with that.");

        assertThatThrownBy(() -> service.optimize(new OptimizationRequest("c", "int x;")))
            .isInstanceOf(ExtractionException.class);
    }

    private CodeOptimizerService serviceReturning(ModelClient client) {
        return new CodeOptimizerService(
            client,
            new OptimizationPromptBuilder(),
            new JsonExtractor(new ObjectMapper()),
            new ResponseNormalizer(new SuggestionNormalizer(), new MetricsNormalizer()),
            "qwen2.5-coder:7b"
        );
    }
}
