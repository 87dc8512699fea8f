package com.yourname.codeoptimizer.controller;

import com.yourname.codeoptimizer.model.OptimizationRequest;
import com.yourname.codeoptimizer.model.OptimizationResponse;
import com.yourname.codeoptimizer.service.CodeOptimizerService;
import com.yourname.codeoptimizer.validation.RequestValidator;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class OptimizeController {

    private final CodeOptimizerService optimizerService;
    private final RequestValidator requestValidator;

    public OptimizeController(CodeOptimizerService optimizerService, RequestValidator requestValidator) {
        this.optimizerService = optimizerService;
        this.requestValidator = requestValidator;
    }

    // Any content type: clients that omit the JSON header still get parsed
    @PostMapping(path = "/optimize", consumes = MediaType.ALL_VALUE)
    public OptimizationResponse optimize(@RequestBody(required = false) String body) {
        OptimizationRequest request = requestValidator.validate(body);
        return optimizerService.optimize(request);
    }
}
