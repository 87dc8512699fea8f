package com.yourname.codeoptimizer.service;

/**
 * Blocking text-completion call against a model server.
 */
public interface ModelClient {

    /**
     * @return the raw completion text
     * @throws com.yourname.codeoptimizer.exception.ModelCallException on
     *         transport failure, timeout or a non-success status
     */
    String generate(String model, String prompt);
}
