package com.yourname.codeoptimizer.exception;

/**
 * Raised when no usable JSON object can be pulled out of a model completion.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
