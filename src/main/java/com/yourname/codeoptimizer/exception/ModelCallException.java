package com.yourname.codeoptimizer.exception;

/**
 * Raised when the outbound call to the model server fails: connection
 * refused, timeout, non-2xx status or a reply without a completion.
 */
public class ModelCallException extends RuntimeException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
