package org.neuralchilli.actionflow.core;

/**
 * Thrown when a placeholder path cannot be compiled or evaluated.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
