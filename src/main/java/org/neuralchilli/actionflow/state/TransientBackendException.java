package org.neuralchilli.actionflow.state;

/**
 * Raised by a backend adapter when the store or broker cannot be reached.
 * Always recovered locally by the state store or event bus.
 */
public class TransientBackendException extends RuntimeException {

    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
