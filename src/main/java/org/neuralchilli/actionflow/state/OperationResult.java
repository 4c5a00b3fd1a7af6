package org.neuralchilli.actionflow.state;

import java.util.Optional;

/**
 * Outcome of a state store or event bus operation.
 * Backend failures surface here instead of as exceptions.
 */
public sealed interface OperationResult {

    /**
     * Check if the operation took effect
     */
    boolean isSuccess();

    /**
     * Key or channel the operation addressed
     */
    String target();

    /**
     * Get reason if failed
     */
    Optional<String> error();

    record Success(String target) implements OperationResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    record Failure(String target, String reason) implements OperationResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(reason);
        }
    }

    static OperationResult success(String target) {
        return new Success(target);
    }

    static OperationResult failure(String target, String reason) {
        return new Failure(target, reason);
    }

    static OperationResult failure(String target, Exception e) {
        return new Failure(target, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
}
