package com.architecture.memory.mergeflow.exception;

/**
 * Thrown for out-of-range configuration values and other bad input.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
