package com.architecture.memory.mergeflow.exception;

/**
 * Wraps a failure talking to the Git hosting API (auth, rate limit, network, timeout).
 * The message never contains the raw provider response body.
 */
public class ProviderException extends RuntimeException {

    private final String operation;
    private final int statusCode;

    public ProviderException(String operation, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public ProviderException(String operation, String message) {
        this(operation, 0, message, null);
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status returned by the provider, or 0 when the request never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
