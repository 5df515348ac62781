package com.deepansh.desk.exception;

/**
 * Base unchecked exception for the desk runtime.
 *
 * Also used directly for non-retryable collaborator failures (bad API key,
 * malformed model output). Resilience4j is configured to ignore this type so
 * such failures neither retry nor trip the circuit breaker.
 */
public class DeskException extends RuntimeException {

    public DeskException(String message) {
        super(message);
    }

    public DeskException(String message, Throwable cause) {
        super(message, cause);
    }
}
