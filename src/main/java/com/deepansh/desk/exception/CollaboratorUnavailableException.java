package com.deepansh.desk.exception;

/**
 * The generation collaborator could not be reached after retries, or its
 * circuit breaker is open. Recoverable at the turn boundary.
 */
public class CollaboratorUnavailableException extends DeskException {

    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
