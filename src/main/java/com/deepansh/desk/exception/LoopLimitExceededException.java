package com.deepansh.desk.exception;

import lombok.Getter;

/**
 * A single turn needed more collaborator round-trips than allowed.
 * The session stays usable; only the current turn is abandoned.
 */
@Getter
public class LoopLimitExceededException extends DeskException {

    private final String handlerName;
    private final int iterations;
    private final int maxIterations;

    public LoopLimitExceededException(String handlerName, int iterations, int maxIterations) {
        super(String.format("Loop limit reached in [%s]: %d/%d", handlerName, iterations, maxIterations));
        this.handlerName = handlerName;
        this.iterations = iterations;
        this.maxIterations = maxIterations;
    }
}
