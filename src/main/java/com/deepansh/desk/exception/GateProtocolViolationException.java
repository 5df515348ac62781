package com.deepansh.desk.exception;

/**
 * A decision was supplied for a PendingAction that is already resolved, or
 * for a Worker that is not waiting on one. Programming-contract violation.
 */
public class GateProtocolViolationException extends DeskException {

    public GateProtocolViolationException(String message) {
        super(message);
    }
}
