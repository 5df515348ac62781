package com.deepansh.desk.exception;

/**
 * A decision that cannot be applied as given, e.g. a revision without
 * feedback text. The caller is expected to resubmit.
 */
public class InvalidDecisionException extends DeskException {

    public InvalidDecisionException(String message) {
        super(message);
    }
}
