package com.deepansh.desk.exception;

public class SessionNotFoundException extends DeskException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
