package com.deepansh.desk.exception;

import lombok.Getter;

@Getter
public class SessionCorruptException extends DeskException {

    private final String sessionId;

    public SessionCorruptException(String sessionId, Throwable cause) {
        super("Session record is unreadable: " + sessionId, cause);
        this.sessionId = sessionId;
    }
}
