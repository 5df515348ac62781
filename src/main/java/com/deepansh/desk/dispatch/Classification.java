package com.deepansh.desk.dispatch;

/**
 * Intent classification result. CLARIFY carries the question to ask; ROUTE
 * names exactly one known worker type.
 */
public record Classification(Kind kind, String workerType, String message) {

    public enum Kind {
        ROUTE, CLARIFY
    }

    public static Classification route(String workerType) {
        return new Classification(Kind.ROUTE, workerType, null);
    }

    public static Classification clarify(String question) {
        return new Classification(Kind.CLARIFY, null, question);
    }
}
