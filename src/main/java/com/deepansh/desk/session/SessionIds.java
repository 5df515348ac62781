package com.deepansh.desk.session;

import java.util.regex.Pattern;

final class SessionIds {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private SessionIds() {
    }

    /** Rejects ids that could escape a directory or key namespace. */
    static String requireSafe(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return sessionId;
    }
}
