package com.deepansh.desk.context;

/**
 * Well-known {@link ContextBag} keys.
 */
public final class ContextKeys {

    private ContextKeys() {
    }

    /** Identity of the person the request is made for. */
    public static final String REQUESTER_ID = "requesterId";

    /** Session the current turn belongs to. */
    public static final String SESSION_ID = "sessionId";

    /** ISO date on which the application is filed. */
    public static final String APPLICATION_DATE = "applicationDate";

    /** Type tag of the Worker handling the turn. */
    public static final String WORKER_TYPE = "workerType";
}
