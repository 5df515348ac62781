package com.deepansh.desk.session;

import com.deepansh.desk.dispatch.Dispatcher;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory handle on one live session: its record, its Dispatcher and the
 * lock that keeps its turns strictly sequential.
 */
@Getter
public class SessionRuntime {

    private final Session session;
    private final Dispatcher dispatcher;
    private final ReentrantLock lock = new ReentrantLock();

    /** Set when the saved record was unreadable and a fresh session replaced it. */
    private final String recoveryNotice;

    private volatile Instant lastUsed = Instant.EPOCH;

    public SessionRuntime(Session session, Dispatcher dispatcher, String recoveryNotice) {
        this.session = session;
        this.dispatcher = dispatcher;
        this.recoveryNotice = recoveryNotice;
    }

    public String getSessionId() {
        return session.getSessionId();
    }

    void touch(Instant now) {
        lastUsed = now;
    }
}
