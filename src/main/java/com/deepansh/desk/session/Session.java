package com.deepansh.desk.session;

import com.deepansh.desk.history.HistoryWindow;
import com.deepansh.desk.worker.WorkerState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One user's continuous interaction: the durable record a SessionStore saves
 * and loads as a whole.
 */
@Data
@NoArgsConstructor
public class Session {

    private String sessionId;
    private String requesterId;

    /** Type tag of the Worker currently holding the conversation, or null. */
    private String activeWorkerType;

    private Instant createdAt;
    private Instant updatedAt;

    private HistoryWindow dispatcherHistory;
    private Map<String, WorkerState> workers = new LinkedHashMap<>();
    private Set<String> resolvedActionIds = new LinkedHashSet<>();

    public static Session create(String sessionId, int dispatcherWindow, Instant now) {
        Session session = new Session();
        session.setSessionId(sessionId);
        session.setCreatedAt(now);
        session.setUpdatedAt(now);
        session.setDispatcherHistory(new HistoryWindow(dispatcherWindow));
        return session;
    }

    @JsonIgnore
    public WorkerState getActiveWorkerState() {
        return activeWorkerType == null ? null : workers.get(activeWorkerType);
    }
}
