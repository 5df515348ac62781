package com.deepansh.desk.api;

import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.session.Session;
import com.deepansh.desk.session.SessionRuntime;
import com.deepansh.desk.worker.WorkerState;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SessionView {

    private String sessionId;
    private boolean identified;
    private String activeWorker;
    private String workerStatus;
    private String pendingActionId;
    private String pendingSummary;
    private String notice;
    private Instant createdAt;
    private Instant updatedAt;

    public static SessionView of(SessionRuntime runtime) {
        Session session = runtime.getSession();
        WorkerState active = session.getActiveWorkerState();
        PendingAction pending = runtime.getDispatcher().pendingAction().orElse(null);
        return SessionView.builder()
                .sessionId(session.getSessionId())
                .identified(session.getRequesterId() != null)
                .activeWorker(session.getActiveWorkerType())
                .workerStatus(active != null ? active.getStatus().name() : null)
                .pendingActionId(pending != null ? pending.actionId() : null)
                .pendingSummary(pending != null ? pending.summary() : null)
                .notice(runtime.getRecoveryNotice())
                .createdAt(session.getCreatedAt())
                .updatedAt(session.getUpdatedAt())
                .build();
    }
}
