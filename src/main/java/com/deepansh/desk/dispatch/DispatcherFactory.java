package com.deepansh.desk.dispatch;

import com.deepansh.desk.approval.ApprovalGate;
import com.deepansh.desk.approval.HumanDecisionProvider;
import com.deepansh.desk.config.DeskProperties;
import com.deepansh.desk.session.Session;
import com.deepansh.desk.session.SessionStore;
import com.deepansh.desk.worker.WorkerRegistry;
import lombok.RequiredArgsConstructor;

import java.time.Clock;

/**
 * Wires a Dispatcher and its ApprovalGate around one session record.
 * Only stateless collaborators are shared between sessions.
 */
@RequiredArgsConstructor
public class DispatcherFactory {

    private final WorkerRegistry workers;
    private final IntentClassifier classifier;
    private final HumanDecisionProvider decisionProvider;
    private final SessionStore store;
    private final TurnErrorHandler errorHandler;
    private final DeskProperties properties;
    private final Clock clock;

    public Dispatcher create(Session session) {
        DeskProperties.Approval approval = properties.getApproval();
        ApprovalGate gate = new ApprovalGate(session.getResolvedActionIds(), decisionProvider,
                approval.getGatedActions(), approval.getMaxResubmissions());
        return new Dispatcher(session, workers, classifier, gate, store, errorHandler, clock);
    }

    public Session newSession(String sessionId) {
        return Session.create(sessionId, properties.getHistory().getDispatcherWindow(), clock.instant());
    }
}
