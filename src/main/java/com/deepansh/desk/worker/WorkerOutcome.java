package com.deepansh.desk.worker;

import com.deepansh.desk.approval.PendingAction;

/**
 * Result of one Worker step as seen by the Dispatcher.
 */
public record WorkerOutcome(Kind kind, String message, PendingAction pendingAction, String artifactLocation) {

    public enum Kind {
        /** Still collecting; the message is the next question. */
        REPLY,
        /** Ready; the pending action must go through the approval gate. */
        ACTION_REQUESTED,
        COMPLETED,
        CANCELLED,
        /** Approved but rendering failed; fields are kept for another attempt. */
        RENDER_FAILED
    }

    public static WorkerOutcome reply(String message) {
        return new WorkerOutcome(Kind.REPLY, message, null, null);
    }

    public static WorkerOutcome actionRequested(PendingAction action, String message) {
        return new WorkerOutcome(Kind.ACTION_REQUESTED, message, action, null);
    }

    public static WorkerOutcome completed(String message, String artifactLocation) {
        return new WorkerOutcome(Kind.COMPLETED, message, null, artifactLocation);
    }

    public static WorkerOutcome cancelled(String message) {
        return new WorkerOutcome(Kind.CANCELLED, message, null, null);
    }

    public static WorkerOutcome renderFailed(String message) {
        return new WorkerOutcome(Kind.RENDER_FAILED, message, null, null);
    }

    public boolean isTerminal() {
        return kind == Kind.COMPLETED || kind == Kind.CANCELLED;
    }
}
