package com.deepansh.desk.approval;

/**
 * Outcome of human judgment on a {@link PendingAction}. Revise carries the
 * feedback text that is fed back to the worker as its next input.
 */
public record ApprovalDecision(Kind kind, String feedback) {

    public enum Kind {
        APPROVE, REVISE, CANCEL
    }

    public static ApprovalDecision approve() {
        return new ApprovalDecision(Kind.APPROVE, null);
    }

    public static ApprovalDecision revise(String feedback) {
        return new ApprovalDecision(Kind.REVISE, feedback);
    }

    public static ApprovalDecision cancel() {
        return new ApprovalDecision(Kind.CANCEL, null);
    }

    public boolean hasFeedback() {
        return feedback != null && !feedback.isBlank();
    }
}
