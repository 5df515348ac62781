package com.deepansh.desk.worker;

import com.deepansh.desk.approval.ApprovalDecision;
import com.deepansh.desk.context.ContextBag;

/**
 * One task type's field-collection state machine:
 * IDLE → COLLECTING_FIELDS → READY_FOR_ACTION → AWAITING_APPROVAL →
 * COMPLETED | COLLECTING_FIELDS (revise) | CANCELLED.
 * ERROR is transient and always falls back to IDLE with fields kept.
 */
public interface Worker {

    String type();

    WorkerState state();

    /**
     * Processes one user input. In AWAITING_APPROVAL the pending action is
     * re-presented unchanged.
     */
    WorkerOutcome advance(String input, ContextBag context);

    /**
     * Applies the decision on the current pending action.
     *
     * @throws com.deepansh.desk.exception.GateProtocolViolationException if nothing is awaiting approval
     */
    WorkerOutcome resolve(ApprovalDecision decision, ContextBag context);

    void reset();

    /** True while the Worker holds an unfinished task the Dispatcher must keep routing to. */
    boolean isInProgress();
}
