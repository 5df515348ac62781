package com.deepansh.desk.approval;

import java.util.Optional;

/**
 * Source of human decisions on pending actions.
 *
 * An empty result means no decision is available yet: the action stays
 * suspended (persisted in the awaiting-approval state) until a decision is
 * supplied through another channel.
 */
public interface HumanDecisionProvider {

    Optional<ApprovalDecision> decide(PendingAction action);
}
