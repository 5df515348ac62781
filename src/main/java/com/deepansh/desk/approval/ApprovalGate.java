package com.deepansh.desk.approval;

import com.deepansh.desk.exception.GateProtocolViolationException;
import com.deepansh.desk.exception.InvalidDecisionException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoint in front of every side-effecting action of one session.
 *
 * Selective by action name: only names listed as gated are put in front of
 * the human; everything else passes straight through as approved. Each
 * action id is resolved at most once. The set of resolved ids belongs to the
 * session record, so the guarantee survives a restart.
 */
@Slf4j
public class ApprovalGate {

    private final Set<String> resolvedActionIds;
    private final HumanDecisionProvider decisionProvider;
    private final Set<String> gatedActions;
    private final int maxResubmissions;

    public ApprovalGate(Set<String> resolvedActionIds,
                        HumanDecisionProvider decisionProvider,
                        Collection<String> gatedActions,
                        int maxResubmissions) {
        this.resolvedActionIds = resolvedActionIds;
        this.decisionProvider = decisionProvider;
        this.gatedActions = Set.copyOf(gatedActions);
        this.maxResubmissions = maxResubmissions;
    }

    public boolean isGated(String actionName) {
        return gatedActions.contains(actionName);
    }

    public boolean isResolved(String actionId) {
        return resolvedActionIds.contains(actionId);
    }

    /**
     * Presents the action to the decision provider.
     *
     * @return the applied decision, or empty when the provider deferred it
     * @throws GateProtocolViolationException if the action was already resolved
     * @throws InvalidDecisionException if the provider keeps returning revisions without feedback
     */
    public Optional<ApprovalDecision> submit(PendingAction action) {
        requireUnresolved(action);

        if (!isGated(action.actionName())) {
            log.debug("Action {} is not gated, passing through", action.actionName());
            return Optional.of(resolve(action, ApprovalDecision.approve()));
        }

        log.info("Approval REQUESTED for {} [{}]", action.actionName(), action.actionId());
        for (int attempt = 0; attempt <= maxResubmissions; attempt++) {
            Optional<ApprovalDecision> decision = decisionProvider.decide(action);
            if (decision.isEmpty()) {
                return Optional.empty();
            }
            ApprovalDecision d = decision.get();
            if (d.kind() == ApprovalDecision.Kind.REVISE && !d.hasFeedback()) {
                log.warn("Revision without feedback for [{}], asking again ({}/{})",
                        action.actionId(), attempt + 1, maxResubmissions);
                continue;
            }
            return Optional.of(resolve(action, d));
        }
        throw new InvalidDecisionException("A revision needs feedback describing what to change.");
    }

    /**
     * Applies a decision that arrived outside {@link #submit}, e.g. from the
     * REST channel. Marks the action resolved.
     */
    public ApprovalDecision resolve(PendingAction action, ApprovalDecision decision) {
        requireUnresolved(action);
        if (decision == null || decision.kind() == null) {
            throw new InvalidDecisionException("A decision kind is required.");
        }
        if (decision.kind() == ApprovalDecision.Kind.REVISE && !decision.hasFeedback()) {
            throw new InvalidDecisionException("A revision needs feedback describing what to change.");
        }
        resolvedActionIds.add(action.actionId());
        log.info("Approval {} for {} [{}]", statusOf(decision), action.actionName(), action.actionId());
        return decision;
    }

    private void requireUnresolved(PendingAction action) {
        if (resolvedActionIds.contains(action.actionId())) {
            throw new GateProtocolViolationException(
                    "Action " + action.actionId() + " has already been resolved");
        }
    }

    private static String statusOf(ApprovalDecision decision) {
        return switch (decision.kind()) {
            case APPROVE -> "APPROVED";
            case REVISE -> "REVISED";
            case CANCEL -> "CANCELLED";
        };
    }
}
