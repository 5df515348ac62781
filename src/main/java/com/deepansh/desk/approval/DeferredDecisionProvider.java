package com.deepansh.desk.approval;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Never decides in-line. Used when decisions arrive asynchronously, e.g.
 * through the REST decisions endpoint.
 */
@Slf4j
public class DeferredDecisionProvider implements HumanDecisionProvider {

    @Override
    public Optional<ApprovalDecision> decide(PendingAction action) {
        log.info("Decision on {} [{}] deferred to the asynchronous channel",
                action.actionName(), action.actionId());
        return Optional.empty();
    }
}
