package com.deepansh.desk.approval;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Auto-approves actions whose total is within a limit and hands everything
 * else to a human provider.
 */
@Slf4j
public class PolicyDecisionProvider implements HumanDecisionProvider {

    private final long autoApproveLimit;
    private final HumanDecisionProvider human;

    public PolicyDecisionProvider(long autoApproveLimit, HumanDecisionProvider human) {
        this.autoApproveLimit = autoApproveLimit;
        this.human = human;
    }

    @Override
    public Optional<ApprovalDecision> decide(PendingAction action) {
        long total = action.totalAmount();
        if (total >= 0 && total <= autoApproveLimit) {
            log.info("Auto-approved {} [{}]: total {} within limit {}",
                    action.actionName(), action.actionId(), total, autoApproveLimit);
            return Optional.of(ApprovalDecision.approve());
        }
        return human.decide(action);
    }
}
