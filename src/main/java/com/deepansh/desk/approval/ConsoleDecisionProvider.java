package com.deepansh.desk.approval;

import com.deepansh.desk.cli.ConsoleIO;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Interactive three-way prompt: 1 approve, 2 revise with feedback, 3 cancel.
 * Empty feedback on a revision is asked for again. End of input defers the
 * decision; the action stays pending in the saved session.
 */
@Slf4j
public class ConsoleDecisionProvider implements HumanDecisionProvider {

    private static final String RULE = "=".repeat(60);

    private final ConsoleIO console;

    public ConsoleDecisionProvider(ConsoleIO console) {
        this.console = console;
    }

    @Override
    public Optional<ApprovalDecision> decide(PendingAction action) {
        console.println("");
        console.println(RULE);
        console.println("Please review before the report is created");
        console.println(RULE);
        console.println(action.summary());
        console.println(RULE);
        console.println("  1. Approve and create the report");
        console.println("  2. Request changes");
        console.println("  3. Cancel");

        while (true) {
            String choice = console.readLine("Choice (1-3): ");
            if (choice == null) {
                log.info("Console closed while {} was awaiting a decision", action.actionId());
                return Optional.empty();
            }
            switch (choice.trim()) {
                case "1":
                    return Optional.of(ApprovalDecision.approve());
                case "2":
                    return readFeedback();
                case "3":
                    return Optional.of(ApprovalDecision.cancel());
                default:
                    console.println("Please enter 1, 2 or 3.");
            }
        }
    }

    private Optional<ApprovalDecision> readFeedback() {
        while (true) {
            String feedback = console.readLine("What should be changed? ");
            if (feedback == null) {
                return Optional.empty();
            }
            if (!feedback.isBlank()) {
                return Optional.of(ApprovalDecision.revise(feedback.trim()));
            }
            console.println("Feedback cannot be empty.");
        }
    }
}
