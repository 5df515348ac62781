package com.deepansh.desk.worker;

import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.history.TurnRole;
import com.deepansh.desk.support.CapturingRenderer;
import com.deepansh.desk.support.DeskFixtures;
import com.deepansh.desk.support.ScriptedLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReceiptExpenseWorkerTest {

    private ScriptedLlmClient llm;
    private ReceiptExpenseWorker worker;

    @BeforeEach
    void setUp() {
        llm = new ScriptedLlmClient();
        WorkerState state = WorkerState.fresh(ReceiptExpenseWorker.TYPE, 15, DeskFixtures.CLOCK.instant());
        worker = new ReceiptExpenseWorker(state, DeskFixtures.services(llm, new CapturingRenderer()));
    }

    @Test
    void advance_allFieldsInOneMessage_requestsActionImmediately() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, receipt("3,200"));

        WorkerOutcome outcome = worker.advance("Bought a Java book at Maruzen for 3,200 yen today, for study",
                ContextBag.empty());

        assertThat(outcome.kind()).isEqualTo(WorkerOutcome.Kind.ACTION_REQUESTED);
        PendingAction action = outcome.pendingAction();
        assertThat(action.actionName()).isEqualTo(ReceiptExpenseWorker.ACTION);
        assertThat(action.totalAmount()).isEqualTo(3200L);
        assertThat(action.parameters()).containsEntry("expenseCategory", "OFFICE_SUPPLIES")
                .containsEntry("items", "Java book");
        assertThat(action.summary()).contains("Maruzen").contains("3,200 yen").contains("Office supplies")
                .contains("not required");
        assertThat(llm.requests()).hasSize(1);
    }

    @Test
    void advance_amountAboveThreshold_asksForManagerApproval() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, receipt("8000")).text("");

        WorkerOutcome outcome = worker.advance("Hotel receipt", ContextBag.empty());

        assertThat(outcome.kind()).isEqualTo(WorkerOutcome.Kind.REPLY);
        assertThat(outcome.message()).isEqualTo("Please provide: managerApproved.");
    }

    @Test
    void advance_managerDeclined_blocksSubmission() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, receipt("8000")).text("")
                .tool(AbstractFormWorker.RECORD_FIELDS, Map.of("managerApproved", "no")).text("Understood.");

        worker.advance("Hotel receipt", ContextBag.empty());
        WorkerOutcome outcome = worker.advance("No, not approved yet", ContextBag.empty());

        assertThat(outcome.kind()).isEqualTo(WorkerOutcome.Kind.REPLY);
        assertThat(outcome.message()).contains("Understood.").contains("manager's approval");
        assertThat(worker.isReady()).isFalse();
    }

    @Test
    void advance_invalidValue_isReportedAndNotStored() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, Map.of("amount", "40000", "storeName", "Yodobashi")).text("");

        WorkerOutcome outcome = worker.advance("40000 yen at Yodobashi", ContextBag.empty());

        assertThat(worker.state().getFields()).containsKey("storeName").doesNotContainKey("amount");
        assertThat(outcome.message()).contains("Please check the following:").contains("- amount:");
    }

    @Test
    void recordFields_unknownField_isIgnoredAndReported() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, Map.of("color", "red")).text("");

        worker.advance("it was red", ContextBag.empty());

        assertThat(worker.state().getFields()).isEmpty();
        assertThat(worker.state().getHistory().getTurns())
                .anyMatch(t -> t.role() == TurnRole.TOOL && t.content().contains("Unknown fields ignored: color"));
    }

    @Test
    void reset_clearsFieldsAndHistory() {
        llm.tool(AbstractFormWorker.RECORD_FIELDS, Map.of("storeName", "Maruzen")).text("");
        worker.advance("Maruzen", ContextBag.empty());

        worker.reset();

        assertThat(worker.state().getFields()).isEmpty();
        assertThat(worker.state().getHistory().size()).isZero();
        assertThat(worker.state().getStatus()).isEqualTo(WorkerStatus.IDLE);
        assertThat(worker.isInProgress()).isFalse();
    }

    private static Map<String, Object> receipt(String amount) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("storeName", "Maruzen");
        args.put("amount", amount);
        args.put("date", "2026-10-19");
        args.put("items", List.of("Java book"));
        args.put("expenseCategory", "books");
        args.put("purpose", "Study");
        return args;
    }
}
