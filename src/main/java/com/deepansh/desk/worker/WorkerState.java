package com.deepansh.desk.worker;

import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.history.HistoryWindow;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable state of one task instance. Persisted verbatim inside the session
 * record; a Worker object is a stateless view over it.
 *
 * Validation error keys name the field, or {@code routes[n].field} for
 * per-item problems (n is 1-based).
 */
@Data
@NoArgsConstructor
public class WorkerState {

    private String workerType;
    private WorkerStatus status = WorkerStatus.IDLE;

    private Map<String, Object> fields = new LinkedHashMap<>();
    private List<Map<String, Object>> items = new ArrayList<>();
    private Map<String, String> validationErrors = new LinkedHashMap<>();

    /** The user said no further items follow. */
    private boolean itemsConfirmed;

    /** The last turn ended by asking whether another item follows. */
    private boolean awaitingMoreItemsAnswer;

    /** Set by a revise decision; cleared by a recorded change or an explicit confirmation. */
    private boolean revisionPending;

    private PendingAction pendingAction;
    private String lastArtifact;

    private HistoryWindow history;
    private Instant updatedAt;

    public static WorkerState fresh(String workerType, int historyBound, Instant now) {
        WorkerState state = new WorkerState();
        state.setWorkerType(workerType);
        state.setHistory(new HistoryWindow(historyBound));
        state.setUpdatedAt(now);
        return state;
    }

    @JsonIgnore
    public boolean hasCollectedData() {
        return !fields.isEmpty() || !items.isEmpty();
    }
}
