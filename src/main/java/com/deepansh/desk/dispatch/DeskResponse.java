package com.deepansh.desk.dispatch;

import com.deepansh.desk.approval.PendingAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the Dispatcher hands back to a surface (console or REST) after one input.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeskResponse {

    public enum Type {
        REPLY,
        CLARIFY,
        AWAITING_APPROVAL,
        COMPLETED,
        CANCELLED,
        RENDER_FAILED,
        ERROR,
        RESET,
        EXIT,
        IGNORED,
        IDENTITY_REQUIRED
    }

    private Type type;
    private String sessionId;
    private String message;
    private String activeWorker;

    /** Present when type = AWAITING_APPROVAL */
    private String actionId;
    private String actionSummary;

    /** Present when type = COMPLETED */
    private String artifactLocation;

    public static DeskResponse of(Type type, String sessionId, String message) {
        return DeskResponse.builder().type(type).sessionId(sessionId).message(message).build();
    }

    public static DeskResponse awaitingApproval(String sessionId, String workerType,
                                                PendingAction action, String message) {
        return DeskResponse.builder()
                .type(Type.AWAITING_APPROVAL)
                .sessionId(sessionId)
                .activeWorker(workerType)
                .actionId(action.actionId())
                .actionSummary(action.summary())
                .message(message)
                .build();
    }
}
