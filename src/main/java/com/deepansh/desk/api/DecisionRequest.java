package com.deepansh.desk.api;

import com.deepansh.desk.approval.ApprovalDecision;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DecisionRequest {

    @NotBlank(message = "actionId must not be blank")
    private String actionId;

    @NotNull(message = "kind must be APPROVE, REVISE or CANCEL")
    private ApprovalDecision.Kind kind;

    /** Required for REVISE. */
    private String feedback;
}
