package com.deepansh.desk.dispatch;

import com.deepansh.desk.exception.CollaboratorUnavailableException;
import com.deepansh.desk.exception.InvalidDecisionException;
import com.deepansh.desk.exception.LoopLimitExceededException;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts a failed turn into a safe, user-facing ERROR response.
 * Full detail goes to the log only.
 */
@Slf4j
public class TurnErrorHandler {

    static final String TOO_COMPLEX =
            "This request is too complex to handle in one step. Please simplify it or give the details in smaller parts.";
    static final String UNAVAILABLE =
            "The assistant is temporarily unavailable. Please try again in a moment.";
    static final String GENERIC =
            "Something went wrong while processing your request. Your answers so far are kept; please try again.";

    public DeskResponse toResponse(RuntimeException e, String sessionId, String activeWorker) {
        String message;
        if (e instanceof LoopLimitExceededException limit) {
            log.warn("Loop limit exceeded [session={}, handler={}, iterations={}]",
                    sessionId, limit.getHandlerName(), limit.getIterations());
            message = TOO_COMPLEX;
        } else if (e instanceof CollaboratorUnavailableException) {
            log.warn("Collaborator unavailable [session={}]", sessionId, e);
            message = UNAVAILABLE;
        } else if (e instanceof InvalidDecisionException) {
            log.warn("Invalid decision [session={}]: {}", sessionId, e.getMessage());
            message = e.getMessage();
        } else {
            log.error("Turn failed [session={}]", sessionId, e);
            message = GENERIC;
        }
        return DeskResponse.builder()
                .type(DeskResponse.Type.ERROR)
                .sessionId(sessionId)
                .activeWorker(activeWorker)
                .message(message)
                .build();
    }
}
