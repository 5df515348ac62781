package com.deepansh.desk.api;

import com.deepansh.desk.approval.ApprovalDecision;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.dispatch.ControlCommand;
import com.deepansh.desk.dispatch.DeskResponse;
import com.deepansh.desk.session.SessionRegistry;
import com.deepansh.desk.session.SessionRuntime;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST surface over the same per-session runtime the console uses.
 *
 * POST /api/v1/sessions                      start a session
 * GET  /api/v1/sessions/{id}                 current state and pending action
 * POST /api/v1/sessions/{id}/messages        one user input
 * POST /api/v1/sessions/{id}/identity        (re)identify the requester
 * POST /api/v1/sessions/{id}/decisions       approve / revise / cancel a pending action
 * GET  /api/v1/health
 */
@RestController
@Profile("server")
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionRegistry sessionRegistry;

    @PostMapping("/sessions")
    public ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        SessionRuntime runtime = sessionRegistry.create(request.getRequesterId(), request.getPrefix());
        log.info("Session created via API [sessionId={}]", runtime.getSessionId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(runtime));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionView> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRegistry.execute(sessionId, SessionView::of));
    }

    @PostMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<DeskResponse> message(@PathVariable String sessionId,
                                                @Valid @RequestBody MessageRequest request) {
        log.info("Message for session {}", sessionId);
        DeskResponse response = sessionRegistry.execute(sessionId, rt -> {
            if (answersIdentityPrompt(rt, request)) {
                return rt.getDispatcher().identify(request.getInput());
            }
            return rt.getDispatcher().handle(request.getInput(), contextOf(rt, request.getRequesterId()));
        });
        return ResponseEntity.ok(response);
    }

    @PostMapping("/sessions/{sessionId}/identity")
    public ResponseEntity<DeskResponse> identify(@PathVariable String sessionId,
                                                 @Valid @RequestBody IdentityRequest request) {
        log.info("Identity for session {}", sessionId);
        return ResponseEntity.ok(sessionRegistry.execute(sessionId,
                rt -> rt.getDispatcher().identify(request.getRequesterId())));
    }

    @PostMapping("/sessions/{sessionId}/decisions")
    public ResponseEntity<DeskResponse> decide(@PathVariable String sessionId,
                                               @Valid @RequestBody DecisionRequest request) {
        log.info("Decision {} for action {} [session={}]", request.getKind(), request.getActionId(), sessionId);
        ApprovalDecision decision = new ApprovalDecision(request.getKind(), request.getFeedback());
        DeskResponse response = sessionRegistry.execute(sessionId,
                rt -> rt.getDispatcher().decide(request.getActionId(), decision, contextOf(rt, null)));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    /**
     * While the session has no requester, a plain message (not a control
     * word) is the answer to the identity prompt, as on the console.
     */
    private static boolean answersIdentityPrompt(SessionRuntime runtime, MessageRequest request) {
        String input = request.getInput();
        return runtime.getSession().getRequesterId() == null
                && (request.getRequesterId() == null || request.getRequesterId().isBlank())
                && !input.isBlank()
                && ControlCommand.parse(input.trim()).isEmpty();
    }

    private static ContextBag contextOf(SessionRuntime runtime, String explicitRequester) {
        String requester = explicitRequester != null && !explicitRequester.isBlank()
                ? explicitRequester.trim()
                : runtime.getSession().getRequesterId();
        return requester == null ? ContextBag.empty() : ContextBag.of(ContextKeys.REQUESTER_ID, requester);
    }
}
