package com.deepansh.desk.dispatch;

import com.deepansh.desk.approval.ApprovalDecision;
import com.deepansh.desk.approval.ApprovalGate;
import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import com.deepansh.desk.exception.GateProtocolViolationException;
import com.deepansh.desk.exception.SessionCorruptException;
import com.deepansh.desk.history.TurnRole;
import com.deepansh.desk.session.Session;
import com.deepansh.desk.session.SessionStore;
import com.deepansh.desk.worker.Worker;
import com.deepansh.desk.worker.WorkerOutcome;
import com.deepansh.desk.worker.WorkerRegistry;
import com.deepansh.desk.worker.WorkerState;
import com.deepansh.desk.worker.WorkerStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Top-level orchestrator for one session.
 *
 * Per input:
 * 1. Handle control words (exit / reset) and empty input
 * 2. Require a requester identity before any routing
 * 3. Forward to the active Worker while it holds an unfinished task,
 *    otherwise classify and start the matching Worker
 * 4. Put any requested action through the approval gate and feed the
 *    decision back to the Worker until the round settles
 * 5. Persist the session, whatever happened
 *
 * Not thread-safe: callers serialize access per session (see SessionRegistry).
 */
@Slf4j
public class Dispatcher {

    static final String IDENTITY_PROMPT = "Please tell me your name before we start.";
    static final String RESET_MESSAGE = "Everything has been cleared. " + IDENTITY_PROMPT;
    static final String EXIT_MESSAGE = "Goodbye. Your session has been saved.";

    private final Session session;
    private final WorkerRegistry workers;
    private final IntentClassifier classifier;
    private final ApprovalGate gate;
    private final SessionStore store;
    private final TurnErrorHandler errorHandler;
    private final Clock clock;

    public Dispatcher(Session session,
                      WorkerRegistry workers,
                      IntentClassifier classifier,
                      ApprovalGate gate,
                      SessionStore store,
                      TurnErrorHandler errorHandler,
                      Clock clock) {
        this.session = session;
        this.workers = workers;
        this.classifier = classifier;
        this.gate = gate;
        this.store = store;
        this.errorHandler = errorHandler;
        this.clock = clock;
    }

    public Session session() {
        return session;
    }

    public DeskResponse handle(String input, ContextBag context) {
        String text = input == null ? "" : input.trim();
        if (text.isEmpty()) {
            return DeskResponse.of(DeskResponse.Type.IGNORED, session.getSessionId(), null);
        }

        Optional<ControlCommand> command = ControlCommand.parse(text);
        if (command.isPresent()) {
            return switch (command.get()) {
                case EXIT -> {
                    persist();
                    log.info("Session {} exit requested", session.getSessionId());
                    yield DeskResponse.of(DeskResponse.Type.EXIT, session.getSessionId(), EXIT_MESSAGE);
                }
                case RESET -> reset();
            };
        }

        if (session.getRequesterId() == null) {
            Optional<String> fromContext = context == null ? Optional.empty()
                    : context.get(ContextKeys.REQUESTER_ID).filter(s -> !s.isBlank());
            if (fromContext.isEmpty()) {
                return DeskResponse.of(DeskResponse.Type.IDENTITY_REQUIRED, session.getSessionId(), IDENTITY_PROMPT);
            }
            session.setRequesterId(fromContext.get());
        }

        ContextBag turnContext = turnContext(context);
        try {
            session.getDispatcherHistory().append(TurnRole.USER, text);
            Worker active = activeWorker();
            if (active == null || !active.isInProgress()) {
                Classification classification = classifier.classify(session.getDispatcherHistory());
                if (classification.kind() == Classification.Kind.CLARIFY) {
                    session.getDispatcherHistory().append(TurnRole.AGENT, classification.message());
                    return DeskResponse.of(DeskResponse.Type.CLARIFY, session.getSessionId(), classification.message());
                }
                active = startWorker(classification.workerType());
            }
            WorkerOutcome outcome = active.advance(text, workerContext(turnContext, active));
            return settle(active, outcome, turnContext);
        } catch (GateProtocolViolationException | SessionCorruptException e) {
            throw e;
        } catch (RuntimeException e) {
            return errorHandler.toResponse(e, session.getSessionId(), session.getActiveWorkerType());
        } finally {
            persist();
        }
    }

    /**
     * Applies a decision that arrived asynchronously for the action the
     * active Worker is waiting on.
     *
     * @throws GateProtocolViolationException if the action is unknown or already resolved
     */
    public DeskResponse decide(String actionId, ApprovalDecision decision, ContextBag context) {
        Worker active = activeWorker();
        PendingAction pending = active != null ? active.state().getPendingAction() : null;
        if (pending == null || !pending.actionId().equals(actionId)) {
            if (gate.isResolved(actionId)) {
                throw new GateProtocolViolationException("Action " + actionId + " has already been resolved");
            }
            throw new GateProtocolViolationException("No action " + actionId + " is awaiting a decision");
        }
        gate.resolve(pending, decision);

        ContextBag turnContext = turnContext(context);
        try {
            WorkerOutcome outcome = active.resolve(decision, workerContext(turnContext, active));
            return settle(active, outcome, turnContext);
        } catch (GateProtocolViolationException | SessionCorruptException e) {
            throw e;
        } catch (RuntimeException e) {
            return errorHandler.toResponse(e, session.getSessionId(), session.getActiveWorkerType());
        } finally {
            persist();
        }
    }

    /**
     * Picks up a reloaded session: an action left awaiting approval is
     * presented again, exactly as it was saved.
     */
    public DeskResponse resume(ContextBag context) {
        Optional<PendingAction> pending = pendingAction();
        if (pending.isEmpty()) {
            String worker = session.getActiveWorkerType();
            String message = worker == null
                    ? "Session resumed. What would you like to apply for?"
                    : "Session resumed. Let's continue where we left off.";
            return DeskResponse.builder()
                    .type(DeskResponse.Type.REPLY)
                    .sessionId(session.getSessionId())
                    .activeWorker(worker)
                    .message(message)
                    .build();
        }
        Worker active = activeWorker();
        ContextBag turnContext = turnContext(context);
        try {
            return settle(active, WorkerOutcome.actionRequested(pending.get(),
                    "Resuming: this application is waiting for a decision."), turnContext);
        } catch (GateProtocolViolationException | SessionCorruptException e) {
            throw e;
        } catch (RuntimeException e) {
            return errorHandler.toResponse(e, session.getSessionId(), session.getActiveWorkerType());
        } finally {
            persist();
        }
    }

    /** Records the requester identity, e.g. after a reset. */
    public DeskResponse identify(String requesterId) {
        if (requesterId == null || requesterId.isBlank()) {
            return DeskResponse.of(DeskResponse.Type.IDENTITY_REQUIRED, session.getSessionId(), IDENTITY_PROMPT);
        }
        session.setRequesterId(requesterId.trim());
        persist();
        return DeskResponse.of(DeskResponse.Type.REPLY, session.getSessionId(),
                "Thank you. What would you like to apply for? (travel expenses or a receipt)");
    }

    public Optional<PendingAction> pendingAction() {
        WorkerState state = session.getActiveWorkerState();
        if (state == null || state.getStatus() != WorkerStatus.AWAITING_APPROVAL) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.getPendingAction());
    }

    // ─── Internals ───────────────────────────────────────────────────────────

    private DeskResponse settle(Worker worker, WorkerOutcome outcome, ContextBag turnContext) {
        while (outcome.kind() == WorkerOutcome.Kind.ACTION_REQUESTED) {
            PendingAction action = outcome.pendingAction();
            persist();
            Optional<ApprovalDecision> decision = gate.submit(action);
            if (decision.isEmpty()) {
                String message = outcome.message() != null && !outcome.message().isBlank()
                        ? outcome.message()
                        : "Your application has been sent for approval.";
                session.getDispatcherHistory().append(TurnRole.AGENT, message);
                return DeskResponse.awaitingApproval(session.getSessionId(), worker.type(), action, message);
            }
            outcome = worker.resolve(decision.get(), workerContext(turnContext, worker));
        }

        if (outcome.message() != null && !outcome.message().isBlank()) {
            session.getDispatcherHistory().append(TurnRole.AGENT, outcome.message());
        }
        if (outcome.isTerminal()) {
            log.info("Worker [{}] finished as {} [session={}]", worker.type(), outcome.kind(), session.getSessionId());
            session.setActiveWorkerType(null);
        }

        DeskResponse.Type type = switch (outcome.kind()) {
            case REPLY -> DeskResponse.Type.REPLY;
            case COMPLETED -> DeskResponse.Type.COMPLETED;
            case CANCELLED -> DeskResponse.Type.CANCELLED;
            case RENDER_FAILED -> DeskResponse.Type.RENDER_FAILED;
            case ACTION_REQUESTED -> throw new IllegalStateException("unreachable");
        };
        return DeskResponse.builder()
                .type(type)
                .sessionId(session.getSessionId())
                .activeWorker(session.getActiveWorkerType())
                .message(outcome.message())
                .artifactLocation(outcome.artifactLocation())
                .build();
    }

    private DeskResponse reset() {
        for (WorkerState state : session.getWorkers().values()) {
            workers.restore(state).reset();
        }
        session.getWorkers().clear();
        session.setActiveWorkerType(null);
        session.setRequesterId(null);
        session.getDispatcherHistory().clear();
        session.getResolvedActionIds().clear();
        persist();
        log.info("Session {} reset", session.getSessionId());
        return DeskResponse.of(DeskResponse.Type.RESET, session.getSessionId(), RESET_MESSAGE);
    }

    private Worker activeWorker() {
        WorkerState state = session.getActiveWorkerState();
        return state == null ? null : workers.restore(state);
    }

    private Worker startWorker(String type) {
        Worker worker = workers.create(type);
        session.getWorkers().put(type, worker.state());
        session.setActiveWorkerType(type);
        log.info("Session {} started worker [{}]", session.getSessionId(), type);
        return worker;
    }

    /** Session-level values; explicit values from the caller win. */
    private ContextBag turnContext(ContextBag context) {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(ContextKeys.SESSION_ID, session.getSessionId());
        defaults.put(ContextKeys.REQUESTER_ID, session.getRequesterId());
        defaults.put(ContextKeys.APPLICATION_DATE, LocalDate.now(clock).toString());
        return ContextPropagator.fillMissing(context, defaults);
    }

    private static ContextBag workerContext(ContextBag turnContext, Worker worker) {
        return ContextPropagator.propagate(turnContext, ContextKeys.WORKER_TYPE, worker.type());
    }

    private void persist() {
        session.setUpdatedAt(clock.instant());
        store.save(session);
    }
}
