package com.deepansh.desk.worker;

import com.deepansh.desk.approval.ApprovalDecision;
import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.context.ContextBag;
import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import com.deepansh.desk.exception.GateProtocolViolationException;
import com.deepansh.desk.exception.LoopLimitExceededException;
import com.deepansh.desk.history.ConversationTurn;
import com.deepansh.desk.history.TurnRole;
import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolCall;
import com.deepansh.desk.model.ToolDefinition;
import com.deepansh.desk.render.RenderRequest;
import com.deepansh.desk.render.RenderResult;
import com.deepansh.desk.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Shared loop for Workers that fill a form through structured tool calls.
 *
 * Per turn:
 * 1. Record the user input in the worker's history window
 * 2. Ask the model, replaying the form state and the retained history
 * 3. Apply each tool call to the form, validating every value
 * 4. Stop on a text reply, or as soon as the form is ready
 * 5. When ready, snapshot the form into a PendingAction
 *
 * The Worker, not the model, decides readiness.
 */
@Slf4j
public abstract class AbstractFormWorker implements Worker {

    public static final String RECORD_FIELDS = "record_fields";
    public static final String CONFIRM_SUBMISSION = "confirm_submission";

    protected final WorkerState state;
    protected final WorkerServices services;

    /** Notes produced while applying tool calls in the current turn; never persisted. */
    protected final List<String> turnNotes = new ArrayList<>();

    protected AbstractFormWorker(WorkerState state, WorkerServices services) {
        this.state = state;
        this.services = services;
    }

    // ─── Hooks ───────────────────────────────────────────────────────────────

    protected abstract String actionName();

    protected abstract String systemPrompt();

    /** Request-level fields accepted by record_fields, in asking order. */
    protected abstract List<String> recordableFields();

    /** Required fields (and item fields) not yet collected. */
    protected abstract List<String> missingFields();

    protected abstract Map<String, Object> actionParameters();

    protected abstract String summarize(Map<String, Object> parameters);

    /** Re-runs the cross-field rules after any change. */
    protected abstract void recheck();

    /** Worker-specific tools beyond record_fields / confirm_submission. */
    protected List<ToolDefinition> extraTools() {
        return List.of();
    }

    /**
     * Handles a worker-specific tool.
     *
     * @return the observation, or null when the tool is unknown
     */
    protected String applyExtraTool(String name, Map<String, Object> args) {
        return null;
    }

    protected boolean itemsReady() {
        return true;
    }

    /** Closing question appended to a reply, e.g. whether another item follows. */
    protected String followUpQuestion() {
        return null;
    }

    // ─── Worker ──────────────────────────────────────────────────────────────

    @Override
    public WorkerState state() {
        return state;
    }

    @Override
    public WorkerOutcome advance(String input, ContextBag context) {
        if (state.getStatus() == WorkerStatus.AWAITING_APPROVAL && state.getPendingAction() != null) {
            return WorkerOutcome.actionRequested(state.getPendingAction(),
                    "This application is still waiting for a decision.");
        }
        if (state.getStatus().isTerminal()) {
            throw new IllegalStateException("Worker " + type() + " already finished as " + state.getStatus());
        }

        transition(WorkerStatus.COLLECTING_FIELDS);
        state.getHistory().append(TurnRole.USER, input);
        turnNotes.clear();

        int maxIterations = services.properties().getLoop().getMaxIterations();
        try {
            for (int i = 0; i < maxIterations; i++) {
                log.debug("Worker [{}] iteration {}/{}", type(), i + 1, maxIterations);
                LlmResponse response = services.llmClient().chat(buildMessages(), tools());

                if (!response.isToolCallRequired() || response.getToolCall() == null) {
                    String text = response.getContent() != null ? response.getContent().trim() : "";
                    if (!text.isEmpty()) {
                        state.getHistory().append(TurnRole.AGENT, text);
                    }
                    return finishTurn(text);
                }

                ToolCall call = response.getToolCall();
                log.info("Worker [{}] applying {} [iteration={}]", type(), call.getToolName(), i + 1);
                String observation = applyTool(call);
                state.getHistory().append(TurnRole.TOOL, call.getToolName() + ": " + observation);

                if (isReady()) {
                    return finishTurn("");
                }
            }
            throw new LoopLimitExceededException(type(), maxIterations, maxIterations);
        } catch (RuntimeException e) {
            transition(WorkerStatus.ERROR);
            transition(WorkerStatus.IDLE);
            throw e;
        }
    }

    @Override
    public WorkerOutcome resolve(ApprovalDecision decision, ContextBag context) {
        PendingAction action = state.getPendingAction();
        if (state.getStatus() != WorkerStatus.AWAITING_APPROVAL || action == null) {
            throw new GateProtocolViolationException(
                    "Worker " + type() + " is not awaiting approval (status " + state.getStatus() + ")");
        }
        state.getHistory().unpinAll();
        state.setPendingAction(null);

        return switch (decision.kind()) {
            case APPROVE -> renderApproved(action, context);
            case REVISE -> {
                state.setRevisionPending(true);
                transition(WorkerStatus.COLLECTING_FIELDS);
                yield advance(decision.feedback(), context);
            }
            case CANCEL -> {
                transition(WorkerStatus.CANCELLED);
                state.getHistory().append(TurnRole.AGENT, "Application cancelled by the reviewer.");
                yield WorkerOutcome.cancelled("The application was cancelled. Nothing was submitted.");
            }
        };
    }

    @Override
    public void reset() {
        state.getFields().clear();
        state.getItems().clear();
        state.getValidationErrors().clear();
        state.setItemsConfirmed(false);
        state.setAwaitingMoreItemsAnswer(false);
        state.setRevisionPending(false);
        state.setPendingAction(null);
        state.setLastArtifact(null);
        state.getHistory().clear();
        transition(WorkerStatus.IDLE);
    }

    @Override
    public boolean isInProgress() {
        WorkerStatus status = state.getStatus();
        if (status.isTerminal()) {
            return false;
        }
        return status != WorkerStatus.IDLE || state.hasCollectedData();
    }

    public boolean isReady() {
        return missingFields().isEmpty()
                && state.getValidationErrors().isEmpty()
                && !state.isRevisionPending()
                && itemsReady();
    }

    // ─── Turn handling ───────────────────────────────────────────────────────

    private WorkerOutcome finishTurn(String modelText) {
        if (isReady()) {
            return requestAction(modelText);
        }
        return WorkerOutcome.reply(composeReply(modelText));
    }

    private WorkerOutcome requestAction(String modelText) {
        transition(WorkerStatus.READY_FOR_ACTION);
        Map<String, Object> parameters = actionParameters();
        PendingAction action = new PendingAction(
                UUID.randomUUID().toString(),
                actionName(),
                type(),
                parameters,
                summarize(parameters),
                services.clock().instant());
        state.setPendingAction(action);
        if (state.getHistory().getBound() > 1) {
            state.getHistory().pinLast(TurnRole.USER);
        }
        transition(WorkerStatus.AWAITING_APPROVAL);
        log.info("Worker [{}] requested {} [{}]", type(), action.actionName(), action.actionId());
        return WorkerOutcome.actionRequested(action, modelText);
    }

    private WorkerOutcome renderApproved(PendingAction action, ContextBag context) {
        ContextBag renderContext = ContextPropagator.propagate(context, ContextKeys.WORKER_TYPE, type());
        RenderResult result = services.renderer().render(
                new RenderRequest(action.actionName(), action.parameters(), renderContext));

        if (result.success()) {
            state.setLastArtifact(result.artifactLocation());
            transition(WorkerStatus.COMPLETED);
            state.getHistory().append(TurnRole.AGENT, "Report created.");
            return WorkerOutcome.completed("Your report has been created.", result.artifactLocation());
        }
        transition(WorkerStatus.READY_FOR_ACTION);
        log.warn("Worker [{}] render failed for [{}]: {}", type(), action.actionId(), result.errorMessage());
        return WorkerOutcome.renderFailed("The report could not be created: " + result.errorMessage()
                + " Your answers are kept; send any message to submit again.");
    }

    protected String composeReply(String modelText) {
        StringBuilder reply = new StringBuilder();
        if (modelText != null && !modelText.isBlank()) {
            reply.append(modelText.trim());
        } else {
            List<String> missing = missingFields();
            if (!missing.isEmpty()) {
                reply.append("Please provide: ").append(String.join(", ", missing)).append('.');
            } else if (state.isRevisionPending()) {
                reply.append("What would you like to change? Say so if everything is correct as it is.");
            }
        }
        if (!state.getValidationErrors().isEmpty()) {
            appendLine(reply, "Please check the following:");
            state.getValidationErrors().forEach((field, error) ->
                    appendLine(reply, "- " + field + ": " + error));
        }
        turnNotes.forEach(note -> appendLine(reply, note));
        String question = followUpQuestion();
        if (question != null && !reply.toString().contains(question)) {
            appendLine(reply, question);
        }
        return reply.toString();
    }

    private static void appendLine(StringBuilder sb, String line) {
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(line);
    }

    // ─── Tools ───────────────────────────────────────────────────────────────

    protected List<ToolDefinition> tools() {
        List<ToolDefinition> tools = new ArrayList<>();
        Map<String, String> props = new LinkedHashMap<>();
        recordableFields().forEach(f -> props.put(f, describeField(f)));
        tools.add(ToolDefinition.builder()
                .name(RECORD_FIELDS)
                .description("Record one or more application fields stated by the user.")
                .inputSchema(ToolDefinition.objectSchema(props, List.of()))
                .build());
        tools.add(ToolDefinition.builder()
                .name(CONFIRM_SUBMISSION)
                .description("The user confirmed that the application is correct as it stands.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(), List.of()))
                .build());
        tools.addAll(extraTools());
        return tools;
    }

    protected String describeField(String field) {
        return switch (field) {
            case "date" -> "Date in YYYY-MM-DD format";
            case "amount" -> "Amount in yen";
            case "managerApproved" -> "Whether the manager approved in advance (yes/no)";
            case "expenseCategory" -> "office supplies, lodging, certification or other";
            case "items" -> "Purchased items, comma separated";
            default -> field;
        };
    }

    private String applyTool(ToolCall call) {
        Map<String, Object> args = call.argumentsOrEmpty();
        String name = call.nameOrEmpty();
        return switch (name) {
            case RECORD_FIELDS -> recordFields(args);
            case CONFIRM_SUBMISSION -> confirmSubmission();
            default -> {
                String observation = applyExtraTool(name, args);
                yield observation != null ? observation : "ERROR: unknown action '" + name + "'";
            }
        };
    }

    private String recordFields(Map<String, Object> args) {
        List<String> recorded = new ArrayList<>();
        List<String> ignored = new ArrayList<>();
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String field = entry.getKey();
            if (!recordableFields().contains(field)) {
                ignored.add(field);
                continue;
            }
            if (setField(field, entry.getValue())) {
                recorded.add(field);
            }
        }
        recheck();
        StringBuilder obs = new StringBuilder();
        obs.append(recorded.isEmpty() ? "Nothing recorded." : "Recorded: " + String.join(", ", recorded) + ".");
        if (!ignored.isEmpty()) {
            obs.append(" Unknown fields ignored: ").append(String.join(", ", ignored)).append('.');
        }
        return obs.append(stateLine()).toString();
    }

    /**
     * Validates and stores one request-level field.
     *
     * @return true when the value was accepted
     */
    protected boolean setField(String field, Object value) {
        ValidationResult result = services.validator().validate(field, value);
        if (result.valid()) {
            state.getFields().put(field, result.value());
            state.getValidationErrors().remove(field);
            markChanged();
            return true;
        }
        state.getFields().remove(field);
        state.getValidationErrors().put(field, result.error());
        return false;
    }

    private String confirmSubmission() {
        state.setRevisionPending(false);
        recheck();
        if (isReady()) {
            return "Confirmed.";
        }
        return "Cannot confirm yet." + stateLine();
    }

    protected void markChanged() {
        state.setRevisionPending(false);
    }

    protected String stateLine() {
        StringBuilder sb = new StringBuilder();
        List<String> missing = missingFields();
        if (!missing.isEmpty()) {
            sb.append(" Still missing: ").append(String.join(", ", missing)).append('.');
        }
        if (!state.getValidationErrors().isEmpty()) {
            sb.append(" Problems: ");
            state.getValidationErrors().forEach((k, v) -> sb.append(k).append(" (").append(v).append(") "));
        }
        return sb.toString();
    }

    // ─── Prompt ──────────────────────────────────────────────────────────────

    private List<Message> buildMessages() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt()
                + "\nToday is " + LocalDate.now(services.clock()) + "."
                + "\nThe applicant is already identified; never ask for their name."));
        messages.add(Message.system("Current application state: " + describeState()));
        for (ConversationTurn turn : state.getHistory().getTurns()) {
            messages.add(switch (turn.role()) {
                case USER -> Message.user(turn.content());
                case AGENT -> Message.assistant(turn.content());
                case TOOL -> Message.system("Result of " + turn.content());
            });
        }
        return messages;
    }

    protected String describeState() {
        StringBuilder sb = new StringBuilder();
        sb.append("fields=").append(state.getFields());
        if (!state.getItems().isEmpty()) {
            sb.append(", items=").append(state.getItems());
        }
        sb.append(stateLine());
        if (state.isRevisionPending()) {
            sb.append(" The reviewer asked for changes; apply them or confirm the application as is.");
        }
        return sb.toString();
    }

    // ─── State machine ───────────────────────────────────────────────────────

    protected void transition(WorkerStatus to) {
        WorkerStatus from = state.getStatus();
        if (from != to) {
            log.info("Worker [{}] {} -> {}", type(), from, to);
        }
        state.setStatus(to);
        state.setUpdatedAt(services.clock().instant());
    }
}
