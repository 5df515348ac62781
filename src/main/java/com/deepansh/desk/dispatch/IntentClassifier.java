package com.deepansh.desk.dispatch;

import com.deepansh.desk.history.ConversationTurn;
import com.deepansh.desk.history.HistoryWindow;
import com.deepansh.desk.llm.LlmClient;
import com.deepansh.desk.model.LlmResponse;
import com.deepansh.desk.model.Message;
import com.deepansh.desk.model.ToolCall;
import com.deepansh.desk.model.ToolDefinition;
import com.deepansh.desk.worker.WorkerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the model which worker type a request belongs to through the
 * {@code route_request} tool. Anything other than exactly one known type is
 * treated as ambiguous and turned into a clarifying question; the Dispatcher
 * never guesses.
 */
@Slf4j
public class IntentClassifier {

    public static final String ROUTE_REQUEST = "route_request";

    private final LlmClient llmClient;
    private final WorkerRegistry workers;

    public IntentClassifier(LlmClient llmClient, WorkerRegistry workers) {
        this.llmClient = llmClient;
        this.workers = workers;
    }

    public Classification classify(HistoryWindow history) {
        LlmResponse response = llmClient.chat(buildMessages(history), List.of(routeTool()));

        if (!response.isToolCallRequired() || response.getToolCall() == null) {
            String text = response.getContent();
            log.debug("Classifier answered with text, asking for clarification");
            return Classification.clarify(text != null && !text.isBlank() ? text.trim() : defaultQuestion());
        }

        ToolCall call = response.getToolCall();
        if (!ROUTE_REQUEST.equals(call.getToolName())) {
            log.warn("Classifier requested unexpected tool '{}'", call.getToolName());
            return Classification.clarify(defaultQuestion());
        }

        Object raw = call.argumentsOrEmpty().get("workerType");
        List<String> candidates = new ArrayList<>();
        if (raw instanceof Collection<?> many) {
            many.forEach(o -> candidates.add(String.valueOf(o).trim()));
        } else if (raw != null) {
            candidates.add(raw.toString().trim());
        }

        if (candidates.size() == 1 && workers.isKnown(candidates.get(0))) {
            log.info("Request routed to {}", candidates.get(0));
            return Classification.route(candidates.get(0));
        }
        log.info("Ambiguous classification {}, asking for clarification", candidates);
        return Classification.clarify(defaultQuestion());
    }

    private List<Message> buildMessages(HistoryWindow history) {
        String catalogue = workers.descriptions().entrySet().stream()
                .map(e -> "- " + e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));

        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("""
                You are the reception desk for employee expense applications.
                Decide which kind of application the user wants to file and call route_request \
                with exactly one workerType. If the request could be either kind, or is unrelated, \
                do not call the tool; ask one short clarifying question instead.
                Application kinds:
                """ + catalogue));
        for (ConversationTurn turn : history.getTurns()) {
            switch (turn.role()) {
                case USER -> messages.add(Message.user(turn.content()));
                case AGENT -> messages.add(Message.assistant(turn.content()));
                case TOOL -> messages.add(Message.system(turn.content()));
            }
        }
        return messages;
    }

    private ToolDefinition routeTool() {
        return ToolDefinition.builder()
                .name(ROUTE_REQUEST)
                .description("Hand the conversation to the handler for one kind of application.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("workerType", Map.of(
                                "type", "string",
                                "enum", List.copyOf(workers.types()),
                                "description", "Kind of application")),
                        "required", List.of("workerType")))
                .build();
    }

    String defaultQuestion() {
        return "Is this about transportation costs (travel expense) or a purchase with a receipt (receipt expense)?";
    }
}
