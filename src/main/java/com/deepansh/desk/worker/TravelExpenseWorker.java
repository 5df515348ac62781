package com.deepansh.desk.worker;

import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.model.ToolDefinition;
import com.deepansh.desk.validation.TransportType;
import com.deepansh.desk.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Travel expenses: one or more routes, collected one at a time.
 *
 * After each completed route the user is asked whether another one follows;
 * the form is only ready once they say no (finish_routes). Routes can be
 * edited by their 1-based number or removed. A route without a stated cost
 * is priced from the fare table.
 */
@Slf4j
public class TravelExpenseWorker extends AbstractFormWorker {

    public static final String TYPE = "travel_expense";
    public static final String ACTION = "travel_expense_report";

    public static final String RECORD_ROUTE = "record_route";
    public static final String REMOVE_ROUTE = "remove_route";
    public static final String FINISH_ROUTES = "finish_routes";

    static final List<String> ROUTE_FIELDS = List.of("departure", "destination", "date", "transportType", "cost");

    private static final String FARE_SOURCE = "fareSource";
    private static final String ANOTHER_ROUTE = "Is there another route to add?";

    private static final String PROMPT = """
            You help an employee file a travel expense application.
            Collect each route (leg) one at a time: departure, destination, date, transport type \
            (train, bus, taxi or airplane) and cost. The cost may be omitted; it is looked up from the fare table.
            Call record_route as soon as the user states any route detail. Pass index only to edit an \
            earlier route. Call remove_route to delete a route.
            After each route, the application asks whether another route follows. When the user says \
            there are no more routes, call finish_routes.
            Also collect the purpose of the trip with record_fields. If the total is above the \
            manager-approval threshold, ask whether the manager approved in advance.
            When the reviewer asked for changes, apply them; if the user says everything is correct, \
            call confirm_submission.
            Keep replies short and ask for one missing thing at a time.
            """;

    public TravelExpenseWorker(WorkerState state, WorkerServices services) {
        super(state, services);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected String actionName() {
        return ACTION;
    }

    @Override
    protected String systemPrompt() {
        return PROMPT;
    }

    @Override
    protected List<String> recordableFields() {
        return List.of("purpose", "managerApproved");
    }

    @Override
    protected List<ToolDefinition> extraTools() {
        Map<String, String> routeProps = new LinkedHashMap<>();
        routeProps.put("index", "1-based number of an existing route to edit; omit for the current or a new route");
        routeProps.put("departure", "Departure station or place");
        routeProps.put("destination", "Destination station or place");
        routeProps.put("date", "Travel date in YYYY-MM-DD format");
        routeProps.put("transportType", "train, bus, taxi or airplane");
        routeProps.put("cost", "Cost in yen, only if the user stated it");
        return List.of(
                ToolDefinition.builder()
                        .name(RECORD_ROUTE)
                        .description("Record details of one route.")
                        .inputSchema(ToolDefinition.objectSchema(routeProps, List.of()))
                        .build(),
                ToolDefinition.builder()
                        .name(REMOVE_ROUTE)
                        .description("Delete a route by its 1-based number.")
                        .inputSchema(ToolDefinition.objectSchema(
                                Map.of("index", "1-based route number"), List.of("index")))
                        .build(),
                ToolDefinition.builder()
                        .name(FINISH_ROUTES)
                        .description("The user confirmed there are no more routes to add.")
                        .inputSchema(ToolDefinition.objectSchema(Map.of(), List.of()))
                        .build());
    }

    @Override
    protected String applyExtraTool(String name, Map<String, Object> args) {
        return switch (name) {
            case RECORD_ROUTE -> recordRoute(args);
            case REMOVE_ROUTE -> removeRoute(args);
            case FINISH_ROUTES -> finishRoutes();
            default -> null;
        };
    }

    // ─── Routes ──────────────────────────────────────────────────────────────

    private String recordRoute(Map<String, Object> args) {
        List<Map<String, Object>> routes = state.getItems();
        Integer requested = parseIndex(args.get("index"));
        int position;
        boolean appended = false;

        if (requested != null) {
            if (requested < 1 || requested > routes.size() + 1) {
                return "ERROR: there is no route " + requested + ". Routes recorded: " + routes.size() + ".";
            }
            if (requested == routes.size() + 1) {
                routes.add(new LinkedHashMap<>());
                appended = true;
            }
            position = requested;
        } else {
            int incomplete = lastIncomplete();
            if (incomplete > 0) {
                position = incomplete;
            } else {
                routes.add(new LinkedHashMap<>());
                appended = true;
                position = routes.size();
            }
        }
        if (appended) {
            state.setItemsConfirmed(false);
            state.setAwaitingMoreItemsAnswer(false);
        }

        Map<String, Object> route = routes.get(position - 1);
        boolean wasComplete = isComplete(position);
        List<String> recorded = new ArrayList<>();

        for (String field : ROUTE_FIELDS) {
            Object value = args.get(field);
            if (value == null || value.toString().isBlank()) {
                continue;
            }
            String key = itemKey(position, field);
            ValidationResult result = services.validator().validate(field, value);
            if (result.valid()) {
                route.put(field, result.value());
                state.getValidationErrors().remove(key);
                recorded.add(field);
                if ("cost".equals(field)) {
                    route.put(FARE_SOURCE, "stated");
                }
            } else {
                route.remove(field);
                state.getValidationErrors().put(key, result.error());
            }
        }

        applyFare(position, route, recorded.contains("cost"));
        checkCommuterPass(position, route);
        if (!recorded.isEmpty()) {
            markChanged();
        }
        recheck();

        if (isComplete(position) && !wasComplete && !state.isItemsConfirmed()) {
            state.setAwaitingMoreItemsAnswer(true);
            turnNotes.add("Route " + position + " recorded: " + describeRoute(route) + ".");
        }

        String head = recorded.isEmpty()
                ? "Route " + position + ": nothing recorded."
                : "Route " + position + ": recorded " + String.join(", ", recorded) + ".";
        return head + stateLine();
    }

    private void applyFare(int position, Map<String, Object> route, boolean costStated) {
        if (costStated) {
            return;
        }
        boolean tableOwned = route.get("cost") == null || "table".equals(route.get(FARE_SOURCE));
        Optional<TransportType> transport = TransportType.fromText((String) route.get("transportType"));
        if (!tableOwned || transport.isEmpty()) {
            return;
        }
        String departure = (String) route.get("departure");
        String destination = (String) route.get("destination");
        String costKey = itemKey(position, "cost");

        Optional<Long> fare = services.fareTable().lookup(departure, destination, transport.get());
        if (fare.isPresent()) {
            route.put("cost", fare.get());
            route.put(FARE_SOURCE, "table");
            state.getValidationErrors().remove(costKey);
        } else if (transport.get() == TransportType.TRAIN && departure != null && destination != null) {
            route.remove("cost");
            route.remove(FARE_SOURCE);
            state.getValidationErrors().put(costKey, "No train fare on file for " + departure + " - "
                    + destination + "; please state the amount.");
        }
    }

    private void checkCommuterPass(int position, Map<String, Object> route) {
        String key = "routes[" + position + "]";
        String error = services.validator().checkCommuterOverlap(
                (String) route.get("departure"), (String) route.get("destination"),
                (String) route.get("transportType"));
        if (error != null) {
            state.getValidationErrors().put(key, error);
        } else {
            state.getValidationErrors().remove(key);
        }
    }

    private String removeRoute(Map<String, Object> args) {
        Integer index = parseIndex(args.get("index"));
        List<Map<String, Object>> routes = state.getItems();
        if (index == null || index < 1 || index > routes.size()) {
            return "ERROR: there is no route " + args.get("index") + ". Routes recorded: " + routes.size() + ".";
        }
        routes.remove(index - 1);
        shiftItemErrors(index);
        if (routes.isEmpty()) {
            state.setItemsConfirmed(false);
            state.setAwaitingMoreItemsAnswer(false);
        }
        markChanged();
        recheck();
        return "Route " + index + " removed. Routes remaining: " + routes.size() + "." + stateLine();
    }

    private String finishRoutes() {
        List<Map<String, Object>> routes = state.getItems();
        if (routes.isEmpty()) {
            return "ERROR: no routes have been recorded yet.";
        }
        for (int i = 1; i <= routes.size(); i++) {
            if (!isComplete(i)) {
                return "ERROR: route " + i + " is incomplete." + stateLine();
            }
        }
        state.setItemsConfirmed(true);
        state.setAwaitingMoreItemsAnswer(false);
        recheck();
        return "All " + routes.size() + " routes confirmed. Total " + String.format("%,d", total()) + " yen."
                + stateLine();
    }

    /** Shifts per-route error keys after the route at {@code removed} was deleted. */
    private void shiftItemErrors(int removed) {
        Map<String, String> shifted = new LinkedHashMap<>();
        state.getValidationErrors().forEach((key, error) -> {
            int n = itemNumber(key);
            if (n < 0 || n < removed) {
                shifted.put(key, error);
            } else if (n > removed) {
                shifted.put(key.replaceFirst("^routes\\[" + n + "]", "routes[" + (n - 1) + "]"), error);
            }
        });
        state.getValidationErrors().clear();
        state.getValidationErrors().putAll(shifted);
    }

    // ─── Form rules ──────────────────────────────────────────────────────────

    @Override
    protected void recheck() {
        if (state.getItems().isEmpty()) {
            state.getValidationErrors().remove("total");
            return;
        }
        String error = services.validator().checkTotal(total(), (Boolean) state.getFields().get("managerApproved"));
        if (error != null) {
            state.getValidationErrors().put("total", error);
        } else {
            state.getValidationErrors().remove("total");
        }
    }

    @Override
    protected List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        List<Map<String, Object>> routes = state.getItems();
        if (routes.isEmpty()) {
            missing.add("route details (departure, destination, date, transport type)");
        }
        for (int i = 1; i <= routes.size(); i++) {
            Map<String, Object> route = routes.get(i - 1);
            for (String field : ROUTE_FIELDS) {
                if (route.get(field) == null) {
                    missing.add(itemKey(i, field));
                }
            }
        }
        if (state.getFields().get("purpose") == null) {
            missing.add("purpose");
        }
        if (services.validator().requiresManagerApproval(total())
                && state.getFields().get("managerApproved") == null) {
            missing.add("managerApproved");
        }
        return missing;
    }

    @Override
    protected boolean itemsReady() {
        if (state.getItems().isEmpty() || !state.isItemsConfirmed()) {
            return false;
        }
        for (int i = 1; i <= state.getItems().size(); i++) {
            if (!isComplete(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected String followUpQuestion() {
        return state.isAwaitingMoreItemsAnswer() && !state.isItemsConfirmed() ? ANOTHER_ROUTE : null;
    }

    @Override
    protected Map<String, Object> actionParameters() {
        List<Map<String, Object>> routes = new ArrayList<>();
        for (Map<String, Object> route : state.getItems()) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ROUTE_FIELDS.forEach(f -> copy.put(f, route.get(f)));
            routes.add(copy);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("routes", routes);
        params.put("purpose", state.getFields().get("purpose"));
        params.put("managerApproved", state.getFields().get("managerApproved"));
        params.put(PendingAction.TOTAL_AMOUNT, total());
        return params;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected String summarize(Map<String, Object> parameters) {
        List<Map<String, Object>> routes = (List<Map<String, Object>>) parameters.get("routes");
        StringBuilder sb = new StringBuilder();
        sb.append("Travel expense application\n");
        sb.append("Routes: ").append(routes.size()).append('\n');
        for (int i = 0; i < routes.size(); i++) {
            sb.append("  ").append(i + 1).append(". ").append(describeRoute(routes.get(i))).append('\n');
        }
        sb.append("Purpose: ").append(parameters.get("purpose")).append('\n');
        Object approved = parameters.get("managerApproved");
        sb.append("Manager pre-approval: ")
                .append(approved == null ? "not required" : (Boolean.TRUE.equals(approved) ? "yes" : "no"))
                .append('\n');
        sb.append("Total: ").append(String.format("%,d", ((Number) parameters.get(
                PendingAction.TOTAL_AMOUNT)).longValue())).append(" yen");
        return sb.toString();
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    long total() {
        long sum = 0;
        for (Map<String, Object> route : state.getItems()) {
            if (route.get("cost") instanceof Number n) {
                sum += n.longValue();
            }
        }
        return sum;
    }

    private boolean isComplete(int position) {
        Map<String, Object> route = state.getItems().get(position - 1);
        for (String field : ROUTE_FIELDS) {
            if (route.get(field) == null) {
                return false;
            }
        }
        String prefix = "routes[" + position + "]";
        return state.getValidationErrors().keySet().stream().noneMatch(k -> k.startsWith(prefix));
    }

    private int lastIncomplete() {
        List<Map<String, Object>> routes = state.getItems();
        for (int i = routes.size(); i >= 1; i--) {
            Map<String, Object> route = routes.get(i - 1);
            if (ROUTE_FIELDS.stream().anyMatch(f -> route.get(f) == null)) {
                return i;
            }
        }
        return -1;
    }

    private static String describeRoute(Map<String, Object> route) {
        Object cost = route.get("cost");
        return route.get("departure") + " - " + route.get("destination") + ", " + route.get("date") + ", "
                + route.get("transportType") + ", "
                + (cost instanceof Number n ? String.format("%,d", n.longValue()) : "?") + " yen";
    }

    private static String itemKey(int position, String field) {
        return "routes[" + position + "]." + field;
    }

    private static int itemNumber(String key) {
        if (!key.startsWith("routes[")) {
            return -1;
        }
        int end = key.indexOf(']');
        try {
            return Integer.parseInt(key.substring("routes[".length(), end));
        } catch (RuntimeException e) {
            return -1;
        }
    }

    private static Integer parseIndex(Object raw) {
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw == null || raw.toString().isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric route index '{}'", raw);
            return null;
        }
    }
}
