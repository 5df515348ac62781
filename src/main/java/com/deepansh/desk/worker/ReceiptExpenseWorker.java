package com.deepansh.desk.worker;

import com.deepansh.desk.approval.PendingAction;
import com.deepansh.desk.validation.ExpenseCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Receipt expenses: a single purchase described by one receipt.
 */
public class ReceiptExpenseWorker extends AbstractFormWorker {

    public static final String TYPE = "receipt_expense";
    public static final String ACTION = "receipt_expense_report";

    private static final List<String> FIELDS = List.of(
            "storeName", "amount", "date", "items", "expenseCategory", "purpose", "managerApproved");

    private static final String PROMPT = """
            You help an employee file an expense application for a purchase with a receipt.
            Collect: store name, amount in yen, purchase date, purchased items, expense category \
            (office supplies, lodging, certification or other) and the purpose.
            Choose the category yourself from the items when it is obvious, otherwise ask.
            If the amount is above the manager-approval threshold, ask whether the manager approved in advance.
            Call record_fields as soon as the user states any of these.
            When the reviewer asked for changes, apply them; if the user says everything is correct, \
            call confirm_submission.
            Keep replies short and ask for one missing thing at a time.
            """;

    public ReceiptExpenseWorker(WorkerState state, WorkerServices services) {
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
        return FIELDS;
    }

    @Override
    protected List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        for (String field : FIELDS) {
            if ("managerApproved".equals(field)) {
                continue;
            }
            if (state.getFields().get(field) == null) {
                missing.add(field);
            }
        }
        if (services.validator().requiresManagerApproval(amount())
                && state.getFields().get("managerApproved") == null) {
            missing.add("managerApproved");
        }
        return missing;
    }

    @Override
    protected void recheck() {
        if (state.getFields().get("amount") == null) {
            state.getValidationErrors().remove("total");
            return;
        }
        String error = services.validator().checkTotal(amount(), (Boolean) state.getFields().get("managerApproved"));
        if (error != null) {
            state.getValidationErrors().put("total", error);
        } else {
            state.getValidationErrors().remove("total");
        }
    }

    @Override
    protected Map<String, Object> actionParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        for (String field : FIELDS) {
            params.put(field, state.getFields().get(field));
        }
        params.put(PendingAction.TOTAL_AMOUNT, amount());
        return params;
    }

    @Override
    protected String summarize(Map<String, Object> parameters) {
        Object category = parameters.get("expenseCategory");
        String categoryLabel = category == null ? "-" : ExpenseCategory.fromText(category.toString())
                .map(ExpenseCategory::label).orElse(category.toString());
        Object approved = parameters.get("managerApproved");
        return "Receipt expense application\n"
                + "Store: " + parameters.get("storeName") + '\n'
                + "Amount: " + String.format("%,d", amount()) + " yen\n"
                + "Date: " + parameters.get("date") + '\n'
                + "Items: " + parameters.get("items") + '\n'
                + "Category: " + categoryLabel + '\n'
                + "Purpose: " + parameters.get("purpose") + '\n'
                + "Manager pre-approval: "
                + (approved == null ? "not required" : (Boolean.TRUE.equals(approved) ? "yes" : "no"));
    }

    private long amount() {
        return state.getFields().get("amount") instanceof Number n ? n.longValue() : 0L;
    }
}
