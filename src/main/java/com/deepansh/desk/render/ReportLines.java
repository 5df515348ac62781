package com.deepansh.desk.render;

import com.deepansh.desk.context.ContextKeys;
import com.deepansh.desk.context.ContextPropagator;
import com.deepansh.desk.validation.ExpenseCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain-text layout of an expense report, shared by the PDF renderer.
 */
final class ReportLines {

    private ReportLines() {
    }

    static String title(String actionName) {
        return switch (actionName) {
            case "travel_expense_report" -> "Travel Expense Report";
            case "receipt_expense_report" -> "Receipt Expense Report";
            default -> actionName;
        };
    }

    @SuppressWarnings("unchecked")
    static List<String> lines(RenderRequest request, String applicant) {
        Map<String, Object> p = request.parameters();
        List<String> out = new ArrayList<>();
        out.add("Applicant: " + applicant);
        out.add("Application date: " + ContextPropagator.valueOf(
                request.context(), ContextKeys.APPLICATION_DATE, "-"));
        out.add("");

        Object routes = p.get("routes");
        if (routes instanceof List<?> list) {
            int i = 1;
            for (Object o : list) {
                Map<String, Object> r = (Map<String, Object>) o;
                out.add(String.format("Route %d: %s - %s", i++, r.get("departure"), r.get("destination")));
                out.add(String.format("    %s, %s, %s yen", r.get("date"), r.get("transportType"),
                        formatYen(r.get("cost"))));
            }
            out.add("");
        } else {
            addIfPresent(out, "Store", p.get("storeName"));
            addIfPresent(out, "Date", p.get("date"));
            addIfPresent(out, "Items", p.get("items"));
            Object category = p.get("expenseCategory");
            if (category != null) {
                String label = ExpenseCategory.fromText(category.toString())
                        .map(ExpenseCategory::label).orElse(category.toString());
                out.add("Category: " + label);
            }
        }

        addIfPresent(out, "Purpose", p.get("purpose"));
        Object approved = p.get("managerApproved");
        if (approved != null) {
            out.add("Manager pre-approval: " + (Boolean.TRUE.equals(approved) ? "yes" : "no"));
        }
        out.add("Total: " + formatYen(p.get("totalAmount")) + " yen");
        return out;
    }

    static String formatYen(Object amount) {
        if (amount instanceof Number n) {
            return String.format("%,d", n.longValue());
        }
        return amount == null ? "-" : amount.toString();
    }

    private static void addIfPresent(List<String> out, String label, Object value) {
        if (value != null && !value.toString().isBlank()) {
            out.add(label + ": " + value);
        }
    }
}
