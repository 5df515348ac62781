package com.deepansh.desk.validation;

import com.deepansh.desk.config.DeskProperties;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Expense rules as pure functions over a field name and a raw value.
 *
 * Field names are shared by both workers: {@code date}, {@code amount},
 * {@code cost}, {@code transportType}, {@code expenseCategory},
 * {@code managerApproved}, {@code items}; anything else is treated as
 * required free text.
 */
public class ExpenseRuleValidator implements FieldValidator {

    private static final Set<String> YES = Set.of("true", "yes", "y", "はい", "済", "承認済み", "approved");
    private static final Set<String> NO = Set.of("false", "no", "n", "いいえ", "未", "not approved");

    private final DeskProperties.Rules rules;
    private final Clock clock;

    public ExpenseRuleValidator(DeskProperties.Rules rules, Clock clock) {
        this.rules = rules;
        this.clock = clock;
    }

    @Override
    public ValidationResult validate(String field, Object value) {
        return switch (field) {
            case "date" -> validateDate(value);
            case "amount", "cost" -> validateAmount(field, value);
            case "transportType" -> validateTransport(value);
            case "expenseCategory" -> validateCategory(value);
            case "managerApproved" -> validateFlag(value);
            case "items" -> validateItems(value);
            default -> validateText(field, value);
        };
    }

    @Override
    public String checkTotal(long total, Boolean managerApproved) {
        if (total > rules.getMaxAmount()) {
            return String.format("The total of %,d yen exceeds the limit of %,d yen per application.",
                    total, rules.getMaxAmount());
        }
        if (requiresManagerApproval(total) && Boolean.FALSE.equals(managerApproved)) {
            return String.format("Totals above %,d yen need your manager's approval before applying.",
                    rules.getManagerApprovalThreshold());
        }
        return null;
    }

    @Override
    public boolean requiresManagerApproval(long total) {
        return total > rules.getManagerApprovalThreshold();
    }

    @Override
    public String checkCommuterOverlap(String departure, String destination, String transportType) {
        if (!TransportType.TRAIN.code().equals(transportType) || departure == null || destination == null) {
            return null;
        }
        String dep = departure.trim();
        String dest = destination.trim();
        for (DeskProperties.CommuterRoute route : rules.getCommuterRoutes()) {
            boolean forward = route.getFrom().equalsIgnoreCase(dep) && route.getTo().equalsIgnoreCase(dest);
            boolean backward = route.getFrom().equalsIgnoreCase(dest) && route.getTo().equalsIgnoreCase(dep);
            if (forward || backward) {
                return String.format("%s - %s is covered by a commuter pass and cannot be claimed.",
                        dep, dest);
            }
        }
        return null;
    }

    private ValidationResult validateDate(Object value) {
        String text = asText(value);
        if (text.isEmpty()) {
            return ValidationResult.error("date is required (YYYY-MM-DD).");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return ValidationResult.error("'" + text + "' is not a valid date. Use YYYY-MM-DD.");
        }
        LocalDate today = LocalDate.now(clock);
        if (date.isAfter(today.plusDays(rules.getMaxFutureDays()))) {
            return ValidationResult.error("Date " + text + " is in the future.");
        }
        if (date.isBefore(today.minusDays(rules.getDateWindowDays()))) {
            return ValidationResult.error("Date " + text + " is more than "
                    + rules.getDateWindowDays() + " days ago and can no longer be claimed.");
        }
        return ValidationResult.ok(date.toString());
    }

    private ValidationResult validateAmount(String field, Object value) {
        long amount;
        if (value instanceof Number n) {
            if (n.doubleValue() != Math.floor(n.doubleValue())) {
                return ValidationResult.error(field + " must be a whole number of yen.");
            }
            amount = n.longValue();
        } else {
            String text = asText(value).replace(",", "").replace("¥", "").replace("円", "").trim();
            if (text.isEmpty()) {
                return ValidationResult.error(field + " is required.");
            }
            try {
                amount = new BigDecimal(text).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                return ValidationResult.error("'" + asText(value) + "' is not a valid amount for " + field + ".");
            }
        }
        if (amount <= 0) {
            return ValidationResult.error(field + " must be greater than zero.");
        }
        if (amount > rules.getMaxAmount()) {
            return ValidationResult.error(String.format("%s of %,d yen exceeds the limit of %,d yen.",
                    field, amount, rules.getMaxAmount()));
        }
        return ValidationResult.ok(amount);
    }

    private ValidationResult validateTransport(Object value) {
        String text = asText(value);
        return TransportType.fromText(text)
                .map(t -> ValidationResult.ok(t.code()))
                .orElseGet(() -> ValidationResult.error("'" + text
                        + "' is not a supported transport type (train, bus, taxi, airplane)."));
    }

    private ValidationResult validateCategory(Object value) {
        String text = asText(value);
        return ExpenseCategory.fromText(text)
                .map(c -> ValidationResult.ok(c.name()))
                .orElseGet(() -> ValidationResult.error("'" + text
                        + "' is not a known category (office supplies, lodging, certification, other)."));
    }

    private ValidationResult validateFlag(Object value) {
        if (value instanceof Boolean b) {
            return ValidationResult.ok(b);
        }
        String text = asText(value).toLowerCase(Locale.ROOT);
        if (YES.contains(text)) {
            return ValidationResult.ok(Boolean.TRUE);
        }
        if (NO.contains(text)) {
            return ValidationResult.ok(Boolean.FALSE);
        }
        return ValidationResult.error("managerApproved must be yes or no.");
    }

    private ValidationResult validateItems(Object value) {
        String joined;
        if (value instanceof Collection<?> list) {
            joined = list.stream().map(String::valueOf).map(String::trim)
                    .filter(s -> !s.isEmpty()).collect(Collectors.joining(", "));
        } else {
            joined = asText(value);
        }
        if (joined.isEmpty()) {
            return ValidationResult.error("items is required.");
        }
        return ValidationResult.ok(joined);
    }

    private ValidationResult validateText(String field, Object value) {
        String text = asText(value);
        if (text.isEmpty()) {
            return ValidationResult.error(field + " is required.");
        }
        return ValidationResult.ok(text);
    }

    private static String asText(Object value) {
        return value == null ? "" : value.toString().trim();
    }
}
