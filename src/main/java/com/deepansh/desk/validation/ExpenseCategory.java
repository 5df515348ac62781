package com.deepansh.desk.validation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Receipt categories. The label is what appears on reports.
 */
public enum ExpenseCategory {

    OFFICE_SUPPLIES("Office supplies", List.of("office_supplies", "office supplies", "supplies", "books", "事務用品費")),
    LODGING("Lodging", List.of("lodging", "hotel", "accommodation", "宿泊費")),
    CERTIFICATION("Certification", List.of("certification", "exam", "qualification", "資格精算費")),
    OTHER("Other", List.of("other", "misc", "その他経費"));

    private final String label;
    private final List<String> aliases;

    ExpenseCategory(String label, List<String> aliases) {
        this.label = label;
        this.aliases = aliases;
    }

    public String label() {
        return label;
    }

    public static Optional<ExpenseCategory> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        for (ExpenseCategory c : values()) {
            if (c.name().equalsIgnoreCase(needle) || c.label.equalsIgnoreCase(needle)
                    || c.aliases.contains(needle)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
