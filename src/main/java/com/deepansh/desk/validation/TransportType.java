package com.deepansh.desk.validation;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum TransportType {

    TRAIN("train", List.of("電車", "鉄道", "rail", "jr", "subway", "地下鉄")),
    BUS("bus", List.of("バス")),
    TAXI("taxi", List.of("タクシー", "cab")),
    AIRPLANE("airplane", List.of("飛行機", "plane", "flight", "air"));

    private final String code;
    private final List<String> aliases;

    TransportType(String code, List<String> aliases) {
        this.code = code;
        this.aliases = aliases;
    }

    public String code() {
        return code;
    }

    public static Optional<TransportType> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        for (TransportType t : values()) {
            if (t.code.equals(needle) || t.aliases.contains(needle)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
