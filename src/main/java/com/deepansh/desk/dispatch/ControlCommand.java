package com.deepansh.desk.dispatch;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Words that steer the outer loop instead of reaching a Worker.
 */
public enum ControlCommand {

    EXIT(Set.of("exit", "quit", "終了")),
    RESET(Set.of("reset", "リセット", "最初から"));

    private final Set<String> words;

    ControlCommand(Set<String> words) {
        this.words = words;
    }

    public static Optional<ControlCommand> parse(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        for (ControlCommand command : values()) {
            if (command.words.contains(normalized)) {
                return Optional.of(command);
            }
        }
        return Optional.empty();
    }
}
