package com.deepansh.desk.session;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Session ids of the form {@code [prefix_]yyyyMMdd_HHmmss_xxxxxxxx}: a
 * timestamp plus 8 hex characters of a random UUID.
 */
public class SessionIdGenerator {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern PREFIX = Pattern.compile("[A-Za-z0-9-]{1,32}");

    private final Clock clock;

    public SessionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate() {
        return generate(null);
    }

    /**
     * @throws IllegalArgumentException if the prefix contains anything but letters, digits or '-'
     */
    public String generate(String prefix) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String id = LocalDateTime.now(clock).format(STAMP) + "_" + suffix;
        if (prefix == null || prefix.isBlank()) {
            return id;
        }
        if (!PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Session id prefix may only contain letters, digits and '-': " + prefix);
        }
        return prefix + "_" + id;
    }
}
