package com.deepansh.desk.validation;

/**
 * Outcome of validating one field: either the normalized value or a
 * user-facing error message.
 */
public record ValidationResult(boolean valid, Object value, String error) {

    public static ValidationResult ok(Object normalized) {
        return new ValidationResult(true, normalized, null);
    }

    public static ValidationResult error(String message) {
        return new ValidationResult(false, null, message);
    }
}
