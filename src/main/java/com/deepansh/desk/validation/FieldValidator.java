package com.deepansh.desk.validation;

/**
 * Pure domain validation: no side effects, same answer for the same input
 * (given the same clock).
 */
public interface FieldValidator {

    ValidationResult validate(String field, Object value);

    /**
     * Cross-field rule on the request total.
     *
     * @return an error message, or null when the total is acceptable
     */
    String checkTotal(long total, Boolean managerApproved);

    /**
     * @return an error message when a train route is covered by a commuter pass, otherwise null
     */
    String checkCommuterOverlap(String departure, String destination, String transportType);

    /**
     * @return true when a total of this size needs the manager's prior approval
     */
    boolean requiresManagerApproval(long total);
}
