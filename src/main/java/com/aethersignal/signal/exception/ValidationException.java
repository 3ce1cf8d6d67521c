/* (C)2026 */
package com.aethersignal.signal.exception;

/**
 * Raised when a required input is structurally invalid: a missing contingency table,
 * negative counts, mismatched time-series lengths, a non-positive case total and so on.
 *
 * <p>Never used for mathematically undefined statistics; those are reported as
 * sentinel values. Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format(
                        "Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format(
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a required input that was not supplied.
     */
    public static ValidationException missingInput(String inputName) {
        return new ValidationException(String.format("Required input '%s' is missing", inputName));
    }

    /**
     * Creates validation exception for a count that must not be negative.
     */
    public static ValidationException negativeCount(String countName, long value) {
        return new ValidationException(
                String.format("Count '%s' must be non-negative, but got %d", countName, value));
    }
}
