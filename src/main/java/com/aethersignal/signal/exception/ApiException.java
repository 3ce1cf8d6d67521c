/* (C)2026 */
package com.aethersignal.signal.exception;

/**
 * Base unchecked exception for all application-level errors raised by the signal engine.
 *
 * <p>Subclasses represent specific error categories (structurally invalid input,
 * unavailable evidence) and are mapped to HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException {

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
