/* (C)2026 */
package com.aethersignal.signal.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates engine and framework exceptions
 * into structured JSON error responses with appropriate HTTP status codes.
 *
 * <p>Structurally invalid inputs become 400, unavailable evidence becomes 503.
 * Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            LOG.debugf("Rejected request on %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST, exception.getMessage(), "VALIDATION_ERROR", path);
        }

        if (exception instanceof EvidenceUnavailableException) {
            LOG.warnf("Evidence unavailable: %s", exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE,
                    exception.getMessage(),
                    "EVIDENCE_UNAVAILABLE",
                    path);
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND, exception.getMessage(), "NOT_FOUND", path);
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path);
    }

    private Response createResponse(Response.Status status, String message, String code, String path) {
        ErrorResponse errorResponse = new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error response body returned to API clients.
     */
    public static class ErrorResponse {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message) {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status) {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
