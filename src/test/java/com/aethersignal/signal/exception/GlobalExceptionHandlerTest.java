/* (C)2026 */
package com.aethersignal.signal.exception;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(ValidationException.missingInput("contingencyTable"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message).isEqualTo("Required input 'contingencyTable' is missing");
        assertThat(body.status).isEqualTo(400);
    }

    @Test
    void mapsUnavailableEvidenceToServiceUnavailable()
    {
        Response response = handler.toResponse(
                new EvidenceUnavailableException("warfarin", "Haemorrhage", new TimeoutException()));

        assertThat(response.getStatus()).isEqualTo(Response.Status.SERVICE_UNAVAILABLE.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("EVIDENCE_UNAVAILABLE");
        assertThat(body.message).isEqualTo("Evidence unavailable for warfarin / Haemorrhage");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
        assertThat(body.message).contains("missing");
    }

    @Test
    void mapsUnhandledTo500()
    {
        Response response = handler.toResponse(new IllegalStateException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).isEqualTo("An unexpected error occurred");
        assertThat(body.timestamp).isNotNull();
    }
}
