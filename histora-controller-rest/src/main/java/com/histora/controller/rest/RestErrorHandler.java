package com.histora.controller.rest;

import com.histora.service.core.error.BackendUnavailableException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/** Global REST exception mapper. Produces consistent JSON payloads for client-visible errors. */
@Slf4j
@ControllerAdvice
public class RestErrorHandler {

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleBadRequest(IllegalArgumentException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, false);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorPayload> handleMissingParameter(
            MissingServletRequestParameterException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), request, false);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", request, false);
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ErrorPayload> handleUnavailable(BackendUnavailableException ex, WebRequest request) {
        log.warn("Backend unavailable: {}", ex.getMessage());
        ResponseEntity<ErrorPayload> response = build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request, true);
        return ResponseEntity.status(response.getStatusCode())
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(response.getBody());
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, WebRequest request, boolean retryable) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body =
                new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path, retryable);
        return ResponseEntity.status(status).body(body);
    }
}
