package com.histora.controller.rest;

import java.time.Instant;

/** Structured error payload returned by REST endpoints. {@code retryable} tells clients to back off and retry. */
public record ErrorPayload(
        Instant timestamp, int status, String error, String message, String path, boolean retryable) {}
