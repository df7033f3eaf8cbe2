package com.histora.controller.rest;

import com.histora.service.core.buffer.BufferTelemetryRegistry;
import com.histora.service.core.buffer.FlushOutcome;
import com.histora.service.core.buffer.WriteBuffer;
import com.histora.service.core.buffer.WriteBufferFlushService;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/buffer", produces = MediaType.APPLICATION_JSON_VALUE)
public class BufferStatusController {

    private final WriteBuffer buffer;
    private final WriteBufferFlushService flushService;
    private final BufferTelemetryRegistry telemetry;

    public BufferStatusController(
            WriteBuffer buffer, WriteBufferFlushService flushService, BufferTelemetryRegistry telemetry) {
        this.buffer = buffer;
        this.flushService = flushService;
        this.telemetry = telemetry;
    }

    @GetMapping("/status")
    public BufferStatus status() {
        return new BufferStatus(
                buffer.pendingSize(), buffer.maxPending(), buffer.currentGeneration(), telemetry.snapshot());
    }

    /** Flushes now instead of waiting for the next scheduled cycle. */
    @PostMapping("/flush")
    public Map<String, FlushOutcome> flush() {
        return Map.of("outcome", flushService.flush());
    }

    public record BufferStatus(
            int pendingSize, int maxPending, long generation, BufferTelemetryRegistry.Snapshot telemetry) {}
}
