package com.histora.controller.rest;

import com.histora.service.core.error.SinkException;
import com.histora.service.core.live.MetricsSink;
import com.histora.service.core.query.MetricValue;
import java.io.IOException;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes latest-value snapshots as server-sent events named {@code metrics}. */
class SseMetricsSink implements MetricsSink {

    private final SseEmitter emitter;

    SseMetricsSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void push(List<MetricValue> metrics) throws SinkException {
        try {
            emitter.send(SseEmitter.event().name("metrics").data(metrics, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException ex) {
            throw new SinkException("Stream client is gone", ex);
        }
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (IllegalStateException ignored) {
            // already completed by the container
        }
    }
}
