package com.histora.controller.rest;

import com.histora.service.core.error.SinkException;
import com.histora.service.core.live.LiveSink;
import com.histora.service.core.live.LiveUpdate;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Writes live updates as server-sent events named {@code initial} or {@code update}. */
class SseLiveSink implements LiveSink {

    private final SseEmitter emitter;

    SseLiveSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void push(LiveUpdate update) throws SinkException {
        try {
            emitter.send(SseEmitter.event()
                    .name(update.initial() ? "initial" : "update")
                    .data(update, MediaType.APPLICATION_JSON));
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
