package com.histora.service.core.buffer;

public interface FlushListener {
    void onFlushCompleted(FlushCompletedEvent event);
}
