package com.histora.service.core.buffer;

public enum FlushOutcome {
    EMPTY,
    FLUSHED,
    FAILED
}
