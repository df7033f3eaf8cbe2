package com.histora.service.core.live;

import com.histora.service.core.error.SinkException;

/** Output channel of one live subscription. Calls for one subscription never overlap. */
public interface LiveSink {

    void push(LiveUpdate update) throws SinkException;

    /** Releases the channel. Must tolerate being called more than once. */
    void close();
}
