package com.histora.service.core.live;

import com.histora.service.core.error.SinkException;
import com.histora.service.core.query.MetricValue;
import java.util.List;

/** Output channel of one latest-values subscription. Calls for one subscription never overlap. */
public interface MetricsSink {

    void push(List<MetricValue> metrics) throws SinkException;

    /** Releases the channel. Must tolerate being called more than once. */
    void close();
}
