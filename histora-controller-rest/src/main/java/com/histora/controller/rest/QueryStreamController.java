package com.histora.controller.rest;

import com.histora.service.core.config.HistoraProperties;
import com.histora.service.core.live.LiveMetricsStream;
import com.histora.service.core.live.LiveQueryStream;
import com.histora.service.core.live.MetricsSubscription;
import com.histora.service.core.live.LiveSubscription;
import com.histora.service.core.query.QueryDescriptor;
import com.histora.service.core.query.TimeframeResolver;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live query stream over server-sent events. The request parameters form the descriptor; without a range the stream
 * only carries data flushed after the request. {@code /query/metrics/stream} carries latest values instead.
 */
@Slf4j
@RestController
@RequestMapping("/query")
public class QueryStreamController {

    private final LiveQueryStream liveQueryStream;
    private final LiveMetricsStream liveMetricsStream;
    private final TimeframeResolver timeframeResolver;
    private final long streamTimeoutMs;

    public QueryStreamController(
            LiveQueryStream liveQueryStream,
            LiveMetricsStream liveMetricsStream,
            TimeframeResolver timeframeResolver,
            HistoraProperties properties) {
        this.liveQueryStream = liveQueryStream;
        this.liveMetricsStream = liveMetricsStream;
        this.timeframeResolver = timeframeResolver;
        this.streamTimeoutMs = properties.getLive().getStreamTimeoutMs();
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @RequestParam("fields") List<String> fields,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end,
            @RequestParam(required = false) String duration,
            @RequestParam(required = false) String step) {
        QueryDescriptor descriptor = timeframeResolver.resolveLive(fields, start, end, duration, step);
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        LiveSubscription subscription = liveQueryStream.subscribe(descriptor, new SseLiveSink(emitter));

        Runnable release = () -> liveQueryStream.unsubscribe(subscription);
        emitter.onCompletion(release);
        emitter.onTimeout(release);
        emitter.onError(ex -> release.run());
        log.debug("Stream {} opened for {}", subscription.id(), descriptor.metrics());
        return emitter;
    }

    @GetMapping(path = "/metrics/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter metricsStream(@RequestParam("fields") List<String> fields) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        MetricsSubscription subscription = liveMetricsStream.subscribe(fields, new SseMetricsSink(emitter));

        Runnable release = () -> liveMetricsStream.unsubscribe(subscription);
        emitter.onCompletion(release);
        emitter.onTimeout(release);
        emitter.onError(ex -> release.run());
        log.debug("Metrics stream {} opened for {}", subscription.id(), subscription.metrics());
        return emitter;
    }
}
