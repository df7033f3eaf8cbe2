package com.histora.service.core.live;

import static com.histora.service.core.support.Records.T0;
import static com.histora.service.core.support.Records.at;
import static com.histora.service.core.support.Records.temp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.FlushCompletedEvent;
import com.histora.service.core.error.SinkException;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.query.MetricValue;
import com.histora.service.core.query.MetricsCache;
import com.histora.service.core.support.DirectExecutorService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LiveMetricsStreamTest {

    private final MetricsCache cache = new MetricsCache();
    private final LiveMetricsStream stream = new LiveMetricsStream(cache, new DirectExecutorService());

    private long generation;

    @BeforeEach
    void setUp() {
        stream.start();
    }

    private void flushed(MeasurementRecord... records) {
        cache.onFlushCompleted(new FlushCompletedEvent(++generation, List.of(records), T0));
    }

    @Test
    void pushesCurrentValuesOnSubscribe() {
        flushed(temp(1, 20.0));
        Sink sink = new Sink();

        stream.subscribe(List.of("spark/temp", "spark/setting"), sink);

        assertThat(sink.pushes).containsExactly(List.of(new MetricValue("spark/temp", 20.0, T0.plusSeconds(1))));
    }

    @Test
    void pushesAgainOnlyWhenASubscribedMetricChanges() {
        Sink sink = new Sink();
        stream.subscribe(List.of("spark/temp"), sink);

        flushed(at(1, "tilt", Map.of("gravity", 1.01)));
        flushed(temp(2, 21.0));
        flushed(temp(1, 19.0));

        assertThat(sink.pushes).hasSize(2);
        assertThat(sink.pushes.get(0)).isEmpty();
        assertThat(sink.pushes.get(1)).extracting(MetricValue::value).containsExactly(21.0);
    }

    @Test
    void failingSinkClosesOnlyItsSubscription() {
        Sink healthy = new Sink();
        Sink broken = new Sink();
        stream.subscribe(List.of("spark/temp"), healthy);
        MetricsSubscription failing = stream.subscribe(List.of("spark/temp"), broken);
        broken.failing = true;

        flushed(temp(1, 20.0));

        assertThat(failing.isClosed()).isTrue();
        assertThat(broken.closed).isTrue();
        assertThat(stream.subscriptionCount()).isEqualTo(1);
        assertThat(healthy.pushes).hasSize(2);
    }

    @Test
    void unsubscribeStopsPushes() {
        Sink sink = new Sink();
        MetricsSubscription subscription = stream.subscribe(List.of("spark/temp"), sink);

        assertThat(stream.unsubscribe(subscription)).isTrue();
        assertThat(stream.unsubscribe(subscription)).isFalse();
        flushed(temp(1, 20.0));

        assertThat(sink.pushes).hasSize(1);
        assertThat(sink.closed).isTrue();
    }

    @Test
    void rejectsMissingOrBlankMetrics() {
        assertThatThrownBy(() -> stream.subscribe(List.of(), new Sink())).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> stream.subscribe(List.of(" "), new Sink())).isInstanceOf(ValidationException.class);
        assertThat(stream.subscriptionCount()).isZero();
    }

    private static final class Sink implements MetricsSink {
        final List<List<MetricValue>> pushes = new ArrayList<>();
        volatile boolean failing;
        volatile boolean closed;

        @Override
        public void push(List<MetricValue> metrics) throws SinkException {
            if (failing) {
                throw new SinkException("gone");
            }
            pushes.add(metrics);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
