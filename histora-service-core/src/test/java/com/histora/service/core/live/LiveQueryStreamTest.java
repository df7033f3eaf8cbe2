package com.histora.service.core.live;

import static com.histora.service.core.support.Records.T0;
import static com.histora.service.core.support.Records.temp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.FlushCompletedEvent;
import com.histora.service.core.error.BackendUnavailableException;
import com.histora.service.core.error.ValidationException;
import com.histora.service.core.query.QueryDescriptor;
import com.histora.service.core.query.QueryEngine;
import com.histora.service.core.support.DirectExecutorService;
import com.histora.service.core.support.InMemoryTimeSeriesBackend;
import com.histora.service.core.support.MutableClock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LiveQueryStreamTest {

    private final MutableClock clock = new MutableClock(T0.plusSeconds(100));
    private final InMemoryTimeSeriesBackend backend = new InMemoryTimeSeriesBackend();
    private final LiveQueryStream stream =
            new LiveQueryStream(new QueryEngine(backend, clock), clock, new DirectExecutorService());

    private long generation;

    private void flushed(MeasurementRecord... records) {
        backend.write(List.of(records));
        stream.onFlushCompleted(new FlushCompletedEvent(++generation, List.of(records), clock.instant()));
    }

    private static QueryDescriptor liveOnly() {
        return QueryDescriptor.of(List.of("spark/temp"), null, null, null);
    }

    @Test
    void liveSubscriptionSeesNothingOlderThanCreation() {
        RecordingSink sink = new RecordingSink();
        LiveSubscription subscription = stream.subscribe(liveOnly(), sink);

        flushed(temp(50, 0.5), temp(150, 1.5));

        assertThat(sink.updates).noneMatch(LiveUpdate::initial);
        assertThat(sink.liveRecords()).extracting(MeasurementRecord::timestamp).containsExactly(T0.plusSeconds(150));
        assertThat(subscription.cursor()).isEqualTo(T0.plusSeconds(150));
    }

    @Test
    void pushesStayInTimestampOrderWithoutDuplicates() {
        RecordingSink sink = new RecordingSink();
        stream.subscribe(liveOnly(), sink);

        flushed(temp(120, 1.0), temp(110, 2.0), temp(120, 3.0));
        flushed(temp(115, 4.0), temp(130, 5.0));

        assertThat(sink.liveRecords()).extracting(r -> r.fields().get("temp")).containsExactly(2.0, 1.0, 3.0, 5.0);
    }

    @Test
    void closingOneSinkKeepsOthersOnTheSameFingerprint() {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        LiveSubscription a = stream.subscribe(liveOnly(), first);
        LiveSubscription b = stream.subscribe(liveOnly(), second);
        assertThat(a.fingerprint()).isEqualTo(b.fingerprint());
        assertThat(stream.fingerprintCount()).isEqualTo(1);
        assertThat(stream.subscriberCount(a.fingerprint())).isEqualTo(2);

        first.failing = true;
        flushed(temp(110, 1.0));
        flushed(temp(120, 2.0));

        assertThat(a.state()).isEqualTo(SubscriptionState.CLOSED);
        assertThat(first.closeCalls).isEqualTo(1);
        assertThat(b.isOpen()).isTrue();
        assertThat(second.liveRecords()).extracting(r -> r.fields().get("temp")).containsExactly(1.0, 2.0);
        assertThat(stream.subscriberCount(a.fingerprint())).isEqualTo(1);
    }

    @Test
    void unsubscribeReleasesFingerprint() {
        RecordingSink sink = new RecordingSink();
        LiveSubscription subscription = stream.subscribe(liveOnly(), sink);

        assertThat(stream.unsubscribe(subscription.id())).isTrue();
        flushed(temp(110, 1.0));

        assertThat(stream.fingerprintCount()).isZero();
        assertThat(stream.subscriptionCount()).isZero();
        assertThat(sink.updates).isEmpty();
        assertThat(sink.closeCalls).isEqualTo(1);
        assertThat(stream.unsubscribe(subscription)).isFalse();
    }

    @Test
    void historicalRangeIsBackfilledBeforeLiveUpdates() {
        backend.write(List.of(temp(10, 0.1), temp(90, 0.9)));
        RecordingSink sink = new RecordingSink();
        stream.subscribe(QueryDescriptor.of(List.of("spark/temp"), T0, null, null), sink);

        flushed(temp(95, 0.95), temp(150, 1.5));

        assertThat(sink.updates).hasSize(2);
        assertThat(sink.updates.get(0).initial()).isTrue();
        assertThat(sink.updates.get(0).records()).extracting(r -> r.fields().get("temp")).containsExactly(0.1, 0.9);
        assertThat(sink.liveRecords()).extracting(r -> r.fields().get("temp")).containsExactly(1.5);
    }

    @Test
    void closedRangeGetsBackfillAndCloses() {
        backend.write(List.of(temp(10, 0.1), temp(60, 0.6)));
        RecordingSink sink = new RecordingSink();

        LiveSubscription subscription = stream.subscribe(
                QueryDescriptor.of(List.of("spark"), T0, T0.plusSeconds(50), null), sink);

        assertThat(subscription.state()).isEqualTo(SubscriptionState.CLOSED);
        assertThat(sink.updates).singleElement().satisfies(update -> {
            assertThat(update.initial()).isTrue();
            assertThat(update.records()).extracting(r -> r.fields().get("temp")).containsExactly(0.1);
        });
        assertThat(stream.subscriptionCount()).isZero();
    }

    @Test
    void futureStartWaitsForItsRange() {
        RecordingSink sink = new RecordingSink();
        stream.subscribe(QueryDescriptor.of(List.of("spark/temp"), T0.plusSeconds(200), null, null), sink);

        flushed(temp(150, 1.5), temp(210, 2.1));

        assertThat(sink.updates).noneMatch(LiveUpdate::initial);
        assertThat(sink.liveRecords()).extracting(r -> r.fields().get("temp")).containsExactly(2.1);
    }

    @Test
    void backfillFailureUnregistersAndPropagates() {
        backend.failQueries(true);

        assertThatThrownBy(() -> stream.subscribe(
                        QueryDescriptor.of(List.of("spark"), T0, null, null), new RecordingSink()))
                .isInstanceOf(BackendUnavailableException.class);
        assertThat(stream.subscriptionCount()).isZero();
        assertThat(stream.fingerprintCount()).isZero();
    }

    @Test
    void sinkFailingDuringBackfillClosesSubscription() {
        RecordingSink sink = new RecordingSink();
        sink.failing = true;

        LiveSubscription subscription =
                stream.subscribe(QueryDescriptor.of(List.of("spark"), T0, null, null), sink);

        assertThat(subscription.isOpen()).isFalse();
        assertThat(stream.subscriptionCount()).isZero();
    }

    @Test
    void invalidDescriptorIsRejected() {
        assertThatThrownBy(() -> stream.subscribe(QueryDescriptor.of(List.of(), null, null, null), new RecordingSink()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void unrelatedRecordsAreNotPushed() {
        RecordingSink sink = new RecordingSink();
        stream.subscribe(liveOnly(), sink);

        flushed(new MeasurementRecord("history", "tilt", T0.plusSeconds(110), Map.of("gravity", 1.01)));

        assertThat(sink.updates).isEmpty();
    }
}
