package com.histora.service.core.buffer;

import static com.histora.service.core.support.Records.T0;
import static com.histora.service.core.support.Records.temp;
import static org.assertj.core.api.Assertions.assertThat;

import com.histora.service.core.support.InMemoryTimeSeriesBackend;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class WriteBufferFlushServiceTest {

    private final Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
    private final BufferTelemetryRegistry telemetry = new BufferTelemetryRegistry();
    private final InMemoryTimeSeriesBackend backend = new InMemoryTimeSeriesBackend();
    private final List<FlushCompletedEvent> events = new ArrayList<>();

    private WriteBufferFlushService service(WriteBuffer buffer, FlushListener... extra) {
        List<FlushListener> listeners = new ArrayList<>(List.of(extra));
        listeners.add(events::add);
        return new WriteBufferFlushService(buffer, backend, listeners, telemetry, clock);
    }

    @Test
    void flushWritesInEnqueueOrderAndNotifiesListeners() {
        WriteBuffer buffer = new WriteBuffer(100, 0, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        buffer.enqueue(temp(2, 2.0));
        buffer.enqueue(temp(1, 1.0));

        assertThat(service.flush()).isEqualTo(FlushOutcome.FLUSHED);

        assertThat(backend.writes()).hasSize(1);
        assertThat(backend.stored()).extracting(r -> r.fields().get("temp")).containsExactly(2.0, 1.0);
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.generation()).isEqualTo(1);
            assertThat(event.records()).hasSize(2);
        });
        assertThat(telemetry.snapshot().flushed()).isEqualTo(2);
    }

    @Test
    void emptyFlushPublishesNothing() {
        WriteBuffer buffer = new WriteBuffer(100, 0, telemetry, clock);

        assertThat(service(buffer).flush()).isEqualTo(FlushOutcome.EMPTY);

        assertThat(backend.writes()).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    void failedWriteIsRetriedAheadOfNewerRecords() {
        WriteBuffer buffer = new WriteBuffer(100, 0, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        backend.failNextWrites(1);
        buffer.enqueue(temp(1, 1.0));
        buffer.enqueue(temp(2, 2.0));

        assertThat(service.flush()).isEqualTo(FlushOutcome.FAILED);
        assertThat(backend.stored()).isEmpty();
        assertThat(events).isEmpty();
        assertThat(buffer.pendingSize()).isEqualTo(2);

        buffer.enqueue(temp(3, 3.0));
        assertThat(service.flush()).isEqualTo(FlushOutcome.FLUSHED);

        assertThat(backend.stored()).extracting(r -> r.fields().get("temp")).containsExactly(1.0, 2.0, 3.0);
        assertThat(events).singleElement().satisfies(event -> assertThat(event.records()).hasSize(3));
        assertThat(telemetry.snapshot().flushFailures()).isEqualTo(1);
    }

    @Test
    void outageLongerThanCapacityKeepsNewestRecords() {
        WriteBuffer buffer = new WriteBuffer(3, 0, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        backend.failNextWrites(2);

        buffer.enqueue(temp(1, 1.0));
        buffer.enqueue(temp(2, 2.0));
        service.flush();
        buffer.enqueue(temp(3, 3.0));
        buffer.enqueue(temp(4, 4.0));
        service.flush();
        buffer.enqueue(temp(5, 5.0));
        service.flush();

        assertThat(backend.stored()).extracting(r -> r.fields().get("temp")).containsExactly(3.0, 4.0, 5.0);
        assertThat(telemetry.snapshot().dropped()).isEqualTo(2);
    }

    @Test
    void failingListenerDoesNotAffectOthers() {
        WriteBuffer buffer = new WriteBuffer(100, 0, telemetry, clock);
        FlushListener broken = event -> {
            throw new IllegalStateException("boom");
        };
        WriteBufferFlushService service = service(buffer, broken);
        buffer.enqueue(temp(1, 1.0));

        assertThat(service.flush()).isEqualTo(FlushOutcome.FLUSHED);
        assertThat(events).hasSize(1);
    }

    @Test
    void thresholdTriggersEarlyFlush() throws Exception {
        WriteBuffer buffer = new WriteBuffer(100, 3, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        service.start();
        try {
            for (int i = 0; i < 3; i++) {
                buffer.enqueue(temp(i, i));
            }
            long deadline = System.currentTimeMillis() + 5_000;
            while (backend.stored().size() < 3 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(backend.stored()).hasSize(3);
        } finally {
            service.stop();
        }
    }

    @Test
    void failedEarlyFlushWaitsForScheduledCycle() throws Exception {
        WriteBuffer buffer = new WriteBuffer(1_000, 10, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        backend.failNextWrites(Integer.MAX_VALUE);
        service.start();
        try {
            for (int i = 0; i < 500; i++) {
                buffer.enqueue(temp(i, i));
            }
            long deadline = System.currentTimeMillis() + 5_000;
            while (backend.writeAttempts() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            Thread.sleep(100);

            assertThat(backend.writeAttempts()).isEqualTo(1);
            assertThat(buffer.pendingSize()).isEqualTo(500);

            backend.failNextWrites(0);
            service.flushScheduled();
            assertThat(backend.stored()).hasSize(500);

            for (int i = 0; i < 10; i++) {
                buffer.enqueue(temp(i, i));
            }
            deadline = System.currentTimeMillis() + 5_000;
            while (backend.stored().size() < 510 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(backend.stored()).hasSize(510);
        } finally {
            service.stop();
        }
    }

    @Test
    void stopFlushesRemainingRecords() {
        WriteBuffer buffer = new WriteBuffer(100, 0, telemetry, clock);
        WriteBufferFlushService service = service(buffer);
        service.start();
        buffer.enqueue(temp(1, 1.0));

        service.stop();

        assertThat(backend.stored()).hasSize(1);
    }
}
