package com.histora.service.core.relay;

import static com.histora.service.core.support.Records.T0;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.BufferTelemetry;
import com.histora.service.core.buffer.BufferTelemetryRegistry;
import com.histora.service.core.buffer.FlushListener;
import com.histora.service.core.buffer.WriteBuffer;
import com.histora.service.core.buffer.WriteBufferFlushService;
import com.histora.service.core.bus.LocalMessageBus;
import com.histora.service.core.config.HistoraProperties;
import com.histora.service.core.spi.MessageBus;
import com.histora.service.core.spi.TimeSeriesBackend;
import com.histora.service.core.support.InMemoryTimeSeriesBackend;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

class EventRelayShutdownTest {

    @Test
    void relayUnsubscribesBeforeFinalFlush() {
        LocalMessageBus bus = new LocalMessageBus();
        AtomicBoolean subscribedDuringFlush = new AtomicBoolean();
        InMemoryTimeSeriesBackend backend = new InMemoryTimeSeriesBackend() {
            @Override
            public synchronized void write(List<MeasurementRecord> batch) {
                subscribedDuringFlush.set(bus.isSubscribed("histora.history"));
                super.write(batch);
            }
        };

        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.registerBean(Clock.class, () -> Clock.fixed(T0, ZoneOffset.UTC));
        ctx.registerBean(ObjectMapper.class, () -> new ObjectMapper());
        ctx.registerBean(HistoraProperties.class, HistoraProperties::new);
        ctx.registerBean(BufferTelemetry.class, BufferTelemetryRegistry::new);
        ctx.registerBean(MessageBus.class, () -> bus);
        ctx.registerBean(TimeSeriesBackend.class, () -> backend);
        ctx.registerBean(FlushListener.class, () -> event -> {});
        ctx.registerBean(RecordDecoder.class);
        ctx.registerBean(WriteBuffer.class);
        // registered ahead of the flush service so that only the declared dependency fixes the shutdown order
        ctx.registerBean("eventRelay", EventRelay.class);
        ctx.registerBean("writeBufferFlushService", WriteBufferFlushService.class);
        ctx.refresh();

        bus.publish("histora.history", "{\"key\":\"a\",\"data\":{\"v\":1}}".getBytes(StandardCharsets.UTF_8));
        ctx.close();

        assertThat(backend.stored()).hasSize(1);
        assertThat(subscribedDuringFlush).isFalse();
    }
}
