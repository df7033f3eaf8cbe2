package com.histora.service.core.live;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.buffer.FlushCompletedEvent;
import com.histora.service.core.buffer.FlushListener;
import com.histora.service.core.error.SinkException;
import com.histora.service.core.query.QueryDescriptor;
import com.histora.service.core.query.QueryEngine;
import com.histora.service.core.query.RecordMatcher;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Standing queries pushed on flush.
 *
 * <p>Subscriptions are grouped by descriptor fingerprint. On every completed flush each group's descriptor is
 * matched once against the newly written records and the matches are fanned out to all subscriptions in the
 * group. Only flushed data is ever pushed, so live results agree with what a historical query returns.
 */
@Service
@Slf4j
public class LiveQueryStream implements FlushListener {

    private final QueryEngine queryEngine;
    private final Clock clock;
    private final ExecutorService deliveryExecutor;

    private final ConcurrentMap<String, FingerprintGroup> registry = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LiveSubscription> byId = new ConcurrentHashMap<>();

    @Autowired
    public LiveQueryStream(QueryEngine queryEngine, Clock clock) {
        this(queryEngine, clock, newDeliveryExecutor());
    }

    public LiveQueryStream(QueryEngine queryEngine, Clock clock, ExecutorService deliveryExecutor) {
        this.queryEngine = queryEngine;
        this.clock = clock;
        this.deliveryExecutor = deliveryExecutor;
    }

    @PreDestroy
    void stop() {
        new ArrayList<>(byId.values()).forEach(this::unsubscribe);
        deliveryExecutor.shutdownNow();
    }

    /**
     * Opens a live subscription. When the descriptor starts before now, the historical part is queried and pushed
     * (as an initial update) before any live update. A descriptor that ends before now only gets that backfill and
     * is returned already closed.
     *
     * @throws com.histora.service.core.error.ValidationException for an invalid descriptor
     * @throws com.histora.service.core.error.BackendUnavailableException when the backfill query fails
     */
    public LiveSubscription subscribe(QueryDescriptor descriptor, LiveSink sink) {
        QueryEngine.validate(descriptor);
        Objects.requireNonNull(sink, "sink");

        Instant created = clock.instant();
        Instant start = descriptor.start();
        Instant end = descriptor.end();
        boolean historical = start != null && start.isBefore(created);
        boolean live = end == null || end.isAfter(created);
        Instant cursor = start != null && start.isAfter(created) ? start : created;

        LiveSubscription subscription = new LiveSubscription(
                UUID.randomUUID().toString(), descriptor, sink, cursor, deliveryExecutor, this::unsubscribe);
        if (live) {
            register(subscription);
        }

        try {
            if (historical) {
                Instant historicalEnd = live ? created : end;
                List<MeasurementRecord> backfill = queryEngine.query(descriptor.withRange(start, historicalEnd));
                subscription.pushInitial(backfill);
            }
        } catch (SinkException ex) {
            log.info("Live subscription {} sink failed during backfill: {}", subscription.id(), ex.getMessage());
            unsubscribe(subscription);
            return subscription;
        } catch (RuntimeException ex) {
            unsubscribe(subscription);
            throw ex;
        }

        if (!live) {
            subscription.close();
            log.debug("Live subscription {} covered history only, closed", subscription.id());
            return subscription;
        }
        subscription.release();
        log.info(
                "Live subscription {} opened fingerprint={} metrics={} historical={}",
                subscription.id(),
                subscription.fingerprint(),
                descriptor.metrics(),
                historical);
        return subscription;
    }

    /** @return false when the subscription was not registered (already closed). */
    public boolean unsubscribe(LiveSubscription subscription) {
        boolean removed = byId.remove(subscription.id(), subscription);
        registry.computeIfPresent(subscription.fingerprint(), (fingerprint, group) -> {
            group.subscriptions().remove(subscription);
            return group.subscriptions().isEmpty() ? null : group;
        });
        subscription.close();
        if (removed) {
            log.info("Live subscription {} closed", subscription.id());
        }
        return removed;
    }

    public boolean unsubscribe(String subscriptionId) {
        LiveSubscription subscription = byId.get(subscriptionId);
        return subscription != null && unsubscribe(subscription);
    }

    public Optional<LiveSubscription> find(String subscriptionId) {
        return Optional.ofNullable(byId.get(subscriptionId));
    }

    @Override
    public void onFlushCompleted(FlushCompletedEvent event) {
        if (registry.isEmpty() || event.records().isEmpty()) {
            return;
        }
        AtomicInteger evaluated = new AtomicInteger();
        registry.forEach((fingerprint, group) -> {
            evaluated.incrementAndGet();
            List<MeasurementRecord> matches = RecordMatcher.select(group.descriptor(), event.records());
            if (matches.isEmpty()) {
                return;
            }
            for (LiveSubscription subscription : group.subscriptions()) {
                subscription.offer(matches);
            }
        });
        log.debug("Evaluated {} live fingerprints for generation {}", evaluated.get(), event.generation());
    }

    public int subscriptionCount() {
        return byId.size();
    }

    public int fingerprintCount() {
        return registry.size();
    }

    /** Number of subscriptions sharing the fingerprint; 0 when nothing is registered under it. */
    public int subscriberCount(String fingerprint) {
        FingerprintGroup group = registry.get(fingerprint);
        return group == null ? 0 : group.subscriptions().size();
    }

    private void register(LiveSubscription subscription) {
        byId.put(subscription.id(), subscription);
        registry.compute(subscription.fingerprint(), (fingerprint, group) -> {
            FingerprintGroup target = group != null
                    ? group
                    : new FingerprintGroup(subscription.descriptor(), ConcurrentHashMap.newKeySet());
            target.subscriptions().add(subscription);
            return target;
        });
    }

    private static ExecutorService newDeliveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "histora-live-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private record FingerprintGroup(QueryDescriptor descriptor, Set<LiveSubscription> subscriptions) {}
}
