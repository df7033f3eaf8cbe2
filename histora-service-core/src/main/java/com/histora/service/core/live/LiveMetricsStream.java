package com.histora.service.core.live;

import com.histora.service.core.error.ValidationException;
import com.histora.service.core.query.MetricsCache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
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
 * Streams the latest value of a set of metrics. The current values are pushed on subscribe, then again after
 * every flush that changes one of the subscribed metrics. Each push carries the full set of known values.
 */
@Service
@Slf4j
public class LiveMetricsStream {

    private final MetricsCache metricsCache;
    private final ExecutorService deliveryExecutor;
    private final ConcurrentMap<String, MetricsSubscription> subscriptions = new ConcurrentHashMap<>();

    @Autowired
    public LiveMetricsStream(MetricsCache metricsCache) {
        this(metricsCache, newDeliveryExecutor());
    }

    public LiveMetricsStream(MetricsCache metricsCache, ExecutorService deliveryExecutor) {
        this.metricsCache = metricsCache;
        this.deliveryExecutor = deliveryExecutor;
    }

    @PostConstruct
    public void start() {
        metricsCache.onUpdate(this::onMetricsUpdated);
    }

    @PreDestroy
    void stop() {
        new ArrayList<>(subscriptions.values()).forEach(this::unsubscribe);
        deliveryExecutor.shutdownNow();
    }

    /** @throws ValidationException when no metric is named or a name is blank */
    public MetricsSubscription subscribe(Collection<String> metrics, MetricsSink sink) {
        Objects.requireNonNull(sink, "sink");
        if (metrics == null || metrics.isEmpty()) {
            throw new ValidationException("at least one metric is required");
        }
        Set<String> names = new LinkedHashSet<>();
        for (String metric : metrics) {
            if (metric == null || metric.isBlank()) {
                throw new ValidationException("metric names must not be blank");
            }
            names.add(metric.trim());
        }
        MetricsSubscription subscription = new MetricsSubscription(
                UUID.randomUUID().toString(), names, sink, deliveryExecutor, this::unsubscribe);
        subscriptions.put(subscription.id(), subscription);
        subscription.offer(metricsCache.metrics(names));
        log.info("Metrics subscription {} opened metrics={}", subscription.id(), names);
        return subscription;
    }

    /** @return false when the subscription was already closed. */
    public boolean unsubscribe(MetricsSubscription subscription) {
        boolean removed = subscriptions.remove(subscription.id(), subscription);
        subscription.close();
        if (removed) {
            log.info("Metrics subscription {} closed", subscription.id());
        }
        return removed;
    }

    public Optional<MetricsSubscription> find(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    void onMetricsUpdated(Set<String> updated) {
        for (MetricsSubscription subscription : subscriptions.values()) {
            if (!Collections.disjoint(subscription.metrics(), updated)) {
                subscription.offer(metricsCache.metrics(subscription.metrics()));
            }
        }
    }

    private static ExecutorService newDeliveryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "histora-metrics-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
