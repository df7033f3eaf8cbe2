package com.histora.service.core.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "histora")
public class HistoraProperties {
    private Buffer buffer = new Buffer();
    private Relay relay = new Relay();
    private Query query = new Query();
    private Datastore datastore = new Datastore();
    private Live live = new Live();
    private Bus bus = new Bus();

    public Buffer getBuffer() {
        return buffer;
    }

    public void setBuffer(Buffer buffer) {
        this.buffer = buffer;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Datastore getDatastore() {
        return datastore;
    }

    public void setDatastore(Datastore datastore) {
        this.datastore = datastore;
    }

    public Live getLive() {
        return live;
    }

    public void setLive(Live live) {
        this.live = live;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus;
    }

    public static class Buffer {
        private int maxPending = 500_000;
        private Flush flush = new Flush();

        public int getMaxPending() {
            return maxPending;
        }

        public void setMaxPending(int maxPending) {
            this.maxPending = maxPending;
        }

        public Flush getFlush() {
            return flush;
        }

        public void setFlush(Flush flush) {
            this.flush = flush;
        }
    }

    public static class Flush {
        private long intervalMs = 5000;
        private int threshold = 5000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }
    }

    public static class Relay {
        private List<String> topics = new ArrayList<>(List.of("histora.history"));

        public List<String> getTopics() {
            return topics;
        }

        public void setTopics(List<String> topics) {
            this.topics = topics;
        }
    }

    public static class Query {
        private String defaultDuration = "1d";
        private String minimumStep = "10s";
        private int desiredPoints = 1000;

        public String getDefaultDuration() {
            return defaultDuration;
        }

        public void setDefaultDuration(String defaultDuration) {
            this.defaultDuration = defaultDuration;
        }

        public String getMinimumStep() {
            return minimumStep;
        }

        public void setMinimumStep(String minimumStep) {
            this.minimumStep = minimumStep;
        }

        public int getDesiredPoints() {
            return desiredPoints;
        }

        public void setDesiredPoints(int desiredPoints) {
            this.desiredPoints = desiredPoints;
        }
    }

    public static class Datastore {
        private String topic = "histora.datastore";

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }
    }

    public static class Live {
        /** SSE emitter timeout; 0 keeps the stream open until the client leaves. */
        private long streamTimeoutMs = 0;

        public long getStreamTimeoutMs() {
            return streamTimeoutMs;
        }

        public void setStreamTimeoutMs(long streamTimeoutMs) {
            this.streamTimeoutMs = streamTimeoutMs;
        }
    }

    public static class Bus {
        /** {@code kafka} or {@code local}. */
        private String type = "kafka";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
