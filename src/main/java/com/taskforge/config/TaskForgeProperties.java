package com.taskforge.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "taskforge")
public class TaskForgeProperties {

    private DispatchConfig dispatch = new DispatchConfig();
    private StreamingConfig streaming = new StreamingConfig();
    private AggregationConfig aggregation = new AggregationConfig();

    public static class DispatchConfig {
        private int defaultLimit = 1;
        private int maxLimit = 50;

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

        public int effectiveLimit(Integer requested) {
            if (requested == null || requested <= 0) {
                return defaultLimit;
            }
            return Math.min(requested, maxLimit);
        }
    }

    public static class StreamingConfig {
        private Duration cacheFlushInterval = Duration.ofSeconds(1);
        private Duration durableFlushInterval = Duration.ofSeconds(3);
        private Duration cacheTtl = Duration.ofHours(1);
        private Duration cancelFlagTtl = Duration.ofMinutes(5);
        private Duration staleSessionTimeout = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private int replayBufferSize = 500;

        public Duration getCacheFlushInterval() { return cacheFlushInterval; }
        public void setCacheFlushInterval(Duration cacheFlushInterval) { this.cacheFlushInterval = cacheFlushInterval; }
        public Duration getDurableFlushInterval() { return durableFlushInterval; }
        public void setDurableFlushInterval(Duration durableFlushInterval) { this.durableFlushInterval = durableFlushInterval; }
        public Duration getCacheTtl() { return cacheTtl; }
        public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
        public Duration getCancelFlagTtl() { return cancelFlagTtl; }
        public void setCancelFlagTtl(Duration cancelFlagTtl) { this.cancelFlagTtl = cancelFlagTtl; }
        public Duration getStaleSessionTimeout() { return staleSessionTimeout; }
        public void setStaleSessionTimeout(Duration staleSessionTimeout) { this.staleSessionTimeout = staleSessionTimeout; }
        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
        public int getReplayBufferSize() { return replayBufferSize; }
        public void setReplayBufferSize(int replayBufferSize) { this.replayBufferSize = replayBufferSize; }
    }

    public static class AggregationConfig {
        private int maxAttempts = 3;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public DispatchConfig getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchConfig dispatch) {
        this.dispatch = dispatch != null ? dispatch : new DispatchConfig();
    }

    public StreamingConfig getStreaming() {
        return streaming;
    }

    public void setStreaming(StreamingConfig streaming) {
        this.streaming = streaming != null ? streaming : new StreamingConfig();
    }

    public AggregationConfig getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationConfig aggregation) {
        this.aggregation = aggregation != null ? aggregation : new AggregationConfig();
    }
}
