package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.Timers;

import java.util.concurrent.Executor;

/**
 * Immutable settings for a {@link Bulkhead}. Use {@link #builder(String)}; every field but the name has a
 * default.
 */
public class BulkheadConfig {

    /** Identifies the resource class in logs, events and errors. */
    public final String name;

    /** How many tasks may run at once. */
    public final int maxConcurrent;

    /** How many tasks may wait for a slot. Zero means tasks that cannot run immediately are rejected. */
    public final int maxQueueSize;

    /** Deadline for a running task, measured from the moment it starts running. */
    public final long executionTimeoutMillis;

    /** How long a task may wait in the queue before it is rejected. */
    public final long queueTimeoutMillis;

    /** How often a metrics snapshot is published to listeners. */
    public final long metricsIntervalMillis;

    /** Starts tasks taken off the queue, so that a finishing task (or a timer) never runs the next one inline. */
    public final Executor executor;

    public BulkheadConfig(String name, int maxConcurrent, int maxQueueSize, long executionTimeoutMillis,
                          long queueTimeoutMillis, long metricsIntervalMillis, Executor executor) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty.");
        }
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1; otherwise, no task could ever run.");
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException("maxQueueSize must be >= 0");
        }
        if (executionTimeoutMillis < 1) {
            throw new IllegalArgumentException("executionTimeoutMillis must be >= 1");
        }
        if (queueTimeoutMillis < 1) {
            throw new IllegalArgumentException("queueTimeoutMillis must be >= 1");
        }
        if (metricsIntervalMillis < 1) {
            throw new IllegalArgumentException("metricsIntervalMillis must be >= 1");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null.");
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.maxQueueSize = maxQueueSize;
        this.executionTimeoutMillis = executionTimeoutMillis;
        this.queueTimeoutMillis = queueTimeoutMillis;
        this.metricsIntervalMillis = metricsIntervalMillis;
        this.executor = executor;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return String.format("BulkheadConfig{name=%s, maxConcurrent=%d, maxQueueSize=%d, executionTimeoutMillis=%d, "
                        + "queueTimeoutMillis=%d}", name, maxConcurrent, maxQueueSize, executionTimeoutMillis,
                queueTimeoutMillis);
    }

    /**
     * A convenience class to make constructor parameters less opaque.
     */
    public static class Builder {
        private final String name;
        private int maxConcurrent = 10;
        private int maxQueueSize = 100;
        private long executionTimeoutMillis = 30000;
        private long queueTimeoutMillis = 60000;
        private long metricsIntervalMillis = 10000;
        private Executor executor = Timers.workers;

        public Builder(String name) {
            this.name = name;
        }
        public Builder setMaxConcurrent(int value) {
            maxConcurrent = value;
            return this;
        }
        public Builder setMaxQueueSize(int value) {
            maxQueueSize = value;
            return this;
        }
        public Builder setExecutionTimeoutMillis(long value) {
            executionTimeoutMillis = value;
            return this;
        }
        public Builder setQueueTimeoutMillis(long value) {
            queueTimeoutMillis = value;
            return this;
        }
        public Builder setMetricsIntervalMillis(long value) {
            metricsIntervalMillis = value;
            return this;
        }
        public Builder setExecutor(Executor value) {
            executor = value;
            return this;
        }
        public BulkheadConfig build() {
            return new BulkheadConfig(name, maxConcurrent, maxQueueSize, executionTimeoutMillis, queueTimeoutMillis,
                    metricsIntervalMillis, executor);
        }
    }
}
