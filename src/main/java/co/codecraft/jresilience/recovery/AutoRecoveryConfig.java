package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.AsyncOperation;
import co.codecraft.jresilience.Timers;

import java.util.concurrent.Executor;

/**
 * Immutable settings for an {@link AutoRecovery}. Use {@link #builder(String)}; every field but the name has a
 * default.
 */
public class AutoRecoveryConfig {

    public final String name;

    /** Retries after the first attempt of {@link AutoRecovery#executeWithRecovery}; 0 means a single attempt. */
    public final int maxRetries;

    public final long initialDelayMillis;

    /** Cap on the computed backoff, applied before jitter. */
    public final long maxDelayMillis;

    public final double backoffMultiplier;

    public final long healthCheckIntervalMillis;

    /** Consecutive failures that make the dependency {@link RecoveryState#FAILED}. */
    public final int failureThreshold;

    /** Consecutive successes that make it {@link RecoveryState#HEALTHY} again. */
    public final int recoveryThreshold;

    /** How long the retry-delay strategy waits before probing. */
    public final long recoveryDelayMillis;

    /**
     * Periodic probe. Healthy unless it throws, completes exceptionally or yields {@link Boolean#FALSE}. May be
     * null, in which case nothing is probed.
     */
    public final AsyncOperation<?> healthCheck;

    /** Used by the restart strategy. May be null. */
    public final RecoveryAction onRecover;

    /** Runs retries, health probes and recovery passes, so that they never run on a timer thread. */
    public final Executor executor;

    public AutoRecoveryConfig(String name, int maxRetries, long initialDelayMillis, long maxDelayMillis,
                              double backoffMultiplier, long healthCheckIntervalMillis, int failureThreshold,
                              int recoveryThreshold, long recoveryDelayMillis, AsyncOperation<?> healthCheck,
                              RecoveryAction onRecover, Executor executor) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty.");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialDelayMillis < 0) {
            throw new IllegalArgumentException("initialDelayMillis must be >= 0");
        }
        if (maxDelayMillis < initialDelayMillis) {
            throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
        }
        if (backoffMultiplier < 1.0 || Double.isNaN(backoffMultiplier) || Double.isInfinite(backoffMultiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be a finite number >= 1.0");
        }
        if (healthCheckIntervalMillis < 1) {
            throw new IllegalArgumentException("healthCheckIntervalMillis must be >= 1");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryThreshold < 1) {
            throw new IllegalArgumentException("recoveryThreshold must be >= 1");
        }
        if (recoveryDelayMillis < 0) {
            throw new IllegalArgumentException("recoveryDelayMillis must be >= 0");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null.");
        }
        this.name = name;
        this.maxRetries = maxRetries;
        this.initialDelayMillis = initialDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.backoffMultiplier = backoffMultiplier;
        this.healthCheckIntervalMillis = healthCheckIntervalMillis;
        this.failureThreshold = failureThreshold;
        this.recoveryThreshold = recoveryThreshold;
        this.recoveryDelayMillis = recoveryDelayMillis;
        this.healthCheck = healthCheck;
        this.onRecover = onRecover;
        this.executor = executor;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return String.format("AutoRecoveryConfig{name=%s, maxRetries=%d, initialDelayMillis=%d, maxDelayMillis=%d, "
                        + "backoffMultiplier=%s, failureThreshold=%d, recoveryThreshold=%d, healthCheck=%s}", name,
                maxRetries, initialDelayMillis, maxDelayMillis, backoffMultiplier, failureThreshold,
                recoveryThreshold, healthCheck != null);
    }

    /**
     * A convenience class to make constructor parameters less opaque.
     */
    public static class Builder {
        private final String name;
        private int maxRetries = 3;
        private long initialDelayMillis = 1000;
        private long maxDelayMillis = 30000;
        private double backoffMultiplier = 2.0;
        private long healthCheckIntervalMillis = 5000;
        private int failureThreshold = 3;
        private int recoveryThreshold = 2;
        private long recoveryDelayMillis = 1000;
        private AsyncOperation<?> healthCheck;
        private RecoveryAction onRecover;
        private Executor executor = Timers.workers;

        public Builder(String name) {
            this.name = name;
        }
        public Builder setMaxRetries(int value) {
            maxRetries = value;
            return this;
        }
        public Builder setInitialDelayMillis(long value) {
            initialDelayMillis = value;
            return this;
        }
        public Builder setMaxDelayMillis(long value) {
            maxDelayMillis = value;
            return this;
        }
        public Builder setBackoffMultiplier(double value) {
            backoffMultiplier = value;
            return this;
        }
        public Builder setHealthCheckIntervalMillis(long value) {
            healthCheckIntervalMillis = value;
            return this;
        }
        public Builder setFailureThreshold(int value) {
            failureThreshold = value;
            return this;
        }
        public Builder setRecoveryThreshold(int value) {
            recoveryThreshold = value;
            return this;
        }
        public Builder setRecoveryDelayMillis(long value) {
            recoveryDelayMillis = value;
            return this;
        }
        public Builder setHealthCheck(AsyncOperation<?> value) {
            healthCheck = value;
            return this;
        }
        public Builder setOnRecover(RecoveryAction value) {
            onRecover = value;
            return this;
        }
        public Builder setExecutor(Executor value) {
            executor = value;
            return this;
        }
        public AutoRecoveryConfig build() {
            return new AutoRecoveryConfig(name, maxRetries, initialDelayMillis, maxDelayMillis, backoffMultiplier,
                    healthCheckIntervalMillis, failureThreshold, recoveryThreshold, recoveryDelayMillis, healthCheck,
                    onRecover, executor);
        }
    }
}
