package co.codecraft.jresilience.breaker;

/**
 * Immutable settings for a {@link CircuitBreaker}. Use {@link #builder(String)}; every field but the name has a
 * default.
 */
public class CircuitBreakerConfig {

    /** Identifies the protected dependency in logs, events and errors. */
    public final String name;

    /** Open a closed circuit after this many consecutive failures. */
    public final int failureThreshold;

    /** How long an open circuit fails fast before letting a probe through. */
    public final long resetTimeoutMillis;

    /** Deadline for each protected call. A call that misses it counts as a failure. */
    public final long callTimeoutMillis;

    /** How often a metrics snapshot is published to listeners. Purely advisory. */
    public final long monitoringPeriodMillis;

    /**
     * If true, a half-open circuit admits one probe at a time and fails other callers fast. If false, every
     * caller that arrives while the circuit is half-open is let through.
     */
    public final boolean singleProbe;

    public CircuitBreakerConfig(String name, int failureThreshold, long resetTimeoutMillis, long callTimeoutMillis,
                                long monitoringPeriodMillis, boolean singleProbe) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty.");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException(
                    "failureThreshold must be positive; otherwise, the circuit breaker could never close.");
        }
        if (resetTimeoutMillis < 0) {
            throw new IllegalArgumentException("resetTimeoutMillis must be >= 0");
        }
        if (callTimeoutMillis < 1) {
            throw new IllegalArgumentException("callTimeoutMillis must be >= 1");
        }
        if (monitoringPeriodMillis < 1) {
            throw new IllegalArgumentException("monitoringPeriodMillis must be >= 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMillis = resetTimeoutMillis;
        this.callTimeoutMillis = callTimeoutMillis;
        this.monitoringPeriodMillis = monitoringPeriodMillis;
        this.singleProbe = singleProbe;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{name=%s, failureThreshold=%d, resetTimeoutMillis=%d, "
                        + "callTimeoutMillis=%d, monitoringPeriodMillis=%d, singleProbe=%b}", name, failureThreshold,
                resetTimeoutMillis, callTimeoutMillis, monitoringPeriodMillis, singleProbe);
    }

    /**
     * A convenience class to make constructor parameters less opaque.
     */
    public static class Builder {
        private final String name;
        private int failureThreshold = 5;
        private long resetTimeoutMillis = 60000;
        private long callTimeoutMillis = 10000;
        private long monitoringPeriodMillis = 60000;
        private boolean singleProbe = false;

        public Builder(String name) {
            this.name = name;
        }
        public Builder setFailureThreshold(int value) {
            failureThreshold = value;
            return this;
        }
        public Builder setResetTimeoutMillis(long value) {
            resetTimeoutMillis = value;
            return this;
        }
        public Builder setCallTimeoutMillis(long value) {
            callTimeoutMillis = value;
            return this;
        }
        public Builder setMonitoringPeriodMillis(long value) {
            monitoringPeriodMillis = value;
            return this;
        }
        public Builder setSingleProbe(boolean value) {
            singleProbe = value;
            return this;
        }
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(name, failureThreshold, resetTimeoutMillis, callTimeoutMillis,
                    monitoringPeriodMillis, singleProbe);
        }
    }
}
