package co.codecraft.jresilience.breaker;

/**
 * Snapshot returned by {@link CircuitBreaker#getStatus()}.
 */
public class CircuitBreakerStatus {
    public final String name;
    public final CircuitBreakerState state;
    public final long failureCount;
    public final long successCount;
    /** Only meaningful while {@link #state} is {@link CircuitBreakerState#OPEN}. */
    public final long nextAttemptAt;
    public final CircuitBreakerMetrics metrics;
    public final CircuitBreakerConfig config;

    public CircuitBreakerStatus(String name, CircuitBreakerState state, long failureCount, long successCount,
                                long nextAttemptAt, CircuitBreakerMetrics metrics, CircuitBreakerConfig config) {
        this.name = name;
        this.state = state;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.nextAttemptAt = nextAttemptAt;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerStatus{name=%s, state=%s, failureCount=%d, successCount=%d}",
                name, state, failureCount, successCount);
    }
}
