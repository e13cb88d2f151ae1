package co.codecraft.jresilience.breaker;

import co.codecraft.jresilience.StateChange;

import java.util.Collections;
import java.util.List;

/**
 * A point-in-time copy of a breaker's counters. Nothing here is shared with the live breaker.
 */
public class CircuitBreakerMetrics {
    public final long totalRequests;
    public final long totalFailures;
    public final long totalSuccesses;
    public final long totalTimeouts;
    public final long totalOpens;
    /** Calls turned away without invoking the operation. */
    public final long totalRejected;
    /** Exponentially weighted mean latency of invoked calls, in millis. */
    public final double averageResponseTime;
    /** Millis since the epoch; 0 if no failure was recorded. */
    public final long lastFailureTime;
    /** Millis since the epoch; 0 if no success was recorded. */
    public final long lastSuccessTime;
    /** Oldest first, at most the last 100 transitions. */
    public final List<StateChange<CircuitBreakerState>> stateHistory;

    public CircuitBreakerMetrics(long totalRequests, long totalFailures, long totalSuccesses, long totalTimeouts,
                                 long totalOpens, long totalRejected, double averageResponseTime,
                                 long lastFailureTime, long lastSuccessTime,
                                 List<StateChange<CircuitBreakerState>> stateHistory) {
        this.totalRequests = totalRequests;
        this.totalFailures = totalFailures;
        this.totalSuccesses = totalSuccesses;
        this.totalTimeouts = totalTimeouts;
        this.totalOpens = totalOpens;
        this.totalRejected = totalRejected;
        this.averageResponseTime = averageResponseTime;
        this.lastFailureTime = lastFailureTime;
        this.lastSuccessTime = lastSuccessTime;
        this.stateHistory = Collections.unmodifiableList(stateHistory);
    }
}
