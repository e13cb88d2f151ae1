package co.codecraft.jresilience;

import co.codecraft.jresilience.breaker.CircuitBreakerState;
import co.codecraft.jresilience.breaker.CircuitBreakerStatus;
import co.codecraft.jresilience.bulkhead.BulkheadStatus;
import co.codecraft.jresilience.recovery.AutoRecoveryStatus;
import co.codecraft.jresilience.recovery.RecoveryState;

/**
 * The statuses of the three components guarding one dependency, taken one after another (not atomically).
 */
public class ProtectedDependencyStatus {
    public final String name;
    public final BulkheadStatus bulkhead;
    public final CircuitBreakerStatus circuitBreaker;
    /** Null when the dependency has no auto-recovery. */
    public final AutoRecoveryStatus autoRecovery;

    public ProtectedDependencyStatus(String name, BulkheadStatus bulkhead, CircuitBreakerStatus circuitBreaker,
                                     AutoRecoveryStatus autoRecovery) {
        this.name = name;
        this.bulkhead = bulkhead;
        this.circuitBreaker = circuitBreaker;
        this.autoRecovery = autoRecovery;
    }

    /**
     * True when the breaker is closed and the auto-recovery, if any, reports the dependency healthy.
     */
    public boolean isHealthy() {
        return circuitBreaker.state == CircuitBreakerState.CLOSED
                && (autoRecovery == null || autoRecovery.state == RecoveryState.HEALTHY);
    }

    @Override
    public String toString() {
        return String.format("ProtectedDependencyStatus{name=%s, breaker=%s, running=%d, queued=%d, recovery=%s}",
                name, circuitBreaker.state, bulkhead.currentConcurrency, bulkhead.queueSize,
                autoRecovery == null ? "none" : autoRecovery.state.toString());
    }
}
