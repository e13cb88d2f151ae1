package co.codecraft.jresilience.recovery;

import java.util.List;

/**
 * A point-in-time copy of everything observable about an {@link AutoRecovery}.
 */
public class AutoRecoveryStatus {
    public final String name;
    public final RecoveryState state;
    /** True while a recovery pass is running. */
    public final boolean recovering;
    public final long failureCount;
    public final long successCount;
    /** Null until the first probe finishes. */
    public final HealthCheckResult lastHealthCheck;
    public final RecoveryMetrics metrics;
    public final AutoRecoveryConfig config;
    /** Registered strategy names, in the order a pass runs them. */
    public final List<String> strategies;

    public AutoRecoveryStatus(String name, RecoveryState state, boolean recovering, long failureCount,
                              long successCount, HealthCheckResult lastHealthCheck, RecoveryMetrics metrics,
                              AutoRecoveryConfig config, List<String> strategies) {
        this.name = name;
        this.state = state;
        this.recovering = recovering;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.lastHealthCheck = lastHealthCheck;
        this.metrics = metrics;
        this.config = config;
        this.strategies = strategies;
    }

    @Override
    public String toString() {
        return String.format("AutoRecoveryStatus{name=%s, state=%s, recovering=%s, failures=%d, successes=%d}",
                name, state, recovering, failureCount, successCount);
    }
}
