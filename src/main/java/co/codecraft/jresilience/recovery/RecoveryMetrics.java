package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.StateChange;

import java.util.List;

/**
 * A point-in-time copy of an {@link AutoRecovery}'s counters.
 */
public class RecoveryMetrics {
    public final long totalFailures;
    public final long totalRecoveries;
    public final long totalRetries;
    /** Exponentially weighted mean of recovery times, in millis. */
    public final double averageRecoveryTime;
    public final long longestOutage;
    /** When the current outage began, or 0 if there is none. */
    public final long currentOutageStart;
    public final long healthCheckSuccesses;
    public final long healthCheckFailures;
    /** Oldest first; unmodifiable. */
    public final List<StateChange<RecoveryState>> stateHistory;

    public RecoveryMetrics(long totalFailures, long totalRecoveries, long totalRetries, double averageRecoveryTime,
                           long longestOutage, long currentOutageStart, long healthCheckSuccesses,
                           long healthCheckFailures, List<StateChange<RecoveryState>> stateHistory) {
        this.totalFailures = totalFailures;
        this.totalRecoveries = totalRecoveries;
        this.totalRetries = totalRetries;
        this.averageRecoveryTime = averageRecoveryTime;
        this.longestOutage = longestOutage;
        this.currentOutageStart = currentOutageStart;
        this.healthCheckSuccesses = healthCheckSuccesses;
        this.healthCheckFailures = healthCheckFailures;
        this.stateHistory = stateHistory;
    }
}
