package co.codecraft.jresilience.recovery;

/**
 * Summary figures derived from {@link RecoveryMetrics}.
 */
public class RecoveryStats {
    public final long totalFailures;
    public final long totalRecoveries;
    public final long totalRetries;
    /** Share of health probes that passed, 0..1; 0 when nothing has been probed yet. */
    public final double healthCheckSuccessRate;
    public final double averageRecoveryTime;
    public final long longestOutage;
    /** Length of the outage in progress, or 0. */
    public final long currentOutage;

    public RecoveryStats(long totalFailures, long totalRecoveries, long totalRetries, double healthCheckSuccessRate,
                         double averageRecoveryTime, long longestOutage, long currentOutage) {
        this.totalFailures = totalFailures;
        this.totalRecoveries = totalRecoveries;
        this.totalRetries = totalRetries;
        this.healthCheckSuccessRate = healthCheckSuccessRate;
        this.averageRecoveryTime = averageRecoveryTime;
        this.longestOutage = longestOutage;
        this.currentOutage = currentOutage;
    }

    @Override
    public String toString() {
        return String.format("RecoveryStats{failures=%d, recoveries=%d, retries=%d, healthRate=%.2f, "
                        + "longestOutage=%d, currentOutage=%d}", totalFailures, totalRecoveries, totalRetries,
                healthCheckSuccessRate, longestOutage, currentOutage);
    }
}
