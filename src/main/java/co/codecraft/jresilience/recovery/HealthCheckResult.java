package co.codecraft.jresilience.recovery;

/**
 * Outcome of the most recent health probe.
 */
public class HealthCheckResult {
    public final long timestamp;
    public final boolean healthy;
    /** What the probe returned, when healthy. */
    public final Object result;
    /** Why the probe failed, when unhealthy. */
    public final Throwable error;

    public HealthCheckResult(long timestamp, boolean healthy, Object result, Throwable error) {
        this.timestamp = timestamp;
        this.healthy = healthy;
        this.result = result;
        this.error = error;
    }

    @Override
    public String toString() {
        return healthy ? String.format("healthy@%d", timestamp) : String.format("unhealthy@%d (%s)", timestamp, error);
    }
}
