package co.codecraft.jresilience.bulkhead;

/**
 * A point-in-time copy of a bulkhead's counters.
 */
public class BulkheadMetrics {
    public final long totalSubmitted;
    public final long totalCompleted;
    public final long totalFailed;
    /** Execution timeouts and queue timeouts together. */
    public final long totalTimeout;
    /** Rejected at submission, plus dropped by a queue clear. */
    public final long totalRejected;
    /** Exponentially weighted mean time tasks held a slot, in millis. */
    public final double averageExecutionTime;
    /** Exponentially weighted mean time tasks waited for a slot, in millis. */
    public final double averageQueueTime;
    public final int peakConcurrency;
    public final int peakQueueSize;
    public final int currentConcurrency;
    public final int currentQueueSize;

    public BulkheadMetrics(long totalSubmitted, long totalCompleted, long totalFailed, long totalTimeout,
                           long totalRejected, double averageExecutionTime, double averageQueueTime,
                           int peakConcurrency, int peakQueueSize, int currentConcurrency, int currentQueueSize) {
        this.totalSubmitted = totalSubmitted;
        this.totalCompleted = totalCompleted;
        this.totalFailed = totalFailed;
        this.totalTimeout = totalTimeout;
        this.totalRejected = totalRejected;
        this.averageExecutionTime = averageExecutionTime;
        this.averageQueueTime = averageQueueTime;
        this.peakConcurrency = peakConcurrency;
        this.peakQueueSize = peakQueueSize;
        this.currentConcurrency = currentConcurrency;
        this.currentQueueSize = currentQueueSize;
    }
}
