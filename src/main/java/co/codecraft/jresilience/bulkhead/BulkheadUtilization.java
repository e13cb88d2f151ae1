package co.codecraft.jresilience.bulkhead;

/**
 * How full a bulkhead is, as percentages of its configured capacity.
 */
public class BulkheadUtilization {
    /** running / maxConcurrent * 100 */
    public final double concurrencyUtilization;
    /** queued / maxQueueSize * 100; 0 when the bulkhead has no queue. */
    public final double queueUtilization;
    public final boolean atCapacity;
    public final boolean queueFull;

    public BulkheadUtilization(double concurrencyUtilization, double queueUtilization, boolean atCapacity,
                               boolean queueFull) {
        this.concurrencyUtilization = concurrencyUtilization;
        this.queueUtilization = queueUtilization;
        this.atCapacity = atCapacity;
        this.queueFull = queueFull;
    }
}
