package co.codecraft.jresilience.bulkhead;

import java.util.Collections;
import java.util.List;

/**
 * Snapshot returned by {@link Bulkhead#getStatus()}.
 */
public class BulkheadStatus {
    public final String name;
    public final int currentConcurrency;
    public final int queueSize;
    /** Ids of the tasks holding a slot, in the order they started. */
    public final List<String> runningTasks;
    public final BulkheadMetrics metrics;
    public final BulkheadConfig config;

    public BulkheadStatus(String name, int currentConcurrency, int queueSize, List<String> runningTasks,
                          BulkheadMetrics metrics, BulkheadConfig config) {
        this.name = name;
        this.currentConcurrency = currentConcurrency;
        this.queueSize = queueSize;
        this.runningTasks = Collections.unmodifiableList(runningTasks);
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public String toString() {
        return String.format("BulkheadStatus{name=%s, currentConcurrency=%d, queueSize=%d}",
                name, currentConcurrency, queueSize);
    }
}
