package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.ResilienceException;

/**
 * A queued task waited longer than the queue timeout for a free slot. It was removed from the queue and never
 * ran.
 */
public class QueueTimeoutException extends ResilienceException {

    private final String taskId;
    private final long timeoutMillis;

    public QueueTimeoutException(String name, String taskId, long timeoutMillis) {
        super(name, String.format("Bulkhead %s: Task %s queue timeout after %dms", name, taskId, timeoutMillis));
        this.taskId = taskId;
        this.timeoutMillis = timeoutMillis;
    }

    public String getTaskId() {
        return taskId;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
