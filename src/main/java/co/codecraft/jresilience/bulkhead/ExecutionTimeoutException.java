package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.ResilienceException;

/**
 * A running task exceeded the execution timeout. Its slot was released, but the operation itself was only
 * abandoned and may still be running.
 */
public class ExecutionTimeoutException extends ResilienceException {

    private final String taskId;
    private final long timeoutMillis;

    public ExecutionTimeoutException(String name, String taskId, long timeoutMillis) {
        super(name, String.format("Bulkhead %s: Task %s timeout after %dms", name, taskId, timeoutMillis));
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
