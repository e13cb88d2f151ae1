package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.ResilienceException;

/**
 * The task was still queued when {@link Bulkhead#clearQueue()} or {@link Bulkhead#destroy()} ran.
 */
public class QueueClearedException extends ResilienceException {

    private final String taskId;

    public QueueClearedException(String name, String taskId) {
        super(name, String.format("Bulkhead %s: Queue cleared (task %s)", name, taskId));
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
