package co.codecraft.jresilience.bulkhead;

/**
 * Something observable that happened to a {@link Bulkhead}. Fields that do not apply to an event's
 * {@link #type} are null (or 0).
 */
public class BulkheadEvent {

    public enum Type {
        TASK_QUEUED,
        TASK_STARTED,
        TASK_COMPLETED,
        /** Failed, or timed out while running or queued. */
        TASK_FAILED,
        TASK_REJECTED,
        QUEUE_CLEARED,
        METRICS
    }

    public final Type type;
    public final String name;
    public final long timestamp;
    public final String taskId;
    public final Throwable error;
    public final long executionTime;
    public final long queueTime;
    /** Queue length right after the event. */
    public final int queueSize;
    /** QUEUE_CLEARED only. */
    public final int clearedTasks;
    /** METRICS only. */
    public final BulkheadStatus status;

    private BulkheadEvent(Type type, String name, String taskId, Throwable error, long executionTime,
                          long queueTime, int queueSize, int clearedTasks, BulkheadStatus status) {
        this.type = type;
        this.name = name;
        this.timestamp = System.currentTimeMillis();
        this.taskId = taskId;
        this.error = error;
        this.executionTime = executionTime;
        this.queueTime = queueTime;
        this.queueSize = queueSize;
        this.clearedTasks = clearedTasks;
        this.status = status;
    }

    static BulkheadEvent taskQueued(String name, String taskId, int queueSize) {
        return new BulkheadEvent(Type.TASK_QUEUED, name, taskId, null, 0, 0, queueSize, 0, null);
    }

    static BulkheadEvent taskStarted(String name, Task<?> task, int queueSize) {
        return new BulkheadEvent(Type.TASK_STARTED, name, task.getId(), null, 0, task.getQueueTime(), queueSize, 0,
                null);
    }

    static BulkheadEvent taskCompleted(String name, Task<?> task, int queueSize) {
        return new BulkheadEvent(Type.TASK_COMPLETED, name, task.getId(), null, task.getExecutionTime(),
                task.getQueueTime(), queueSize, 0, null);
    }

    static BulkheadEvent taskFailed(String name, Task<?> task, Throwable error, int queueSize) {
        return new BulkheadEvent(Type.TASK_FAILED, name, task.getId(), error, task.getExecutionTime(),
                task.getQueueTime(), queueSize, 0, null);
    }

    static BulkheadEvent taskRejected(String name, String taskId, Throwable error, int queueSize) {
        return new BulkheadEvent(Type.TASK_REJECTED, name, taskId, error, 0, 0, queueSize, 0, null);
    }

    static BulkheadEvent queueCleared(String name, int clearedTasks) {
        return new BulkheadEvent(Type.QUEUE_CLEARED, name, null, null, 0, 0, 0, clearedTasks, null);
    }

    static BulkheadEvent metrics(BulkheadStatus status) {
        return new BulkheadEvent(Type.METRICS, status.name, null, null, 0, 0, status.queueSize, 0, status);
    }

    @Override
    public String toString() {
        return String.format("BulkheadEvent{type=%s, name=%s, taskId=%s}", type, name, taskId);
    }
}
