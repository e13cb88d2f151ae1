package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.AsyncOperation;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One submission to a {@link Bulkhead}: the operation plus its bookkeeping. Timestamps are millis since the
 * epoch; 0 means "not yet".
 */
public class Task<T> {

    private final String id;
    final AsyncOperation<T> operation;
    final CompletableFuture<T> result = new CompletableFuture<T>();
    private final long createdAt = System.currentTimeMillis();

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile long startedAt;
    private volatile long completedAt;

    // Guarded by the owning bulkhead's monitor.
    ScheduledFuture<?> queueTimer;

    // The first of completion, execution timeout, queue timeout or queue clear wins.
    final AtomicBoolean settled = new AtomicBoolean(false);

    Task(String id, AsyncOperation<T> operation) {
        this.id = id;
        this.operation = operation;
    }

    public String getId() {
        return id;
    }

    public TaskStatus getStatus() {
        return status;
    }

    void setStatus(TaskStatus status) {
        this.status = status;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getStartedAt() {
        return startedAt;
    }

    void setStartedAt(long startedAt) {
        this.startedAt = startedAt;
    }

    public long getCompletedAt() {
        return completedAt;
    }

    void setCompletedAt(long completedAt) {
        this.completedAt = completedAt;
    }

    /**
     * @return how long the task waited for a slot; up to now if it is still waiting.
     */
    public long getQueueTime() {
        long end = startedAt != 0 ? startedAt : (completedAt != 0 ? completedAt : System.currentTimeMillis());
        return end - createdAt;
    }

    /**
     * @return how long the task held a slot; 0 if it never started.
     */
    public long getExecutionTime() {
        if (startedAt == 0) {
            return 0;
        }
        long end = completedAt != 0 ? completedAt : System.currentTimeMillis();
        return end - startedAt;
    }

    @Override
    public String toString() {
        return String.format("Task{id=%s, status=%s}", id, status);
    }
}
