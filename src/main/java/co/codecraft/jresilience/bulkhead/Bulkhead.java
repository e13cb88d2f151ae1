package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.AsyncOperation;
import co.codecraft.jresilience.ListenerList;
import co.codecraft.jresilience.MovingAverage;
import co.codecraft.jresilience.Operations;
import co.codecraft.jresilience.ResilienceListener;
import co.codecraft.jresilience.Timers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * <p>Isolates one class of resource (a downstream service, a connection pool, an expensive code path) by bounding
 * how many of its tasks may run at once. Named after the watertight compartments of a ship: when one resource
 * slows down, only its own slots fill up, and unrelated work keeps flowing.</p>
 *
 * <p>A submitted task runs immediately if fewer than {@link BulkheadConfig#maxConcurrent} tasks are running.
 * Otherwise it waits in a FIFO queue of at most {@link BulkheadConfig#maxQueueSize} tasks; if the queue is full
 * too, the submission fails at once with a {@link QueueFullException}. A queued task that waits longer than
 * {@link BulkheadConfig#queueTimeoutMillis} is removed and fails with a {@link QueueTimeoutException}.</p>
 *
 * <p>Each freed slot takes exactly one task from the head of the queue. The execution timeout of a task starts
 * when it starts running, never while it is queued. A task that exceeds it fails with an
 * {@link ExecutionTimeoutException} and gives up its slot right away; the operation is abandoned, not stopped,
 * so it may keep consuming the resource until it finishes on its own.</p>
 *
 * <p>All bookkeeping happens under one monitor, held only while slots and the queue are updated. Operations are
 * never invoked while it is held. Tasks that have been granted a slot are started by a single drain loop in the
 * order they were granted it, so a task never starts before one that was queued ahead of it.</p>
 *
 * <p>Listeners are notified before the caller's future completes. Timeouts and periodic metrics are delivered on
 * {@link BulkheadConfig#executor}; the shared timer thread only does the bookkeeping.</p>
 */
public class Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(Bulkhead.class);

    public final BulkheadConfig config;

    private final ListenerList<BulkheadEvent> listeners;
    private final AtomicLong taskSequence = new AtomicLong(0);

    private final Object lock = new Object();
    private final Map<String, Task<?>> running = new LinkedHashMap<String, Task<?>>();
    private final ArrayDeque<Task<?>> queue = new ArrayDeque<Task<?>>();
    // Tasks holding a slot but not started yet, in the order the slots were granted.
    private final ConcurrentLinkedQueue<Task<?>> ready = new ConcurrentLinkedQueue<Task<?>>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private long totalSubmitted;
    private long totalCompleted;
    private long totalFailed;
    private long totalTimeout;
    private long totalRejected;
    private int peakConcurrency;
    private int peakQueueSize;
    private final MovingAverage executionTime = new MovingAverage();
    private final MovingAverage queueTime = new MovingAverage();

    private final ScheduledFuture<?> monitor;

    /**
     * @param config  May not be null.
     */
    public Bulkhead(BulkheadConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null.");
        }
        this.config = config;
        this.listeners = new ListenerList<BulkheadEvent>(config.name);
        this.monitor = Timers.scheduledExecutorService.scheduleAtFixedRate(new Runnable() {
            @Override
            public void run() {
                Operations.handOff(Bulkhead.this.config.executor, new Runnable() {
                    @Override
                    public void run() {
                        publishMetrics();
                    }
                });
            }
        }, config.metricsIntervalMillis, config.metricsIntervalMillis, TimeUnit.MILLISECONDS);
        log.info("Bulkhead {} initialized (maxConcurrent={}, maxQueueSize={}, timeout={}ms)",
                config.name, config.maxConcurrent, config.maxQueueSize, config.executionTimeoutMillis);
    }

    public String getName() {
        return config.name;
    }

    /**
     * Run <code>operation</code> in one of this bulkhead's slots, now or once one frees up.
     *
     * @return a future that completes with the operation's result, with the operation's own error, or with a
     * {@link QueueFullException}, {@link QueueTimeoutException}, {@link ExecutionTimeoutException} or
     * {@link QueueClearedException}.
     */
    public <T> CompletableFuture<T> execute(AsyncOperation<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null.");
        }
        final Task<T> task = new Task<T>(config.name + "-" + taskSequence.incrementAndGet(), operation);
        boolean granted = false;
        boolean queued = false;
        int queueSize;
        synchronized (lock) {
            ++totalSubmitted;
            if (running.size() < config.maxConcurrent) {
                markRunning(task);
                granted = true;
            } else if (queue.size() < config.maxQueueSize) {
                queue.addLast(task);
                peakQueueSize = Math.max(peakQueueSize, queue.size());
                task.queueTimer = Timers.scheduledExecutorService.schedule(new Runnable() {
                    @Override
                    public void run() {
                        expire(task);
                    }
                }, config.queueTimeoutMillis, TimeUnit.MILLISECONDS);
                queued = true;
            } else {
                ++totalRejected;
                task.setStatus(TaskStatus.REJECTED);
                task.setCompletedAt(System.currentTimeMillis());
                task.settled.set(true);
            }
            queueSize = queue.size();
        }

        if (granted) {
            drainOnCallingThread();
        } else if (queued) {
            log.debug("Bulkhead {} queued task {} (queueSize={})", config.name, task.getId(), queueSize);
            listeners.fire(BulkheadEvent.taskQueued(config.name, task.getId(), queueSize));
        } else {
            QueueFullException e = new QueueFullException(config.name, config.maxQueueSize);
            log.warn("Bulkhead {} rejected task {}: queue is full ({})", config.name, task.getId(),
                    config.maxQueueSize);
            listeners.fire(BulkheadEvent.taskRejected(config.name, task.getId(), e, queueSize));
            task.result.completeExceptionally(e);
        }
        return task.result;
    }

    // Caller holds the lock.
    private void markRunning(Task<?> task) {
        if (task.queueTimer != null) {
            task.queueTimer.cancel(false);
            task.queueTimer = null;
        }
        task.setStatus(TaskStatus.RUNNING);
        task.setStartedAt(System.currentTimeMillis());
        running.put(task.getId(), task);
        peakConcurrency = Math.max(peakConcurrency, running.size());
        ready.add(task);
    }

    // Start granted tasks right here, unless another thread is already draining; it will pick them up.
    private void drainOnCallingThread() {
        if (draining.compareAndSet(false, true)) {
            drain();
        }
    }

    // Start granted tasks on the executor, never on the thread that freed the slot.
    private void drainOnExecutor() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            config.executor.execute(new Runnable() {
                @Override
                public void run() {
                    drain();
                }
            });
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("Bulkhead {} could not start queued tasks", config.name, e);
            Task<?> task;
            while ((task = ready.poll()) != null) {
                fail(task, e);
            }
        }
    }

    // Caller owns the draining flag.
    private void drain() {
        do {
            try {
                Task<?> task;
                while ((task = ready.poll()) != null) {
                    start(task);
                }
            } finally {
                draining.set(false);
            }
        } while (!ready.isEmpty() && draining.compareAndSet(false, true));
    }

    private <T> void fail(Task<T> task, Throwable error) {
        settle(task, null, error, false);
    }

    private <T> void start(final Task<T> task) {
        log.debug("Bulkhead {} executing task {} (queueTime={}ms)", config.name, task.getId(), task.getQueueTime());
        listeners.fire(BulkheadEvent.taskStarted(config.name, task, getQueueSize()));

        // The execution clock starts now, not at submission.
        final ScheduledFuture<?> timer = Timers.scheduledExecutorService.schedule(new Runnable() {
            @Override
            public void run() {
                settle(task, null, new ExecutionTimeoutException(config.name, task.getId(),
                        config.executionTimeoutMillis), true);
            }
        }, config.executionTimeoutMillis, TimeUnit.MILLISECONDS);

        Operations.invoke(task.operation).whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                timer.cancel(false);
                settle(task, value, error == null ? null : Operations.unwrap(error), false);
            }
        });
    }

    /**
     * Record how a running task ended, free its slot and hand the slot to the head of the queue. Only the first
     * call per task has any effect. When called from the execution timer, the caller is notified on the executor.
     */
    private <T> void settle(final Task<T> task, final T value, final Throwable error, boolean timedOut) {
        if (!task.settled.compareAndSet(false, true)) {
            return;
        }
        boolean granted;
        final int queueSize;
        synchronized (lock) {
            running.remove(task.getId());
            task.setCompletedAt(System.currentTimeMillis());
            if (error == null) {
                task.setStatus(TaskStatus.COMPLETED);
                ++totalCompleted;
            } else if (timedOut) {
                task.setStatus(TaskStatus.TIMEOUT);
                ++totalTimeout;
            } else {
                task.setStatus(TaskStatus.FAILED);
                ++totalFailed;
            }
            executionTime.add(task.getExecutionTime());
            queueTime.add(task.getQueueTime());
            Task<?> next = queue.pollFirst();
            granted = next != null;
            if (granted) {
                markRunning(next);
            }
            queueSize = queue.size();
        }

        if (timedOut) {
            Operations.handOff(config.executor, new Runnable() {
                @Override
                public void run() {
                    report(task, value, error, queueSize);
                }
            });
        } else {
            report(task, value, error, queueSize);
        }

        if (granted) {
            drainOnExecutor();
        }
    }

    private <T> void report(Task<T> task, T value, Throwable error, int queueSize) {
        if (error == null) {
            log.debug("Bulkhead {} task {} completed (executionTime={}ms, queueTime={}ms)",
                    config.name, task.getId(), task.getExecutionTime(), task.getQueueTime());
            listeners.fire(BulkheadEvent.taskCompleted(config.name, task, queueSize));
            task.result.complete(value);
        } else {
            log.warn("Bulkhead {} task {} failed: {} (executionTime={}ms, queueTime={}ms)",
                    config.name, task.getId(), error.toString(), task.getExecutionTime(), task.getQueueTime());
            listeners.fire(BulkheadEvent.taskFailed(config.name, task, error, queueSize));
            task.result.completeExceptionally(error);
        }
    }

    // Queue timer fired. Does nothing if the task already left the queue.
    private void expire(final Task<?> task) {
        boolean removed;
        final int queueSize;
        synchronized (lock) {
            removed = queue.remove(task);
            if (removed) {
                task.queueTimer = null;
                task.setStatus(TaskStatus.TIMEOUT);
                task.setCompletedAt(System.currentTimeMillis());
                ++totalTimeout;
                queueTime.add(task.getQueueTime());
            }
            queueSize = queue.size();
        }
        if (!removed || !task.settled.compareAndSet(false, true)) {
            return;
        }
        Operations.handOff(config.executor, new Runnable() {
            @Override
            public void run() {
                QueueTimeoutException e = new QueueTimeoutException(config.name, task.getId(),
                        config.queueTimeoutMillis);
                log.warn("Bulkhead {} task {} timed out in queue after {}ms", config.name, task.getId(),
                        config.queueTimeoutMillis);
                listeners.fire(BulkheadEvent.taskFailed(config.name, task, e, queueSize));
                task.result.completeExceptionally(e);
            }
        });
    }

    /**
     * Reject every queued task with a {@link QueueClearedException}. Running tasks are not touched.
     *
     * @return how many tasks were dropped.
     */
    public int clearQueue() {
        List<Task<?>> cleared;
        synchronized (lock) {
            cleared = new ArrayList<Task<?>>(queue);
            queue.clear();
            long now = System.currentTimeMillis();
            for (Task<?> task : cleared) {
                if (task.queueTimer != null) {
                    task.queueTimer.cancel(false);
                    task.queueTimer = null;
                }
                task.setStatus(TaskStatus.REJECTED);
                task.setCompletedAt(now);
                ++totalRejected;
            }
        }
        for (Task<?> task : cleared) {
            if (task.settled.compareAndSet(false, true)) {
                task.result.completeExceptionally(new QueueClearedException(config.name, task.getId()));
            }
        }
        if (!cleared.isEmpty()) {
            log.warn("Bulkhead {} queue cleared ({} tasks rejected)", config.name, cleared.size());
        }
        listeners.fire(BulkheadEvent.queueCleared(config.name, cleared.size()));
        return cleared.size();
    }

    public int getRunningCount() {
        synchronized (lock) {
            return running.size();
        }
    }

    public int getQueueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public BulkheadStatus getStatus() {
        synchronized (lock) {
            BulkheadMetrics metrics = new BulkheadMetrics(totalSubmitted, totalCompleted, totalFailed, totalTimeout,
                    totalRejected, executionTime.get(), queueTime.get(), peakConcurrency, peakQueueSize,
                    running.size(), queue.size());
            return new BulkheadStatus(config.name, running.size(), queue.size(),
                    new ArrayList<String>(running.keySet()), metrics, config);
        }
    }

    public BulkheadUtilization getUtilization() {
        int r;
        int q;
        synchronized (lock) {
            r = running.size();
            q = queue.size();
        }
        double queueUtilization = config.maxQueueSize == 0 ? 0.0 : (q * 100.0) / config.maxQueueSize;
        return new BulkheadUtilization((r * 100.0) / config.maxConcurrent, queueUtilization,
                r >= config.maxConcurrent, q >= config.maxQueueSize);
    }

    public void addListener(ResilienceListener<BulkheadEvent> listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ResilienceListener<BulkheadEvent> listener) {
        return listeners.remove(listener);
    }

    private void publishMetrics() {
        try {
            listeners.fire(BulkheadEvent.metrics(getStatus()));
        } catch (RuntimeException e) {
            log.error("Bulkhead {} failed to publish metrics", config.name, e);
        }
    }

    /**
     * Stop the metrics timer, reject everything still queued, and drop all listeners. Running tasks are left to
     * finish on their own.
     */
    public void destroy() {
        monitor.cancel(false);
        clearQueue();
        List<String> stillRunning;
        synchronized (lock) {
            stillRunning = new ArrayList<String>(running.keySet());
        }
        for (String id : stillRunning) {
            log.warn("Bulkhead {} destroyed while task {} is still running; it will not be interrupted",
                    config.name, id);
        }
        listeners.clear();
        log.info("Bulkhead {} destroyed", config.name);
    }
}
