package co.codecraft.jresilience.bulkhead;

/**
 * Lifecycle of a {@link Task}. A task starts PENDING and ends in exactly one of the other states except RUNNING.
 */
public enum TaskStatus {
    /** Waiting in the queue for a free slot. */
    PENDING,
    /** Holding a slot; its execution timeout clock is ticking. */
    RUNNING,
    COMPLETED,
    FAILED,
    /** Ran past the execution timeout, or waited past the queue timeout. */
    TIMEOUT,
    /** Turned away because the queue was full, or dropped when the queue was cleared. */
    REJECTED
}
