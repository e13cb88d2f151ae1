package co.codecraft.jresilience.bulkhead;

import co.codecraft.jresilience.ResilienceException;

/**
 * Raised at submission when every slot is busy and the queue is at capacity. The task was never queued.
 */
public class QueueFullException extends ResilienceException {

    private final int maxQueueSize;

    public QueueFullException(String name, int maxQueueSize) {
        super(name, String.format("Bulkhead %s: Queue is full (%d)", name, maxQueueSize));
        this.maxQueueSize = maxQueueSize;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }
}
