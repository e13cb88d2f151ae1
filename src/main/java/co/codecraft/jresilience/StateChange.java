package co.codecraft.jresilience;

/**
 * One entry in a component's state history.
 *
 * @param <S>  The component's state enum.
 */
public class StateChange<S extends Enum<S>> {

    public final S state;

    /** Millis since the epoch. */
    public final long timestamp;

    /** Consecutive failures at the moment of the change. */
    public final long failureCount;

    /** Consecutive successes at the moment of the change. */
    public final long successCount;

    public StateChange(S state, long timestamp, long failureCount, long successCount) {
        this.state = state;
        this.timestamp = timestamp;
        this.failureCount = failureCount;
        this.successCount = successCount;
    }

    @Override
    public String toString() {
        return String.format("%s@%d (failures=%d, successes=%d)", state, timestamp, failureCount, successCount);
    }
}
