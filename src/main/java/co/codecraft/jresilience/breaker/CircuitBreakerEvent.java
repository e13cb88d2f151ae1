package co.codecraft.jresilience.breaker;

/**
 * Something observable that happened to a {@link CircuitBreaker}. Fields that do not apply to an event's
 * {@link #type} are null (or 0).
 */
public class CircuitBreakerEvent {

    public enum Type {
        STATE_CHANGED,
        OPENED,
        SUCCESS,
        FAILURE,
        RESET,
        METRICS
    }

    public final Type type;
    public final String name;
    public final long timestamp;
    /** STATE_CHANGED only. */
    public final CircuitBreakerState oldState;
    /** The state after the event. */
    public final CircuitBreakerState state;
    /** FAILURE only. */
    public final Throwable error;
    /** SUCCESS and FAILURE: how long the call took, in millis. */
    public final long responseTime;
    /** Consecutive failures after the event. */
    public final long failureCount;
    /** OPENED only. */
    public final long nextAttemptAt;
    /** METRICS only. */
    public final CircuitBreakerStatus status;

    private CircuitBreakerEvent(Type type, String name, CircuitBreakerState oldState, CircuitBreakerState state,
                                Throwable error, long responseTime, long failureCount, long nextAttemptAt,
                                CircuitBreakerStatus status) {
        this.type = type;
        this.name = name;
        this.timestamp = System.currentTimeMillis();
        this.oldState = oldState;
        this.state = state;
        this.error = error;
        this.responseTime = responseTime;
        this.failureCount = failureCount;
        this.nextAttemptAt = nextAttemptAt;
        this.status = status;
    }

    static CircuitBreakerEvent stateChanged(String name, CircuitBreakerState oldState, CircuitBreakerState newState,
                                            long failureCount) {
        return new CircuitBreakerEvent(Type.STATE_CHANGED, name, oldState, newState, null, 0, failureCount, 0, null);
    }

    static CircuitBreakerEvent opened(String name, long failureCount, long nextAttemptAt) {
        return new CircuitBreakerEvent(Type.OPENED, name, null, CircuitBreakerState.OPEN, null, 0, failureCount,
                nextAttemptAt, null);
    }

    static CircuitBreakerEvent success(String name, CircuitBreakerState state, long responseTime) {
        return new CircuitBreakerEvent(Type.SUCCESS, name, null, state, null, responseTime, 0, 0, null);
    }

    static CircuitBreakerEvent failure(String name, CircuitBreakerState state, Throwable error, long responseTime,
                                       long failureCount) {
        return new CircuitBreakerEvent(Type.FAILURE, name, null, state, error, responseTime, failureCount, 0, null);
    }

    static CircuitBreakerEvent reset(String name) {
        return new CircuitBreakerEvent(Type.RESET, name, null, CircuitBreakerState.CLOSED, null, 0, 0, 0, null);
    }

    static CircuitBreakerEvent metrics(CircuitBreakerStatus status) {
        return new CircuitBreakerEvent(Type.METRICS, status.name, null, status.state, null, 0, status.failureCount,
                status.nextAttemptAt, status);
    }

    @Override
    public String toString() {
        return String.format("CircuitBreakerEvent{type=%s, name=%s, state=%s}", type, name, state);
    }
}
