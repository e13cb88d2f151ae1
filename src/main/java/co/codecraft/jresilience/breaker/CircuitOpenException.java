package co.codecraft.jresilience.breaker;

import co.codecraft.jresilience.ResilienceException;

/**
 * Raised without invoking the protected operation because the circuit is open.
 */
public class CircuitOpenException extends ResilienceException {

    private final long nextAttemptAt;

    public CircuitOpenException(String name, long nextAttemptAt) {
        super(name, String.format("Circuit breaker %s is OPEN. Fast failing request.", name));
        this.nextAttemptAt = nextAttemptAt;
    }

    /**
     * @return millis since the epoch at which the circuit will let a probe through. 0 if the caller was turned
     * away because another half-open probe was already in flight.
     */
    public long getNextAttemptAt() {
        return nextAttemptAt;
    }
}
