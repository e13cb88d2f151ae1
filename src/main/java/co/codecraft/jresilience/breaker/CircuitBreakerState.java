package co.codecraft.jresilience.breaker;

/**
 * Describe the current condition of a circuit breaker.
 */
public enum CircuitBreakerState {

    /** The circuit is closed. Calls pass through; the dependency is healthy. */
    CLOSED,

    /** The circuit is open (tripped by consecutive failures). Calls fail fast without reaching the dependency. */
    OPEN,

    /**
     * The reset timeout has elapsed. Calls are let through as probes; a success closes the circuit, a failure
     * opens it again.
     */
    HALF_OPEN
}
