package co.codecraft.jresilience.breaker;

import co.codecraft.jresilience.ResilienceException;

/**
 * The protected call did not finish within the breaker's call timeout. The call itself may still be running.
 */
public class CallTimeoutException extends ResilienceException {

    private final long timeoutMillis;

    public CallTimeoutException(String name, long timeoutMillis) {
        super(name, String.format("Circuit breaker %s: Request timeout after %dms", name, timeoutMillis));
        this.timeoutMillis = timeoutMillis;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
