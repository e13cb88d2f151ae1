package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.ResilienceException;

/**
 * A health probe failed: it threw, completed exceptionally, or reported {@link Boolean#FALSE}.
 */
public class HealthCheckException extends ResilienceException {

    public HealthCheckException(String name) {
        super(name, String.format("Auto-Recovery %s: health check reported unhealthy", name));
    }

    public HealthCheckException(String name, Throwable cause) {
        super(name, String.format("Auto-Recovery %s: health check failed: %s", name, cause), cause);
    }
}
