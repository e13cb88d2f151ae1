package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.ResilienceException;

/**
 * Every attempt of an {@link AutoRecovery#executeWithRecovery} call failed. The caller receives the last
 * underlying error itself; this wrapper is what the recovery pass and the
 * {@link RecoveryEvent.Type#RECOVERY_FAILURE RECOVERY_FAILURE} event see, with that error as its cause.
 */
public class RetryExhaustedException extends ResilienceException {

    private final int attempts;

    public RetryExhaustedException(String name, int attempts, Throwable lastError) {
        super(name, String.format("Auto-Recovery %s: gave up after %d attempts: %s", name, attempts, lastError),
                lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
