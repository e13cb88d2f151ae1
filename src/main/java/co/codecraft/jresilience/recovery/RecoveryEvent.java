package co.codecraft.jresilience.recovery;

/**
 * Something observable that happened to an {@link AutoRecovery}. Fields that do not apply to an event's
 * {@link #type} are null (or 0).
 */
public class RecoveryEvent {

    public enum Type {
        STATE_CHANGED,
        SUCCESS,
        FAILURE,
        /** A call succeeded after at least one retry. */
        RECOVERY_SUCCESS,
        /** A call exhausted its retries. */
        RECOVERY_FAILURE,
        /** The degrade strategy ran. */
        DEGRADED,
        HEALTH_CHECK,
        /** One strategy of a recovery pass failed; the pass moves on. */
        STRATEGY_FAILED,
        /** A pass requested through {@link AutoRecovery#triggerRecovery()} finished. */
        MANUAL_RECOVERY,
        RESET
    }

    public final Type type;
    public final String name;
    public final long timestamp;
    public final RecoveryState oldState;
    public final RecoveryState state;
    public final Throwable error;
    public final int attempts;
    public final long recoveryTime;
    public final long failureCount;
    public final long successCount;
    /** STRATEGY_FAILED only. */
    public final String strategy;
    /** HEALTH_CHECK only. */
    public final HealthCheckResult healthCheck;

    private RecoveryEvent(Type type, String name, RecoveryState oldState, RecoveryState state, Throwable error,
                          int attempts, long recoveryTime, long failureCount, long successCount, String strategy,
                          HealthCheckResult healthCheck) {
        this.type = type;
        this.name = name;
        this.timestamp = System.currentTimeMillis();
        this.oldState = oldState;
        this.state = state;
        this.error = error;
        this.attempts = attempts;
        this.recoveryTime = recoveryTime;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.strategy = strategy;
        this.healthCheck = healthCheck;
    }

    static RecoveryEvent stateChanged(String name, RecoveryState oldState, RecoveryState state, long failureCount,
                                      long successCount) {
        return new RecoveryEvent(Type.STATE_CHANGED, name, oldState, state, null, 0, 0, failureCount, successCount,
                null, null);
    }

    static RecoveryEvent success(String name, RecoveryState state, long successCount) {
        return new RecoveryEvent(Type.SUCCESS, name, null, state, null, 0, 0, 0, successCount, null, null);
    }

    static RecoveryEvent failure(String name, RecoveryState state, Throwable error, long failureCount) {
        return new RecoveryEvent(Type.FAILURE, name, null, state, error, 0, 0, failureCount, 0, null, null);
    }

    static RecoveryEvent recoverySuccess(String name, RecoveryState state, int attempts, long recoveryTime) {
        return new RecoveryEvent(Type.RECOVERY_SUCCESS, name, null, state, null, attempts, recoveryTime, 0, 0, null,
                null);
    }

    static RecoveryEvent recoveryFailure(String name, RecoveryState state, RetryExhaustedException error) {
        return new RecoveryEvent(Type.RECOVERY_FAILURE, name, null, state, error, error.getAttempts(), 0, 0, 0, null,
                null);
    }

    static RecoveryEvent degraded(String name, Throwable reason) {
        return new RecoveryEvent(Type.DEGRADED, name, null, RecoveryState.DEGRADED, reason, 0, 0, 0, 0, null, null);
    }

    static RecoveryEvent healthCheck(String name, RecoveryState state, HealthCheckResult result) {
        return new RecoveryEvent(Type.HEALTH_CHECK, name, null, state, result.error, 0, 0, 0, 0, null, result);
    }

    static RecoveryEvent strategyFailed(String name, String strategy, Throwable error) {
        return new RecoveryEvent(Type.STRATEGY_FAILED, name, null, null, error, 0, 0, 0, 0, strategy, null);
    }

    static RecoveryEvent manualRecovery(String name, RecoveryState state) {
        return new RecoveryEvent(Type.MANUAL_RECOVERY, name, null, state, null, 0, 0, 0, 0, null, null);
    }

    static RecoveryEvent reset(String name) {
        return new RecoveryEvent(Type.RESET, name, null, RecoveryState.HEALTHY, null, 0, 0, 0, 0, null, null);
    }

    @Override
    public String toString() {
        return String.format("RecoveryEvent{type=%s, name=%s, state=%s}", type, name, state);
    }
}
