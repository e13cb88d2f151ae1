package co.codecraft.jresilience.recovery;

/**
 * Health of the dependency an {@link AutoRecovery} watches over.
 *
 * <pre>
 *    {@link #HEALTHY} --one failure--&gt; {@link #DEGRADED}
 *    {@link #DEGRADED} --failureThreshold consecutive failures--&gt; {@link #FAILED}
 *    {@link #FAILED} --recovery pass starts--&gt; {@link #RECOVERING}
 *    {@link #RECOVERING} --failureThreshold consecutive failures--&gt; {@link #FAILED}
 *    any but HEALTHY --recoveryThreshold consecutive successes--&gt; {@link #HEALTHY}
 * </pre>
 */
public enum RecoveryState {
    HEALTHY,
    /** Something failed, but not often enough to call the dependency down. */
    DEGRADED,
    /** A recovery pass is running its strategies. */
    RECOVERING,
    /** Consecutive failures reached the threshold. */
    FAILED
}
