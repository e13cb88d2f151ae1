package co.codecraft.jresilience.recovery;

import java.util.concurrent.CompletionStage;

/**
 * One step of a recovery pass. Strategies run in registration order; the first one whose stage completes
 * normally ends the pass. A strategy that throws or completes exceptionally is logged and the pass moves on to
 * the next one.
 *
 * @see RecoveryStrategies for the defaults every {@link AutoRecovery} starts with.
 */
public interface RecoveryStrategy {

    /** Unique within one {@link AutoRecovery}; registering a second strategy with the same name replaces the first. */
    String getName();

    /**
     * @param error  What triggered the pass.
     * @param recovery  The instance running the pass.
     */
    CompletionStage<?> execute(Throwable error, AutoRecovery recovery) throws Exception;
}
