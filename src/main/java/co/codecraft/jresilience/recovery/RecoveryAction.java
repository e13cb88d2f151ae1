package co.codecraft.jresilience.recovery;

import java.util.concurrent.CompletionStage;

/**
 * Active remediation supplied by the owner of an {@link AutoRecovery}: reconnect, flush a pool, restart a client.
 * Invoked by the {@link RecoveryStrategies#RESTART restart} strategy.
 */
public interface RecoveryAction {
    CompletionStage<?> recover(Throwable error) throws Exception;
}
