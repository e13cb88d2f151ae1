package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.Operations;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * The strategies every {@link AutoRecovery} is created with, in the order a pass tries them: wait and probe,
 * then run the owner's remediation, then accept degraded service.
 */
public final class RecoveryStrategies {

    public static final String RETRY_DELAY = "retry-delay";
    public static final String RESTART = "restart";
    public static final String DEGRADE = "degrade";

    private RecoveryStrategies() {
    }

    /**
     * Wait {@link AutoRecoveryConfig#recoveryDelayMillis}, then run the health check if there is one. Fails when
     * the probe does.
     */
    public static RecoveryStrategy retryDelay() {
        return new RecoveryStrategy() {
            @Override
            public String getName() {
                return RETRY_DELAY;
            }

            @Override
            public CompletionStage<?> execute(Throwable error, final AutoRecovery recovery) {
                return recovery.delay(recovery.config.recoveryDelayMillis).thenComposeAsync(
                        new Function<Void, CompletionStage<Object>>() {
                            @Override
                            public CompletionStage<Object> apply(Void ignored) {
                                return recovery.performHealthCheck();
                            }
                        }, recovery.config.executor);
            }
        };
    }

    /**
     * Invoke {@link AutoRecoveryConfig#onRecover}. Fails when none is configured, so the pass falls through to the
     * next strategy.
     */
    public static RecoveryStrategy restart() {
        return new RecoveryStrategy() {
            @Override
            public String getName() {
                return RESTART;
            }

            @Override
            public CompletionStage<?> execute(Throwable error, AutoRecovery recovery) throws Exception {
                RecoveryAction action = recovery.config.onRecover;
                if (action == null) {
                    return Operations.failed(new IllegalStateException(
                            "No onRecover action configured for " + recovery.getName()));
                }
                return action.recover(error);
            }
        };
    }

    /**
     * Mark the dependency {@link RecoveryState#DEGRADED}. Always succeeds.
     */
    public static RecoveryStrategy degrade() {
        return new RecoveryStrategy() {
            @Override
            public String getName() {
                return DEGRADE;
            }

            @Override
            public CompletionStage<?> execute(Throwable error, AutoRecovery recovery) {
                recovery.degrade(error);
                return CompletableFuture.completedFuture(null);
            }
        };
    }

    static List<RecoveryStrategy> defaults() {
        List<RecoveryStrategy> list = new ArrayList<RecoveryStrategy>();
        list.add(retryDelay());
        list.add(restart());
        list.add(degrade());
        return list;
    }
}
