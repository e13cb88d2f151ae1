package co.codecraft.jresilience;

import co.codecraft.jresilience.breaker.CircuitBreaker;
import co.codecraft.jresilience.breaker.CircuitBreakerConfig;
import co.codecraft.jresilience.bulkhead.Bulkhead;
import co.codecraft.jresilience.bulkhead.BulkheadConfig;
import co.codecraft.jresilience.recovery.AutoRecovery;
import co.codecraft.jresilience.recovery.AutoRecoveryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * <p>The full protection stack for one remote dependency. A call is admitted by the {@link Bulkhead}, passes the
 * {@link CircuitBreaker}, and is retried by the {@link AutoRecovery} (when there is one):</p>
 *
 * <pre>
 *    caller -&gt; Bulkhead.execute -&gt; CircuitBreaker.execute -&gt; AutoRecovery.executeWithRecovery -&gt; operation
 * </pre>
 *
 * <p>Each layer only sees whether the layer inside it succeeded or failed. In particular the breaker counts one
 * failure per exhausted retry sequence, not one per attempt, and a breaker timeout covers all retries.</p>
 */
public class ProtectedDependency {

    private static final Logger log = LoggerFactory.getLogger(ProtectedDependency.class);

    public final String name;
    private final Bulkhead bulkhead;
    private final CircuitBreaker circuitBreaker;
    private final AutoRecovery autoRecovery;

    /**
     * @param autoRecovery  May be null, in which case operations are not retried.
     */
    public ProtectedDependency(String name, Bulkhead bulkhead, CircuitBreaker circuitBreaker,
                               AutoRecovery autoRecovery) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty.");
        }
        if (bulkhead == null || circuitBreaker == null) {
            throw new IllegalArgumentException("A protected dependency needs both a bulkhead and a circuit breaker.");
        }
        this.name = name;
        this.bulkhead = bulkhead;
        this.circuitBreaker = circuitBreaker;
        this.autoRecovery = autoRecovery;
        log.info("Protected dependency {} initialized (autoRecovery={})", name, autoRecovery != null);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public <T> CompletableFuture<T> execute(final AsyncOperation<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null.");
        }
        final AsyncOperation<T> retried;
        if (autoRecovery == null) {
            retried = operation;
        } else {
            retried = new AsyncOperation<T>() {
                @Override
                public CompletionStage<T> call() {
                    return autoRecovery.executeWithRecovery(operation);
                }
            };
        }
        return bulkhead.execute(new AsyncOperation<T>() {
            @Override
            public CompletionStage<T> call() {
                return circuitBreaker.execute(retried);
            }
        });
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /** May be null. */
    public AutoRecovery getAutoRecovery() {
        return autoRecovery;
    }

    public ProtectedDependencyStatus getStatus() {
        return new ProtectedDependencyStatus(name, bulkhead.getStatus(), circuitBreaker.getStatus(),
                autoRecovery == null ? null : autoRecovery.getStatus());
    }

    public void destroy() {
        bulkhead.destroy();
        circuitBreaker.destroy();
        if (autoRecovery != null) {
            autoRecovery.destroy();
        }
        log.info("Protected dependency {} destroyed", name);
    }

    /**
     * Builds the three components from their configs. The bulkhead and breaker get default configs named after
     * the dependency unless told otherwise; there is no auto-recovery unless a config for it is given.
     */
    public static class Builder {
        private final String name;
        private BulkheadConfig bulkheadConfig;
        private CircuitBreakerConfig circuitBreakerConfig;
        private AutoRecoveryConfig autoRecoveryConfig;

        public Builder(String name) {
            this.name = name;
        }
        public Builder setBulkheadConfig(BulkheadConfig value) {
            bulkheadConfig = value;
            return this;
        }
        public Builder setCircuitBreakerConfig(CircuitBreakerConfig value) {
            circuitBreakerConfig = value;
            return this;
        }
        public Builder setAutoRecoveryConfig(AutoRecoveryConfig value) {
            autoRecoveryConfig = value;
            return this;
        }
        public ProtectedDependency build() {
            BulkheadConfig bc = bulkheadConfig != null ? bulkheadConfig : BulkheadConfig.builder(name).build();
            CircuitBreakerConfig cc = circuitBreakerConfig != null ? circuitBreakerConfig
                    : CircuitBreakerConfig.builder(name).build();
            return new ProtectedDependency(name, new Bulkhead(bc), new CircuitBreaker(cc),
                    autoRecoveryConfig == null ? null : new AutoRecovery(autoRecoveryConfig));
        }
    }
}
