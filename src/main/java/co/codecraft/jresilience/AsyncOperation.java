package co.codecraft.jresilience;

import java.util.concurrent.CompletionStage;

/**
 * <p>A fallible, asynchronous unit of work that can be protected by a
 * {@link co.codecraft.jresilience.breaker.CircuitBreaker CircuitBreaker}, a
 * {@link co.codecraft.jresilience.bulkhead.Bulkhead Bulkhead} or an
 * {@link co.codecraft.jresilience.recovery.AutoRecovery AutoRecovery}. The protected operation is opaque:
 * the primitives only observe whether the returned stage completes normally or exceptionally.</p>
 *
 * <p>Throwing from {@link #call()}, or returning null, counts as a failure of the operation. Timeouts imposed
 * by the primitives abandon the operation rather than stopping it; releasing whatever an abandoned operation
 * holds is the caller's job.</p>
 *
 * @param <T>  The type of the result.
 */
public interface AsyncOperation<T> {
    CompletionStage<T> call() throws Exception;
}
