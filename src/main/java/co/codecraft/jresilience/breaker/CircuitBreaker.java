package co.codecraft.jresilience.breaker;

import co.codecraft.jresilience.AsyncOperation;
import co.codecraft.jresilience.BoundedHistory;
import co.codecraft.jresilience.ListenerList;
import co.codecraft.jresilience.MovingAverage;
import co.codecraft.jresilience.Operations;
import co.codecraft.jresilience.ResilienceListener;
import co.codecraft.jresilience.StateChange;
import co.codecraft.jresilience.Timers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

import static co.codecraft.jresilience.breaker.Circuit.*;

/**
 * <p>Encapsulates the circuit breaker design pattern described by Michael Nygard in <em>Release It!</em>, for
 * asynchronous calls to one remote dependency.</p>
 *
 * <p>When a dependency is battling an outage, the last thing you want is to pile on: every caller waiting out a
 * timeout, threads tied up, retries flooding the logs. A circuit breaker notices consecutive failures and, once
 * {@link CircuitBreakerConfig#failureThreshold} of them have happened in a row, stops calling the dependency
 * altogether for {@link CircuitBreakerConfig#resetTimeoutMillis}. During that time every call fails fast with a
 * {@link CircuitOpenException}, without touching the network. When the timeout has elapsed, the next call is let
 * through as a probe: success closes the circuit, failure opens it for another round.</p>
 *
 * <h3>Typical usage</h3>
 *
 * <pre>
 *    CircuitBreaker payments = new CircuitBreaker(CircuitBreakerConfig.builder("payment-service")
 *            .setFailureThreshold(3)
 *            .setResetTimeoutMillis(30000)
 *            .build());
 *    CompletableFuture&lt;Receipt&gt; receipt = payments.execute(new AsyncOperation&lt;Receipt&gt;() {
 *        public CompletionStage&lt;Receipt&gt; call() {
 *            return client.charge(order);
 *        }
 *    });
 * </pre>
 *
 * <p>Every call is also raced against {@link CircuitBreakerConfig#callTimeoutMillis}. A call that loses the race
 * completes with a {@link CallTimeoutException} and counts as a failure; the underlying operation is abandoned,
 * not stopped.</p>
 *
 * <h3>Concurrency</h3>
 *
 * <p>Breakers are called far more often than they change state, so the state lives in a single atomic
 * (see {@link Circuit}) and transitions are compare-and-set. Counters are atomics as well; the metrics that
 * need several fields updated together use a small monitor that is never held while a call is in flight.</p>
 *
 * <p>While half-open, the breaker admits every caller by default, so several probes can be in flight at once.
 * Set {@link CircuitBreakerConfig#singleProbe} to admit exactly one and fail the others fast.</p>
 *
 * <p>A failed probe always reopens the circuit, even if a success recorded in the meantime lowered the
 * consecutive failure count below the threshold.</p>
 *
 * <h3>Listeners</h3>
 *
 * <p>Listeners are notified before the caller's future completes, so a caller that sees a result also sees every
 * event its call caused. A slow listener therefore delays the result of the call that triggered it, and nothing
 * else: timeouts and periodic metrics are delivered on {@link Timers#workers}, never on the shared timer thread.</p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public final CircuitBreakerConfig config;

    private final Circuit circuit;
    private final ListenerList<CircuitBreakerEvent> listeners;

    private final AtomicLong consecutiveFailures = new AtomicLong(0);
    private final AtomicLong consecutiveSuccesses = new AtomicLong(0);
    private final AtomicLong nextAttemptAt = new AtomicLong(0);
    private final AtomicBoolean probeInFlight = new AtomicBoolean(false);

    private final Object metricsLock = new Object();
    private long totalRequests;
    private long totalFailures;
    private long totalSuccesses;
    private long totalTimeouts;
    private long totalOpens;
    private long totalRejected;
    private long lastFailureTime;
    private long lastSuccessTime;
    private final MovingAverage responseTime = new MovingAverage();
    private final BoundedHistory<StateChange<CircuitBreakerState>> stateHistory =
            new BoundedHistory<StateChange<CircuitBreakerState>>();

    private final ScheduledFuture<?> monitor;

    /**
     * Create a closed breaker and start publishing periodic metrics.
     *
     * @param config  May not be null.
     */
    public CircuitBreaker(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null; circuit breaker would not know when to open.");
        }
        this.config = config;
        this.listeners = new ListenerList<CircuitBreakerEvent>(config.name);
        this.circuit = new Circuit(new Circuit.Listener() {
            @Override
            public void onCircuitTransition(Circuit c, int oldState, int newState) {
                onTransition(oldState, newState);
            }
        });
        this.monitor = Timers.scheduledExecutorService.scheduleAtFixedRate(new Runnable() {
            @Override
            public void run() {
                Operations.handOff(Timers.workers, new Runnable() {
                    @Override
                    public void run() {
                        publishMetrics();
                    }
                });
            }
        }, config.monitoringPeriodMillis, config.monitoringPeriodMillis, TimeUnit.MILLISECONDS);
        log.info("Circuit breaker {} initialized (failureThreshold={}, resetTimeout={}ms, timeout={}ms)",
                config.name, config.failureThreshold, config.resetTimeoutMillis, config.callTimeoutMillis);
    }

    public String getName() {
        return config.name;
    }

    public CircuitBreakerState getState() {
        return toEnum(circuit.getState());
    }

    /**
     * <p>Run <code>operation</code> under the protection of this breaker.</p>
     *
     * <p>If the circuit is open and the reset timeout has not elapsed, the returned future is already completed
     * with a {@link CircuitOpenException} and the operation is never invoked. Otherwise the operation is invoked
     * (as a half-open probe, if the timeout just elapsed) and raced against the call timeout.</p>
     *
     * @return a future that completes with the operation's result, with the operation's own error, with a
     * {@link CallTimeoutException}, or with a {@link CircuitOpenException}.
     */
    public <T> CompletableFuture<T> execute(AsyncOperation<T> operation) {
        final long start = System.currentTimeMillis();
        synchronized (metricsLock) {
            ++totalRequests;
        }
        boolean isProbe = false;
        while (true) {
            int snapshot = circuit.getStateSnapshot();
            int state = snapshot & STATE_MASK;
            if (state == OPEN) {
                long next = nextAttemptAt.get();
                if (System.currentTimeMillis() < next) {
                    return reject(next);
                }
                Outcome outcome = circuit.transition(snapshot, HALF_OPEN);
                if (outcome == Outcome.STALE) {
                    continue;
                }
                if (outcome == Outcome.CHANGED) {
                    log.info("Circuit breaker {} entering HALF_OPEN state for recovery test", config.name);
                }
                state = HALF_OPEN;
            }
            if (state == HALF_OPEN && config.singleProbe) {
                if (!probeInFlight.compareAndSet(false, true)) {
                    return reject(0);
                }
                isProbe = true;
            }
            break;
        }

        final boolean probe = isProbe;
        CompletableFuture<T> call = Operations.withTimeout(Operations.invoke(operation), config.callTimeoutMillis,
                new Operations.TimeoutHandler() {
                    @Override
                    public Throwable onTimeout() {
                        return new CallTimeoutException(config.name, config.callTimeoutMillis);
                    }
                }, Timers.workers);
        final CompletableFuture<T> result = new CompletableFuture<T>();
        call.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                long elapsed = System.currentTimeMillis() - start;
                if (error == null) {
                    onSuccess(elapsed);
                    if (probe) {
                        probeInFlight.set(false);
                    }
                    result.complete(value);
                } else {
                    Throwable e = Operations.unwrap(error);
                    onFailure(e, elapsed);
                    if (probe) {
                        probeInFlight.set(false);
                    }
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    private <T> CompletableFuture<T> reject(long next) {
        synchronized (metricsLock) {
            ++totalRejected;
        }
        log.debug("Circuit breaker {} rejected a call (next attempt at {})", config.name, next);
        return Operations.failed(new CircuitOpenException(config.name, next));
    }

    private void onSuccess(long elapsed) {
        consecutiveFailures.set(0);
        consecutiveSuccesses.incrementAndGet();
        synchronized (metricsLock) {
            ++totalSuccesses;
            lastSuccessTime = System.currentTimeMillis();
            responseTime.add(elapsed);
        }
        while (true) {
            int snapshot = circuit.getStateSnapshot();
            if ((snapshot & STATE_MASK) != HALF_OPEN) {
                break;
            }
            Outcome outcome = circuit.transition(snapshot, CLOSED);
            if (outcome == Outcome.CHANGED) {
                log.info("Circuit breaker {} recovered - closing circuit", config.name);
            }
            if (outcome != Outcome.STALE) {
                break;
            }
        }
        listeners.fire(CircuitBreakerEvent.success(config.name, getState(), elapsed));
    }

    private void onFailure(Throwable e, long elapsed) {
        long failures = consecutiveFailures.incrementAndGet();
        consecutiveSuccesses.set(0);
        synchronized (metricsLock) {
            ++totalFailures;
            if (e instanceof CallTimeoutException) {
                ++totalTimeouts;
            }
            lastFailureTime = System.currentTimeMillis();
            responseTime.add(elapsed);
        }
        log.warn("Circuit breaker {} recorded failure: {} (failureCount={}, threshold={})",
                config.name, e.toString(), failures, config.failureThreshold);
        while (true) {
            int snapshot = circuit.getStateSnapshot();
            int state = snapshot & STATE_MASK;
            if (state == OPEN) {
                break;
            }
            if (state == HALF_OPEN || failures >= config.failureThreshold) {
                // Publish the deadline before the state, so nobody sees OPEN with a stale deadline.
                nextAttemptAt.set(System.currentTimeMillis() + config.resetTimeoutMillis);
                if (circuit.transition(snapshot, OPEN) == Outcome.STALE) {
                    continue;
                }
            }
            break;
        }
        listeners.fire(CircuitBreakerEvent.failure(config.name, getState(), e, elapsed, failures));
    }

    private void onTransition(int oldState, int newState) {
        consecutiveSuccesses.set(0);
        long failures = consecutiveFailures.get();
        CircuitBreakerState from = toEnum(oldState);
        CircuitBreakerState to = toEnum(newState);
        synchronized (metricsLock) {
            stateHistory.add(new StateChange<CircuitBreakerState>(to, System.currentTimeMillis(), failures, 0));
            if (newState == OPEN) {
                ++totalOpens;
            }
        }
        log.info("Circuit breaker {} state changed: {} -> {}", config.name, from, to);
        listeners.fire(CircuitBreakerEvent.stateChanged(config.name, from, to, failures));
        if (newState == OPEN) {
            long next = nextAttemptAt.get();
            log.error("Circuit breaker {} OPENED - failing fast for {}ms (failureCount={})",
                    config.name, config.resetTimeoutMillis, failures);
            listeners.fire(CircuitBreakerEvent.opened(config.name, failures, next));
        }
    }

    /**
     * Force the circuit closed and zero its consecutive counters, regardless of calls in flight. Their outcomes
     * are still recorded when they finish.
     */
    public void reset() {
        consecutiveFailures.set(0);
        consecutiveSuccesses.set(0);
        probeInFlight.set(false);
        circuit.unsafeTransition(CLOSED);
        log.info("Circuit breaker {} manually reset", config.name);
        listeners.fire(CircuitBreakerEvent.reset(config.name));
    }

    public CircuitBreakerStatus getStatus() {
        CircuitBreakerMetrics metrics;
        synchronized (metricsLock) {
            metrics = new CircuitBreakerMetrics(totalRequests, totalFailures, totalSuccesses, totalTimeouts,
                    totalOpens, totalRejected, responseTime.get(), lastFailureTime, lastSuccessTime,
                    stateHistory.toList());
        }
        return new CircuitBreakerStatus(config.name, getState(), consecutiveFailures.get(),
                consecutiveSuccesses.get(), nextAttemptAt.get(), metrics, config);
    }

    public void addListener(ResilienceListener<CircuitBreakerEvent> listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ResilienceListener<CircuitBreakerEvent> listener) {
        return listeners.remove(listener);
    }

    private void publishMetrics() {
        try {
            listeners.fire(CircuitBreakerEvent.metrics(getStatus()));
        } catch (RuntimeException e) {
            // Let the next tick run; an escaping exception would cancel the schedule.
            log.error("Circuit breaker {} failed to publish metrics", config.name, e);
        }
    }

    /**
     * Stop the metrics timer and drop all listeners. Calls in flight are left alone.
     */
    public void destroy() {
        monitor.cancel(false);
        listeners.clear();
        log.info("Circuit breaker {} destroyed", config.name);
    }
}
