package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.AsyncOperation;
import co.codecraft.jresilience.BoundedHistory;
import co.codecraft.jresilience.ListenerList;
import co.codecraft.jresilience.MovingAverage;
import co.codecraft.jresilience.Operations;
import co.codecraft.jresilience.ResilienceException;
import co.codecraft.jresilience.ResilienceListener;
import co.codecraft.jresilience.StateChange;
import co.codecraft.jresilience.Timers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * <p>Retries failing calls with exponential backoff, tracks whether the dependency behind them is healthy, and
 * runs remediation when it is not.</p>
 *
 * <p>Each {@link #executeWithRecovery} call makes up to {@link AutoRecoveryConfig#maxRetries} + 1 attempts. The
 * delay before retry <em>n</em> is <code>min(initialDelay * multiplier^(n-1), maxDelay)</code> plus up to 10%
 * jitter. If every attempt fails, the caller gets the last error and, without waiting for it, a recovery pass
 * starts.</p>
 *
 * <p>A recovery pass walks the registered {@link RecoveryStrategy strategies} in registration order and stops
 * at the first one that succeeds. Only one pass runs at a time; asking for another while one is running does
 * nothing.</p>
 *
 * <p>If a {@link AutoRecoveryConfig#healthCheck} is configured it is probed every
 * {@link AutoRecoveryConfig#healthCheckIntervalMillis}. Probe outcomes count exactly like call outcomes, so calls
 * and probes drive a single {@link RecoveryState} machine. A tick is skipped while the previous probe is still
 * running.</p>
 *
 * <p>State lives behind one private monitor, held only while counters and state change. Operations, probes,
 * strategies and listeners never run under it.</p>
 */
public class AutoRecovery {

    private static final Logger log = LoggerFactory.getLogger(AutoRecovery.class);

    private static final double MAX_JITTER = 0.1;

    public final AutoRecoveryConfig config;

    private final ListenerList<RecoveryEvent> listeners;

    private final Object lock = new Object();
    private RecoveryState state = RecoveryState.HEALTHY;
    private long failureCount;
    private long successCount;
    private boolean recovering;
    private long passGeneration;
    private final LinkedHashMap<String, RecoveryStrategy> strategies = new LinkedHashMap<String, RecoveryStrategy>();

    private long totalFailures;
    private long totalRecoveries;
    private long totalRetries;
    private final MovingAverage recoveryTime = new MovingAverage();
    private long longestOutage;
    private long currentOutageStart;
    private long healthCheckSuccesses;
    private long healthCheckFailures;
    private HealthCheckResult lastHealthCheck;
    private final BoundedHistory<StateChange<RecoveryState>> stateHistory =
            new BoundedHistory<StateChange<RecoveryState>>();

    private final AtomicBoolean healthCheckInFlight = new AtomicBoolean(false);
    private final ScheduledFuture<?> healthMonitor;

    /**
     * Create a healthy instance with the {@link RecoveryStrategies default strategies}, and start the health
     * monitor if a health check is configured.
     */
    public AutoRecovery(AutoRecoveryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null.");
        }
        this.config = config;
        this.listeners = new ListenerList<RecoveryEvent>(config.name);
        for (RecoveryStrategy strategy : RecoveryStrategies.defaults()) {
            strategies.put(strategy.getName(), strategy);
        }
        if (config.healthCheck != null) {
            healthMonitor = Timers.scheduledExecutorService.scheduleAtFixedRate(new Runnable() {
                @Override
                public void run() {
                    healthTick();
                }
            }, config.healthCheckIntervalMillis, config.healthCheckIntervalMillis, TimeUnit.MILLISECONDS);
        } else {
            healthMonitor = null;
        }
        log.info("Auto-recovery {} initialized (maxRetries={}, failureThreshold={}, healthCheck={})",
                config.name, config.maxRetries, config.failureThreshold, config.healthCheck != null);
    }

    public String getName() {
        return config.name;
    }

    public RecoveryState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Run <code>operation</code>, retrying with backoff when it fails.
     *
     * @return a future that completes with the first successful result, or with the error of the last attempt.
     */
    public <T> CompletableFuture<T> executeWithRecovery(AsyncOperation<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation cannot be null.");
        }
        CompletableFuture<T> result = new CompletableFuture<T>();
        attempt(operation, 1, result);
        return result;
    }

    private <T> void attempt(final AsyncOperation<T> operation, final int attempt, final CompletableFuture<T> result) {
        Operations.invoke(operation).whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                if (error == null) {
                    if (attempt > 1) {
                        recordRecovery(attempt);
                    }
                    onSuccess();
                    result.complete(value);
                    return;
                }
                Throwable e = Operations.unwrap(error);
                if (attempt <= config.maxRetries) {
                    long delay = calculateDelay(attempt);
                    synchronized (lock) {
                        ++totalRetries;
                    }
                    log.warn("Auto-recovery {} attempt {} failed, retrying in {}ms: {}",
                            config.name, attempt, delay, e.toString());
                    scheduleRetry(operation, attempt + 1, result, delay, e);
                    return;
                }
                RetryExhaustedException exhausted = new RetryExhaustedException(config.name, attempt, e);
                log.error("Auto-recovery {} failed after {} attempts: {}", config.name, attempt, e.toString());
                try {
                    handleFailure(e);
                    listeners.fire(RecoveryEvent.recoveryFailure(config.name, getState(), exhausted));
                    attemptRecovery(exhausted);
                } finally {
                    result.completeExceptionally(e);
                }
            }
        });
    }

    private <T> void scheduleRetry(final AsyncOperation<T> operation, final int attempt,
                                   final CompletableFuture<T> result, long delay, final Throwable lastError) {
        Timers.scheduledExecutorService.schedule(new Runnable() {
            @Override
            public void run() {
                try {
                    config.executor.execute(new Runnable() {
                        @Override
                        public void run() {
                            attempt(operation, attempt, result);
                        }
                    });
                } catch (RuntimeException e) {
                    log.error("Auto-recovery {} could not schedule attempt {}", config.name, attempt, e);
                    result.completeExceptionally(lastError);
                }
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    /**
     * Backoff before the retry that follows failed attempt number <code>attempt</code> (1-based).
     */
    long calculateDelay(int attempt) {
        double base = Math.min(config.initialDelayMillis * Math.pow(config.backoffMultiplier, attempt - 1),
                config.maxDelayMillis);
        double jitter = base * MAX_JITTER * ThreadLocalRandom.current().nextDouble();
        return (long) Math.ceil(base + jitter);
    }

    private void recordRecovery(int attempts) {
        long elapsed;
        RecoveryState current;
        synchronized (lock) {
            long now = System.currentTimeMillis();
            elapsed = currentOutageStart == 0 ? 0 : now - currentOutageStart;
            ++totalRecoveries;
            recoveryTime.add(elapsed);
            endOutage(now);
            current = state;
        }
        log.info("Auto-recovery {} succeeded after {} attempts", config.name, attempts);
        listeners.fire(RecoveryEvent.recoverySuccess(config.name, current, attempts, elapsed));
    }

    private void onSuccess() {
        List<RecoveryEvent> events = new ArrayList<RecoveryEvent>();
        synchronized (lock) {
            ++successCount;
            failureCount = 0;
            if (state != RecoveryState.HEALTHY && successCount >= config.recoveryThreshold) {
                setState(RecoveryState.HEALTHY, events);
                endOutage(System.currentTimeMillis());
            }
            events.add(RecoveryEvent.success(config.name, state, successCount));
        }
        fireAll(events);
    }

    private void handleFailure(Throwable error) {
        List<RecoveryEvent> events = new ArrayList<RecoveryEvent>();
        long failures;
        synchronized (lock) {
            failures = ++failureCount;
            successCount = 0;
            ++totalFailures;
            if (failures >= config.failureThreshold) {
                setState(RecoveryState.FAILED, events);
                if (currentOutageStart == 0) {
                    currentOutageStart = System.currentTimeMillis();
                }
            } else if (state == RecoveryState.HEALTHY) {
                setState(RecoveryState.DEGRADED, events);
            }
            events.add(RecoveryEvent.failure(config.name, state, error, failures));
        }
        log.warn("Auto-recovery {} recorded failure: {} (failureCount={}, threshold={})",
                config.name, error.toString(), failures, config.failureThreshold);
        fireAll(events);
    }

    /**
     * Start a recovery pass unless one is running.
     *
     * @return a future that completes with true if a strategy succeeded, and with false if all of them failed or
     * another pass was already running.
     */
    CompletableFuture<Boolean> attemptRecovery(final Throwable error) {
        final long generation;
        final List<RecoveryStrategy> plan;
        List<RecoveryEvent> events = new ArrayList<RecoveryEvent>();
        synchronized (lock) {
            if (recovering) {
                log.debug("Auto-recovery {} already recovering; ignoring {}", config.name, error.toString());
                return CompletableFuture.completedFuture(false);
            }
            recovering = true;
            generation = ++passGeneration;
            plan = new ArrayList<RecoveryStrategy>(strategies.values());
            setState(RecoveryState.RECOVERING, events);
        }
        fireAll(events);
        log.info("Auto-recovery {} starting recovery pass ({} strategies): {}",
                config.name, plan.size(), error.toString());
        final CompletableFuture<Boolean> done = new CompletableFuture<Boolean>();
        try {
            config.executor.execute(new Runnable() {
                @Override
                public void run() {
                    runStrategy(plan, 0, error, generation, done);
                }
            });
        } catch (RuntimeException e) {
            log.error("Auto-recovery {} could not start recovery pass", config.name, e);
            finishPass(generation, done, false, e);
        }
        return done;
    }

    private void runStrategy(final List<RecoveryStrategy> plan, final int index, final Throwable error,
                             final long generation, final CompletableFuture<Boolean> done) {
        try {
            if (index >= plan.size()) {
                log.error("Auto-recovery {}: all recovery strategies failed", config.name);
                finishPass(generation, done, false, null);
                return;
            }
            final RecoveryStrategy strategy = plan.get(index);
            log.info("Auto-recovery {} attempting recovery strategy: {}", config.name, strategy.getName());
            Operations.invoke(new AsyncOperation<Object>() {
                @Override
                public CompletionStage<Object> call() throws Exception {
                    return strategy.execute(error, AutoRecovery.this).thenApply(new Function<Object, Object>() {
                        @Override
                        public Object apply(Object value) {
                            return value;
                        }
                    });
                }
            }).whenComplete(new BiConsumer<Object, Throwable>() {
                @Override
                public void accept(Object ignored, Throwable failure) {
                    if (failure == null) {
                        log.info("Auto-recovery {} strategy {} succeeded", config.name, strategy.getName());
                        finishPass(generation, done, true, null);
                        return;
                    }
                    Throwable e = Operations.unwrap(failure);
                    log.warn("Auto-recovery {} strategy {} failed: {}", config.name, strategy.getName(), e.toString());
                    listeners.fire(RecoveryEvent.strategyFailed(config.name, strategy.getName(), e));
                    runStrategy(plan, index + 1, error, generation, done);
                }
            });
        } catch (RuntimeException e) {
            log.error("Auto-recovery {} recovery pass aborted", config.name, e);
            finishPass(generation, done, false, e);
        }
    }

    private void finishPass(long generation, CompletableFuture<Boolean> done, boolean recovered, Throwable failure) {
        try {
            synchronized (lock) {
                // A reset may have let a newer pass start; that one owns the flag now.
                if (passGeneration == generation) {
                    recovering = false;
                }
            }
        } finally {
            if (failure != null) {
                done.completeExceptionally(failure);
            } else {
                done.complete(recovered);
            }
        }
    }

    /**
     * Probe the health check once, and count the outcome like a call outcome. Completes with what the probe
     * returned, or with a {@link HealthCheckException}. Completes with null at once when no health check is
     * configured.
     */
    CompletableFuture<Object> performHealthCheck() {
        AsyncOperation<?> check = config.healthCheck;
        if (check == null) {
            return CompletableFuture.completedFuture(null);
        }
        final CompletableFuture<Object> outcome = new CompletableFuture<Object>();
        Operations.invoke(check).whenComplete(new BiConsumer<Object, Throwable>() {
            @Override
            public void accept(Object value, Throwable error) {
                try {
                    long now = System.currentTimeMillis();
                    if (error == null && !Boolean.FALSE.equals(value)) {
                        recordHealthCheck(new HealthCheckResult(now, true, value, null));
                        onSuccess();
                        outcome.complete(value);
                    } else {
                        HealthCheckException e = error == null ? new HealthCheckException(config.name)
                                : new HealthCheckException(config.name, Operations.unwrap(error));
                        recordHealthCheck(new HealthCheckResult(now, false, null, e));
                        handleFailure(e);
                        attemptRecovery(e);
                        outcome.completeExceptionally(e);
                    }
                } catch (RuntimeException e) {
                    log.error("Auto-recovery {} could not record health check outcome", config.name, e);
                    outcome.completeExceptionally(e);
                }
            }
        });
        return outcome;
    }

    private void recordHealthCheck(HealthCheckResult result) {
        RecoveryState current;
        synchronized (lock) {
            lastHealthCheck = result;
            if (result.healthy) {
                ++healthCheckSuccesses;
            } else {
                ++healthCheckFailures;
            }
            current = state;
        }
        log.debug("Auto-recovery {} health check: {}", config.name, result);
        listeners.fire(RecoveryEvent.healthCheck(config.name, current, result));
    }

    private void healthTick() {
        if (!healthCheckInFlight.compareAndSet(false, true)) {
            log.debug("Auto-recovery {} skipping health check; previous probe still running", config.name);
            return;
        }
        try {
            config.executor.execute(new Runnable() {
                @Override
                public void run() {
                    try {
                        performHealthCheck().whenComplete(new BiConsumer<Object, Throwable>() {
                            @Override
                            public void accept(Object value, Throwable error) {
                                healthCheckInFlight.set(false);
                            }
                        });
                    } catch (RuntimeException e) {
                        healthCheckInFlight.set(false);
                        log.error("Auto-recovery {} health check failed to run", config.name, e);
                    }
                }
            });
        } catch (RuntimeException e) {
            // Let the next tick run; an escaping exception would cancel the schedule.
            healthCheckInFlight.set(false);
            log.error("Auto-recovery {} could not start health check", config.name, e);
        }
    }

    /**
     * A future that completes on {@link AutoRecoveryConfig#executor} after <code>millis</code>.
     */
    CompletableFuture<Void> delay(long millis) {
        final CompletableFuture<Void> f = new CompletableFuture<Void>();
        Timers.scheduledExecutorService.schedule(new Runnable() {
            @Override
            public void run() {
                Operations.handOff(config.executor, new Runnable() {
                    @Override
                    public void run() {
                        f.complete(null);
                    }
                });
            }
        }, millis, TimeUnit.MILLISECONDS);
        return f;
    }

    void degrade(Throwable reason) {
        List<RecoveryEvent> events = new ArrayList<RecoveryEvent>();
        synchronized (lock) {
            setState(RecoveryState.DEGRADED, events);
        }
        log.warn("Auto-recovery {} entering degraded mode", config.name);
        events.add(RecoveryEvent.degraded(config.name, reason));
        fireAll(events);
    }

    /**
     * Run a recovery pass now. Completes when the pass finishes, or at once if a pass is already running.
     *
     * @return a future that completes with true if some strategy succeeded.
     */
    public CompletableFuture<Boolean> triggerRecovery() {
        log.info("Auto-recovery {} manual recovery triggered", config.name);
        return attemptRecovery(new ResilienceException(config.name, "Manual recovery triggered"))
                .whenComplete(new BiConsumer<Boolean, Throwable>() {
                    @Override
                    public void accept(Boolean recovered, Throwable error) {
                        listeners.fire(RecoveryEvent.manualRecovery(config.name, getState()));
                    }
                });
    }

    /**
     * Add a strategy at the end of the pass, or replace the strategy of the same name where it stands.
     */
    public void registerStrategy(RecoveryStrategy strategy) {
        if (strategy == null || strategy.getName() == null) {
            throw new IllegalArgumentException("Strategy and its name cannot be null.");
        }
        synchronized (lock) {
            strategies.put(strategy.getName(), strategy);
        }
        log.info("Auto-recovery {} registered recovery strategy: {}", config.name, strategy.getName());
    }

    public boolean removeStrategy(String name) {
        synchronized (lock) {
            return strategies.remove(name) != null;
        }
    }

    public List<String> getStrategyNames() {
        synchronized (lock) {
            return new ArrayList<String>(strategies.keySet());
        }
    }

    /**
     * Force {@link RecoveryState#HEALTHY}, zero the consecutive counters, forget the current outage and release the
     * recovery guard. A pass already running is not stopped. The health monitor keeps running.
     */
    public void reset() {
        List<RecoveryEvent> events = new ArrayList<RecoveryEvent>();
        synchronized (lock) {
            failureCount = 0;
            successCount = 0;
            recovering = false;
            currentOutageStart = 0;
            setState(RecoveryState.HEALTHY, events);
        }
        log.info("Auto-recovery {} manually reset", config.name);
        events.add(RecoveryEvent.reset(config.name));
        fireAll(events);
    }

    public AutoRecoveryStatus getStatus() {
        synchronized (lock) {
            RecoveryMetrics metrics = new RecoveryMetrics(totalFailures, totalRecoveries, totalRetries,
                    recoveryTime.get(), longestOutage, currentOutageStart, healthCheckSuccesses, healthCheckFailures,
                    stateHistory.toList());
            return new AutoRecoveryStatus(config.name, state, recovering, failureCount, successCount,
                    lastHealthCheck, metrics, config, new ArrayList<String>(strategies.keySet()));
        }
    }

    public RecoveryStats getStats() {
        synchronized (lock) {
            long probes = healthCheckSuccesses + healthCheckFailures;
            double rate = probes == 0 ? 0.0 : (double) healthCheckSuccesses / probes;
            long currentOutage = currentOutageStart == 0 ? 0 : System.currentTimeMillis() - currentOutageStart;
            return new RecoveryStats(totalFailures, totalRecoveries, totalRetries, rate, recoveryTime.get(),
                    longestOutage, currentOutage);
        }
    }

    public void addListener(ResilienceListener<RecoveryEvent> listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ResilienceListener<RecoveryEvent> listener) {
        return listeners.remove(listener);
    }

    /**
     * Stop the health monitor and drop all listeners. Calls, retries and a pass already running are left alone.
     */
    public void destroy() {
        if (healthMonitor != null) {
            healthMonitor.cancel(false);
        }
        listeners.clear();
        log.info("Auto-recovery {} destroyed", config.name);
    }

    // Callers hold lock.
    private void setState(RecoveryState newState, List<RecoveryEvent> events) {
        RecoveryState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        stateHistory.add(new StateChange<RecoveryState>(newState, System.currentTimeMillis(), failureCount,
                successCount));
        log.info("Auto-recovery {} state changed: {} -> {}", config.name, oldState, newState);
        events.add(RecoveryEvent.stateChanged(config.name, oldState, newState, failureCount, successCount));
    }

    // Callers hold lock.
    private void endOutage(long now) {
        if (currentOutageStart != 0) {
            longestOutage = Math.max(longestOutage, now - currentOutageStart);
            currentOutageStart = 0;
        }
    }

    private void fireAll(List<RecoveryEvent> events) {
        for (RecoveryEvent event : events) {
            listeners.fire(event);
        }
    }
}
