package co.codecraft.jresilience.recovery;

import co.codecraft.jresilience.AsyncOperation;
import co.codecraft.jresilience.CapturingListener;
import co.codecraft.jresilience.Operations;
import co.codecraft.jresilience.ResilienceException;
import co.codecraft.jresilience.StateChange;
import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static co.codecraft.jresilience.TestOperations.*;
import static org.junit.Assert.*;

public class AutoRecoveryTest {

    private final List<AutoRecovery> created = new ArrayList<AutoRecovery>();

    @After
    public void tearDown() {
        for (AutoRecovery r : created) {
            r.destroy();
        }
    }

    private AutoRecovery recovery(AutoRecoveryConfig.Builder builder) {
        AutoRecovery r = new AutoRecovery(builder.build());
        created.add(r);
        return r;
    }

    /**
     * Fails the first <code>failures</code> calls, each with its own exception, then succeeds.
     */
    private static class Flaky implements AsyncOperation<String> {
        final int failures;
        final AtomicInteger calls = new AtomicInteger(0);
        final List<Exception> thrown = new ArrayList<Exception>();

        Flaky(int failures) {
            this.failures = failures;
        }

        @Override
        public synchronized CompletionStage<String> call() {
            int n = calls.incrementAndGet();
            if (n <= failures) {
                IOException e = new IOException("failure " + n);
                thrown.add(e);
                return Operations.failed(e);
            }
            return CompletableFuture.completedFuture("ok");
        }
    }

    /** A health probe whose answer the test flips. */
    private static class Health implements AsyncOperation<Boolean> {
        final AtomicBoolean healthy = new AtomicBoolean(true);
        final AtomicInteger probes = new AtomicInteger(0);

        @Override
        public CompletionStage<Boolean> call() throws Exception {
            probes.incrementAndGet();
            if (!healthy.get()) {
                throw new IOException("unreachable");
            }
            return CompletableFuture.completedFuture(true);
        }
    }

    /** A strategy that records its runs and then succeeds or fails as told. */
    private static class Recorded implements RecoveryStrategy {
        final String name;
        final boolean succeed;
        final List<Throwable> errors = new ArrayList<Throwable>();

        Recorded(String name, boolean succeed) {
            this.name = name;
            this.succeed = succeed;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public synchronized CompletionStage<?> execute(Throwable error, AutoRecovery recovery) {
            errors.add(error);
            return succeed ? CompletableFuture.completedFuture(null)
                    : Operations.failed(new IllegalStateException(name + " failed"));
        }

        synchronized int runs() {
            return errors.size();
        }
    }

    private static void onlyStrategies(AutoRecovery r, RecoveryStrategy... strategies) {
        for (String name : r.getStrategyNames()) {
            r.removeStrategy(name);
        }
        for (RecoveryStrategy s : strategies) {
            r.registerStrategy(s);
        }
    }

    @Test(expected=IllegalArgumentException.class)
    public void config_may_not_be_null() {
        new AutoRecovery(null);
    }

    @Test(expected=IllegalArgumentException.class)
    public void multiplier_below_one_rejected() {
        AutoRecoveryConfig.builder("x").setBackoffMultiplier(0.5).build();
    }

    @Test(expected=IllegalArgumentException.class)
    public void negative_retries_rejected() {
        AutoRecoveryConfig.builder("x").setMaxRetries(-1).build();
    }

    @Test(expected=IllegalArgumentException.class)
    public void max_delay_below_initial_rejected() {
        AutoRecoveryConfig.builder("x").setInitialDelayMillis(500).setMaxDelayMillis(100).build();
    }

    @Test
    public void config_defaults() {
        AutoRecoveryConfig config = AutoRecoveryConfig.builder("x").build();
        assertEquals(3, config.maxRetries);
        assertEquals(1000, config.initialDelayMillis);
        assertEquals(30000, config.maxDelayMillis);
        assertEquals(2.0, config.backoffMultiplier, 0.0);
        assertEquals(5000, config.healthCheckIntervalMillis);
        assertEquals(3, config.failureThreshold);
        assertEquals(2, config.recoveryThreshold);
        assertEquals(1000, config.recoveryDelayMillis);
        assertNull(config.healthCheck);
        assertNull(config.onRecover);
        assertNotNull(config.executor);
    }

    @Test
    public void backoff_grows_and_is_capped() {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("x").setInitialDelayMillis(100)
                .setBackoffMultiplier(10).setMaxDelayMillis(500));
        for (int i = 0; i < 50; ++i) {
            long first = r.calculateDelay(1);
            assertTrue(first >= 100 && first <= 110);
            long second = r.calculateDelay(2);
            assertTrue(second >= 500 && second <= 550);
            long third = r.calculateDelay(3);
            assertTrue(third >= 500 && third <= 550);
        }
    }

    @Test
    public void succeeds_after_two_failures() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(3).setInitialDelayMillis(100)
                .setBackoffMultiplier(2));
        CapturingListener<RecoveryEvent> listener = new CapturingListener<RecoveryEvent>();
        r.addListener(listener);
        Flaky op = new Flaky(2);
        long start = System.currentTimeMillis();
        assertEquals("ok", r.executeWithRecovery(op).get(5, TimeUnit.SECONDS));
        long elapsed = System.currentTimeMillis() - start;

        assertTrue("elapsed " + elapsed, elapsed >= 300);
        assertEquals(3, op.calls.get());
        assertEquals(RecoveryState.HEALTHY, r.getState());
        AutoRecoveryStatus status = r.getStatus();
        assertEquals(2, status.metrics.totalRetries);
        assertEquals(1, status.metrics.totalRecoveries);
        assertEquals(0, status.metrics.totalFailures);
        assertEquals(1, count(listener, RecoveryEvent.Type.RECOVERY_SUCCESS));
        for (RecoveryEvent event : listener.snapshot()) {
            if (event.type == RecoveryEvent.Type.RECOVERY_SUCCESS) {
                assertEquals(3, event.attempts);
            }
        }
    }

    @Test
    public void first_attempt_success_is_not_a_recovery() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        assertEquals("ok", r.executeWithRecovery(new Flaky(0)).get(1, TimeUnit.SECONDS));
        assertEquals(0, r.getStatus().metrics.totalRecoveries);
        assertEquals(1, r.getStatus().successCount);
    }

    @Test
    public void exhausted_retries_propagate_last_error_and_start_recovery() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(2).setInitialDelayMillis(10)
                .setRecoveryDelayMillis(5000));
        CapturingListener<RecoveryEvent> listener = new CapturingListener<RecoveryEvent>();
        r.addListener(listener);
        Flaky op = new Flaky(100);
        Throwable e = errorOf(r.executeWithRecovery(op), 5000);

        assertEquals(3, op.calls.get());
        assertSame(op.thrown.get(2), e);
        RecoveryState state = r.getState();
        assertTrue(state == RecoveryState.RECOVERING || state == RecoveryState.FAILED);
        AutoRecoveryStatus status = r.getStatus();
        assertTrue(status.recovering);
        assertEquals(1, status.failureCount);
        assertEquals(1, status.metrics.totalFailures);

        RecoveryEvent exhausted = null;
        for (RecoveryEvent event : listener.snapshot()) {
            if (event.type == RecoveryEvent.Type.RECOVERY_FAILURE) {
                exhausted = event;
            }
        }
        assertNotNull(exhausted);
        assertTrue(exhausted.error instanceof RetryExhaustedException);
        assertEquals(3, ((RetryExhaustedException) exhausted.error).getAttempts());
        assertSame(e, exhausted.error.getCause());
    }

    @Test
    public void zero_retries_means_one_attempt() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(0).setRecoveryDelayMillis(5000));
        Flaky op = new Flaky(1);
        errorOf(r.executeWithRecovery(op), 1000);
        assertEquals(1, op.calls.get());
        assertEquals(0, r.getStatus().metrics.totalRetries);
    }

    @Test
    public void consecutive_failures_reach_failed() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(0).setFailureThreshold(2)
                .setRecoveryDelayMillis(5000));
        errorOf(r.executeWithRecovery(new Flaky(1)), 1000);
        assertEquals(RecoveryState.RECOVERING, r.getState());
        errorOf(r.executeWithRecovery(new Flaky(1)), 1000);
        assertEquals(RecoveryState.FAILED, r.getState());
        assertTrue(r.getStatus().metrics.currentOutageStart > 0);

        List<RecoveryState> states = new ArrayList<RecoveryState>();
        for (StateChange<RecoveryState> change : r.getStatus().metrics.stateHistory) {
            states.add(change.state);
        }
        assertEquals(Arrays.asList(RecoveryState.DEGRADED, RecoveryState.RECOVERING, RecoveryState.FAILED), states);
    }

    @Test
    public void successes_and_failures_reset_each_other() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(0).setFailureThreshold(5)
                .setRecoveryDelayMillis(5000));
        errorOf(r.executeWithRecovery(new Flaky(1)), 1000);
        errorOf(r.executeWithRecovery(new Flaky(1)), 1000);
        assertEquals(2, r.getStatus().failureCount);
        r.executeWithRecovery(new Flaky(0)).get(1, TimeUnit.SECONDS);
        assertEquals(0, r.getStatus().failureCount);
        assertEquals(1, r.getStatus().successCount);
        assertNotEquals(RecoveryState.HEALTHY, r.getState());
        r.executeWithRecovery(new Flaky(0)).get(1, TimeUnit.SECONDS);
        assertEquals(RecoveryState.HEALTHY, r.getState());
    }

    @Test
    public void failing_health_checks_reach_failed() throws Exception {
        Health health = new Health();
        health.healthy.set(false);
        final AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(health)
                .setHealthCheckIntervalMillis(50).setFailureThreshold(3).setRecoveryDelayMillis(10000));
        assertTrue(eventually(new Condition() {
            @Override
            public boolean holds() {
                return r.getState() == RecoveryState.FAILED;
            }
        }, 3000));
        AutoRecoveryStatus status = r.getStatus();
        assertTrue(status.metrics.healthCheckFailures >= 3);
        assertNotNull(status.lastHealthCheck);
        assertFalse(status.lastHealthCheck.healthy);
        assertTrue(status.lastHealthCheck.error instanceof HealthCheckException);
        assertTrue(status.lastHealthCheck.error.getCause() instanceof IOException);
    }

    @Test
    public void healthy_probes_bring_it_back() throws Exception {
        Health health = new Health();
        health.healthy.set(false);
        final AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(health)
                .setHealthCheckIntervalMillis(30).setFailureThreshold(3).setRecoveryThreshold(2)
                .setRecoveryDelayMillis(10000));
        assertTrue(eventually(new Condition() {
            @Override
            public boolean holds() {
                return r.getState() == RecoveryState.FAILED;
            }
        }, 3000));
        health.healthy.set(true);
        assertTrue(eventually(new Condition() {
            @Override
            public boolean holds() {
                return r.getState() == RecoveryState.HEALTHY;
            }
        }, 3000));
        assertEquals(0, r.getStatus().metrics.currentOutageStart);
        assertTrue(r.getStatus().metrics.longestOutage > 0);
        RecoveryStats stats = r.getStats();
        assertEquals(0, stats.currentOutage);
        assertTrue(stats.healthCheckSuccessRate > 0.0 && stats.healthCheckSuccessRate < 1.0);
    }

    @Test
    public void false_health_result_counts_as_unhealthy() throws Exception {
        AsyncOperation<Boolean> no = new AsyncOperation<Boolean>() {
            @Override
            public CompletionStage<Boolean> call() {
                return CompletableFuture.completedFuture(Boolean.FALSE);
            }
        };
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(no)
                .setHealthCheckIntervalMillis(60000).setRecoveryDelayMillis(10000));
        Throwable e = errorOf(r.performHealthCheck(), 1000);
        assertTrue(e instanceof HealthCheckException);
        assertNull(e.getCause());
        assertEquals(1, r.getStatus().failureCount);
        assertEquals(1, r.getStatus().metrics.healthCheckFailures);
    }

    @Test
    public void slow_probe_is_not_overlapped() throws Exception {
        final AtomicInteger probes = new AtomicInteger(0);
        AsyncOperation<Object> slow = new AsyncOperation<Object>() {
            @Override
            public CompletionStage<Object> call() {
                probes.incrementAndGet();
                return new CompletableFuture<Object>();
            }
        };
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(slow)
                .setHealthCheckIntervalMillis(20));
        Thread.sleep(300);
        assertEquals(1, probes.get());
        assertNull(r.getStatus().lastHealthCheck);
    }

    @Test
    public void destroy_stops_health_monitor() throws Exception {
        Health health = new Health();
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(health)
                .setHealthCheckIntervalMillis(20));
        Thread.sleep(100);
        r.destroy();
        Thread.sleep(50);
        int probes = health.probes.get();
        Thread.sleep(150);
        assertEquals(probes, health.probes.get());
    }

    @Test
    public void default_strategies_in_order() {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        assertEquals(Arrays.asList(RecoveryStrategies.RETRY_DELAY, RecoveryStrategies.RESTART,
                RecoveryStrategies.DEGRADE), r.getStrategyNames());
    }

    @Test
    public void strategy_registry_keeps_registration_order() {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        r.registerStrategy(new Recorded("custom", true));
        r.registerStrategy(new Recorded(RecoveryStrategies.RESTART, true));
        assertEquals(Arrays.asList(RecoveryStrategies.RETRY_DELAY, RecoveryStrategies.RESTART,
                RecoveryStrategies.DEGRADE, "custom"), r.getStrategyNames());
        assertTrue(r.removeStrategy(RecoveryStrategies.DEGRADE));
        assertFalse(r.removeStrategy("missing"));
        assertEquals(Arrays.asList(RecoveryStrategies.RETRY_DELAY, RecoveryStrategies.RESTART, "custom"),
                r.getStrategyNames());
    }

    @Test
    public void first_successful_strategy_ends_the_pass() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        CapturingListener<RecoveryEvent> listener = new CapturingListener<RecoveryEvent>();
        r.addListener(listener);
        Recorded a = new Recorded("a", false);
        Recorded b = new Recorded("b", true);
        Recorded c = new Recorded("c", true);
        onlyStrategies(r, a, b, c);

        assertTrue(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertEquals(1, a.runs());
        assertEquals(1, b.runs());
        assertEquals(0, c.runs());
        assertTrue(a.errors.get(0) instanceof ResilienceException);
        assertFalse(r.getStatus().recovering);
        assertEquals(1, count(listener, RecoveryEvent.Type.STRATEGY_FAILED));
        assertEquals(1, count(listener, RecoveryEvent.Type.MANUAL_RECOVERY));
        for (RecoveryEvent event : listener.snapshot()) {
            if (event.type == RecoveryEvent.Type.STRATEGY_FAILED) {
                assertEquals("a", event.strategy);
            }
        }
    }

    @Test
    public void throwing_strategy_is_skipped() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        Recorded fallback = new Recorded("fallback", true);
        onlyStrategies(r, new RecoveryStrategy() {
            @Override
            public String getName() {
                return "explodes";
            }

            @Override
            public CompletionStage<?> execute(Throwable error, AutoRecovery recovery) {
                throw new IllegalStateException("boom");
            }
        }, fallback);
        assertTrue(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertEquals(1, fallback.runs());
    }

    @Test
    public void guard_is_released_when_every_strategy_fails() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        Recorded a = new Recorded("a", false);
        onlyStrategies(r, a, new Recorded("b", false));
        assertFalse(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertFalse(r.getStatus().recovering);
        assertFalse(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertEquals(2, a.runs());
    }

    @Test
    public void only_one_pass_at_a_time() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        final CompletableFuture<Void> gate = new CompletableFuture<Void>();
        final AtomicInteger runs = new AtomicInteger(0);
        onlyStrategies(r, new RecoveryStrategy() {
            @Override
            public String getName() {
                return "gated";
            }

            @Override
            public CompletionStage<?> execute(Throwable error, AutoRecovery recovery) {
                runs.incrementAndGet();
                return gate;
            }
        });
        CompletableFuture<Boolean> first = r.triggerRecovery();
        assertEquals(RecoveryState.RECOVERING, r.getState());
        CompletableFuture<Boolean> second = r.triggerRecovery();
        assertFalse(second.get(1, TimeUnit.SECONDS));
        assertFalse(first.isDone());
        gate.complete(null);
        assertTrue(first.get(1, TimeUnit.SECONDS));
        assertEquals(1, runs.get());
    }

    @Test
    public void restart_strategy_runs_on_recover() throws Exception {
        final AtomicReference<Throwable> seen = new AtomicReference<Throwable>();
        RecoveryAction action = new RecoveryAction() {
            @Override
            public CompletionStage<?> recover(Throwable error) {
                seen.set(error);
                return CompletableFuture.completedFuture(null);
            }
        };
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setOnRecover(action));
        Recorded after = new Recorded("after", true);
        onlyStrategies(r, RecoveryStrategies.restart(), after);
        assertTrue(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertNotNull(seen.get());
        assertEquals(0, after.runs());
    }

    @Test
    public void missing_on_recover_falls_through_to_degrade() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        CapturingListener<RecoveryEvent> listener = new CapturingListener<RecoveryEvent>();
        r.addListener(listener);
        r.removeStrategy(RecoveryStrategies.RETRY_DELAY);
        assertTrue(r.triggerRecovery().get(1, TimeUnit.SECONDS));
        assertEquals(RecoveryState.DEGRADED, r.getState());
        assertEquals(1, count(listener, RecoveryEvent.Type.DEGRADED));
        assertEquals(1, count(listener, RecoveryEvent.Type.STRATEGY_FAILED));
    }

    @Test
    public void retry_delay_waits_and_verifies_health() throws Exception {
        Health health = new Health();
        health.healthy.set(false);
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setHealthCheck(health)
                .setHealthCheckIntervalMillis(60000).setRecoveryDelayMillis(100));
        Recorded next = new Recorded("next", true);
        onlyStrategies(r, RecoveryStrategies.retryDelay(), next);

        long start = System.currentTimeMillis();
        assertTrue(r.triggerRecovery().get(2, TimeUnit.SECONDS));
        assertTrue(System.currentTimeMillis() - start >= 100);
        assertEquals(1, health.probes.get());
        assertEquals(1, next.runs());
        assertEquals(1, r.getStatus().failureCount);

        health.healthy.set(true);
        Recorded unused = new Recorded("unused", true);
        onlyStrategies(r, RecoveryStrategies.retryDelay(), unused);
        assertTrue(r.triggerRecovery().get(2, TimeUnit.SECONDS));
        assertEquals(0, unused.runs());
        assertEquals(0, r.getStatus().failureCount);
    }

    @Test
    public void reset_forces_healthy() throws Exception {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc").setMaxRetries(0).setFailureThreshold(1)
                .setRecoveryDelayMillis(10000));
        CapturingListener<RecoveryEvent> listener = new CapturingListener<RecoveryEvent>();
        r.addListener(listener);
        errorOf(r.executeWithRecovery(new Flaky(1)), 1000);
        assertTrue(r.getStatus().recovering);
        r.reset();
        AutoRecoveryStatus status = r.getStatus();
        assertEquals(RecoveryState.HEALTHY, status.state);
        assertEquals(0, status.failureCount);
        assertEquals(0, status.successCount);
        assertFalse(status.recovering);
        assertEquals(0, status.metrics.currentOutageStart);
        assertEquals(1, status.metrics.totalFailures);
        assertEquals(1, count(listener, RecoveryEvent.Type.RESET));
    }

    @Test
    public void stats_without_probes() {
        AutoRecovery r = recovery(AutoRecoveryConfig.builder("svc"));
        RecoveryStats stats = r.getStats();
        assertEquals(0.0, stats.healthCheckSuccessRate, 0.0);
        assertEquals(0, stats.totalFailures);
        assertEquals(0, stats.currentOutage);
    }

    private static int count(CapturingListener<RecoveryEvent> listener, RecoveryEvent.Type type) {
        int n = 0;
        for (RecoveryEvent event : listener.snapshot()) {
            if (event.type == type) {
                ++n;
            }
        }
        return n;
    }
}
