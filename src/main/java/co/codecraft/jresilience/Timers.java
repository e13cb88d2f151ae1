package co.codecraft.jresilience;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>Threads shared by every breaker, bulkhead and recovery instance in the process.</p>
 *
 * <p>{@link #scheduledExecutorService} runs timers only: timeouts, periodic metrics, backoff waits and health
 * check ticks. It is important that tasks run by this service complete quickly (microseconds), to avoid delaying
 * the timers of unrelated instances. Anything that calls back into user code from a timer is handed to an
 * {@link java.util.concurrent.Executor} instead; {@link #workers} is the default one.</p>
 */
public final class Timers {

    private Timers() {
    }

    public static final ScheduledExecutorService scheduledExecutorService =
            Executors.newScheduledThreadPool(2, new DaemonThreadFactory("jresilience-timer"));

    public static final ExecutorService workers =
            Executors.newCachedThreadPool(new DaemonThreadFactory("jresilience-worker"));

    private static class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger count = new AtomicInteger(0);

        DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread th = new Thread(r, prefix + "-" + count.incrementAndGet());
            th.setDaemon(true);
            return th;
        }
    }
}
