package co.codecraft.jresilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Helpers for starting {@link AsyncOperation}s and racing them against timers.
 */
public final class Operations {

    private static final Logger log = LoggerFactory.getLogger(Operations.class);

    private Operations() {
    }

    /**
     * Start an operation and expose it as a {@link CompletableFuture}. A synchronous throw or a null stage becomes
     * an exceptionally completed future, so callers only ever have one failure path to handle.
     */
    public static <T> CompletableFuture<T> invoke(AsyncOperation<T> operation) {
        final CompletionStage<T> stage;
        try {
            stage = operation.call();
        } catch (Throwable e) {
            return failed(e);
        }
        if (stage == null) {
            return failed(new NullPointerException("Operation returned a null CompletionStage."));
        }
        final CompletableFuture<T> result = new CompletableFuture<T>();
        stage.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(value);
                }
            }
        });
        return result;
    }

    public static <T> CompletableFuture<T> failed(Throwable e) {
        CompletableFuture<T> f = new CompletableFuture<T>();
        f.completeExceptionally(e);
        return f;
    }

    /**
     * Strip the wrappers that futures put around the error an operation actually raised.
     */
    public static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * <p>Race <code>source</code> against a timer. Whichever finishes first settles the returned future; the loser
     * is ignored. The source is never cancelled when the timer wins (abandon, don't kill).</p>
     *
     * <p>When the timer wins, the returned future is completed on <code>executor</code>, so the caller's dependent
     * stages never run on the shared timer thread.</p>
     *
     * @param timeoutMillis  How long to wait. Values &lt;= 0 disable the timer.
     * @param onTimeout  Produces the error to complete with if the timer fires first. It may still lose the race,
     *                   so it must be quick and free of side effects.
     */
    public static <T> CompletableFuture<T> withTimeout(CompletableFuture<T> source, long timeoutMillis,
                                                       final TimeoutHandler onTimeout, final Executor executor) {
        if (timeoutMillis <= 0) {
            return source;
        }
        final CompletableFuture<T> result = new CompletableFuture<T>();
        final ScheduledFuture<?> timer = Timers.scheduledExecutorService.schedule(new Runnable() {
            @Override
            public void run() {
                if (result.isDone()) {
                    return;
                }
                handOff(executor, new Runnable() {
                    @Override
                    public void run() {
                        result.completeExceptionally(onTimeout.onTimeout());
                    }
                });
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
        source.whenComplete(new BiConsumer<T, Throwable>() {
            @Override
            public void accept(T value, Throwable error) {
                timer.cancel(false);
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(value);
                }
            }
        });
        return result;
    }

    /**
     * Run <code>task</code> on <code>executor</code>, or on the calling thread if the executor refuses it.
     */
    public static void handOff(Executor executor, Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected a task; running it on {} instead", Thread.currentThread().getName(), e);
            task.run();
        }
    }

    /**
     * Builds the error reported when a timer wins a race in {@link #withTimeout}.
     */
    public interface TimeoutHandler {
        Throwable onTimeout();
    }
}
