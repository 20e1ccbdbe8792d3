package io.github.byzatic.genjobs.executor;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.genjobs.ObjectsUtils;
import io.github.byzatic.genjobs.context.Task;
import io.github.byzatic.genjobs.context.TaskFunction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ThreadPoolTaskExecutor — runs every task on a local thread pool:
 * - each task becomes a {@link CompletableFuture} completed by a pool thread;
 * - a failing work function fails only its own future;
 * - cancelling a future is best-effort: a task still queued is skipped, a task already running
 *   is not interrupted and its late output is dropped by the future;
 * - closing fails every future whose task has not completed.
 * - Configurable ThreadPoolExecutor via Builder.
 */
@ThreadSafe
public final class ThreadPoolTaskExecutor implements TaskExecutor, AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ThreadPoolTaskExecutor.class);

    private final ThreadPoolExecutor executor;
    private final long shutdownGraceMillis;
    private final Awaiter awaiter = new CompletableFutureAwaiter();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final Object lifecycle = new Object();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    private ThreadPoolTaskExecutor(ThreadPoolExecutor executor, long shutdownGraceMillis) {
        this.executor = executor;
        this.shutdownGraceMillis = shutdownGraceMillis;
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
        private String threadNamePrefix = "genjob-task-";
        private long shutdownGraceMillis = 10_000; // 10s

        /**
         * Provide your own custom thread pool. Overrides {@link #threads(int)}.
         */
        public Builder executor(@NotNull ThreadPoolExecutor executor) {
            this.executor = ObjectsUtils.requireNonNull(executor, new IllegalArgumentException("executor should be NotNull"));
            return this;
        }

        public Builder threads(int threads) {
            if (threads < 1) throw new IllegalArgumentException("threads must be >= 1, got " + threads);
            this.threads = threads;
            return this;
        }

        public Builder threadNamePrefix(@NotNull String threadNamePrefix) {
            this.threadNamePrefix = ObjectsUtils.requireNonNull(threadNamePrefix, new IllegalArgumentException("threadNamePrefix should be NotNull"));
            return this;
        }

        /**
         * How long {@link #close()} waits for running tasks before interrupting them.
         */
        public Builder shutdownGraceMillis(long shutdownGraceMillis) {
            if (shutdownGraceMillis < 0) throw new IllegalArgumentException("shutdownGraceMillis must be >= 0");
            this.shutdownGraceMillis = shutdownGraceMillis;
            return this;
        }

        public ThreadPoolTaskExecutor build() {
            ThreadPoolExecutor pool = executor;
            if (pool == null) {
                String prefix = threadNamePrefix;
                pool = new ThreadPoolExecutor(
                        threads,
                        threads,
                        60, TimeUnit.SECONDS,
                        new LinkedBlockingQueue<>(),
                        r -> {
                            Thread t = new Thread(r, prefix + UUID.randomUUID());
                            t.setDaemon(true);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught exception in {}", th.getName(), ex));
                            return t;
                        },
                        new ThreadPoolExecutor.CallerRunsPolicy()
                );
                pool.allowCoreThreadTimeOut(true);
            }
            return new ThreadPoolTaskExecutor(pool, shutdownGraceMillis);
        }
    }

    @Override
    public <I, O> @NotNull List<Submission<O>> submitAll(@NotNull TaskFunction<I, O> fn, @NotNull List<Task<I>> tasks) {
        ObjectsUtils.requireNonNull(fn, new IllegalArgumentException("fn should be NotNull"));
        ObjectsUtils.requireNonNull(tasks, new IllegalArgumentException("tasks should be NotNull"));

        List<Submission<O>> submissions = new ArrayList<>(tasks.size());
        // serialised with close(): a task queued here is either run or failed by close()
        synchronized (lifecycle) {
            if (closing.get()) throw new IllegalStateException("Executor is closed");
            for (Task<I> task : tasks) {
                CompletableFuture<List<O>> future = new CompletableFuture<>();
                inFlight.add(future);
                future.whenComplete((value, error) -> inFlight.remove(future));
                try {
                    executor.execute(() -> run(fn, task, future));
                } catch (RejectedExecutionException e) {
                    future.completeExceptionally(e);
                }
                submissions.add(new Submission<>(task.slots(), future));
            }
        }
        logger.trace("Submitted {} task(s)", tasks.size());
        return submissions;
    }

    @Override
    public @NotNull Awaiter getAwaiter() {
        return awaiter;
    }

    /**
     * Stops the pool: running tasks get the grace period, then the pool is interrupted. Futures
     * of tasks that never ran or ignored the interrupt are failed with a
     * {@link RejectedExecutionException}, so nobody waits on them forever.
     */
    @Override
    public void close() {
        synchronized (lifecycle) {
            if (!closing.compareAndSet(false, true)) return;
            executor.shutdown();
        }
        try {
            if (!executor.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Task pool did not stop within {} ms, interrupting", shutdownGraceMillis);
                List<Runnable> dropped = executor.shutdownNow();
                logger.debug("{} queued task(s) dropped", dropped.size());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            failInFlight();
        }
    }

    private void failInFlight() {
        int failed = 0;
        for (CompletableFuture<?> future : new ArrayList<>(inFlight)) {
            if (future.completeExceptionally(new RejectedExecutionException("Executor closed before the task completed"))) {
                failed++;
            }
        }
        if (failed > 0) logger.warn("{} unfinished task(s) failed on close", failed);
    }

    private static <I, O> void run(TaskFunction<I, O> fn, Task<I> task, CompletableFuture<List<O>> future) {
        // cancelled or failed by close() while queued
        if (future.isDone()) return;
        try {
            future.complete(invoke(fn, task));
        } catch (CompletionException e) {
            future.completeExceptionally(e.getCause() != null ? e.getCause() : e);
        } catch (Throwable t) {
            future.completeExceptionally(t);
        }
    }

    private static <I, O> List<O> invoke(TaskFunction<I, O> fn, Task<I> task) {
        List<O> outputs;
        try {
            outputs = fn.apply(task.input());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
        if (outputs == null || outputs.size() < task.slots().size()) {
            throw new IllegalStateException("Task " + task + " produced " + (outputs == null ? "no" : outputs.size())
                    + " output(s) for " + task.slots().size() + " slot(s)");
        }
        return outputs;
    }
}
