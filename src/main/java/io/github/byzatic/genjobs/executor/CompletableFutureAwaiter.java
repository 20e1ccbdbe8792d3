package io.github.byzatic.genjobs.executor;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.genjobs.Durations;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Awaiter} for {@link CompletableFuture}s. Each future gets a single completion hook the
 * first time it is awaited; the hook wakes every caller sleeping in {@link #await}, which then
 * recounts. Cancelled and failed futures count as complete.
 */
@ThreadSafe
public final class CompletableFutureAwaiter implements Awaiter {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition completion = lock.newCondition();

    // CompletableFuture keeps identity equals, so the weak map drops futures nobody references
    @GuardedBy("lock") private final Map<CompletableFuture<?>, Boolean> hooked = new WeakHashMap<>();

    @Override
    public @NotNull Set<Future<?>> await(@NotNull List<? extends Future<?>> futures, int count, @Nullable Duration timeout)
            throws InterruptedException {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        for (Future<?> future : futures) {
            if (!(future instanceof CompletableFuture)) {
                throw new IllegalArgumentException("Unsupported future type " + future.getClass().getName());
            }
        }

        int needed = Math.min(count, futures.size());
        if (countDone(futures) < needed) {
            for (Future<?> future : futures) hook((CompletableFuture<?>) future);

            lock.lock();
            try {
                if (timeout == null) {
                    while (countDone(futures) < needed) completion.await();
                } else {
                    long nanos = Durations.toNanosSaturated(timeout);
                    while (countDone(futures) < needed && nanos > 0) nanos = completion.awaitNanos(nanos);
                }
            } finally {
                lock.unlock();
            }
        }

        Set<Future<?>> done = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Future<?> future : futures) {
            if (future.isDone()) done.add(future);
        }
        return done;
    }

    private void hook(CompletableFuture<?> future) {
        if (future.isDone()) return;
        lock.lock();
        try {
            if (hooked.put(future, Boolean.TRUE) != null) return;
        } finally {
            lock.unlock();
        }
        // may run right here if the future completed meanwhile; the lock is not held
        future.whenComplete((value, error) -> signal());
    }

    private void signal() {
        lock.lock();
        try {
            completion.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private static int countDone(List<? extends Future<?>> futures) {
        int done = 0;
        for (Future<?> future : futures) {
            if (future.isDone()) done++;
        }
        return done;
    }
}
