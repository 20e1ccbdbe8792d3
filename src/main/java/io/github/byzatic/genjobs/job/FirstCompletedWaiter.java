package io.github.byzatic.genjobs.job;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.genjobs.Durations;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot trigger shared by every job of a single {@link Jobs#firstCompleted} call.
 * Jobs append themselves while holding their own lock, so the list is written by several
 * workers concurrently.
 */
@ThreadSafe
final class FirstCompletedWaiter {
    private final CountDownLatch trigger = new CountDownLatch(1);
    private final List<Job<?, ?>> finishedJobs = new CopyOnWriteArrayList<>();

    void addResult(@NotNull Job<?, ?> job) {
        finishedJobs.add(job);
        trigger.countDown();
    }

    /**
     * @return {@code true} if triggered, {@code false} on timeout
     */
    boolean await(@Nullable Duration timeout) throws InterruptedException {
        if (timeout == null) {
            trigger.await();
            return true;
        }
        return trigger.await(Durations.toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
    }

    @NotNull List<Job<?, ?>> finishedJobs() {
        return new ArrayList<>(finishedJobs);
    }
}
