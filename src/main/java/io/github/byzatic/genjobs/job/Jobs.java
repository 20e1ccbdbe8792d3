package io.github.byzatic.genjobs.job;

import com.google.common.annotations.Beta;
import io.github.byzatic.genjobs.Durations;
import io.github.byzatic.genjobs.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Waiting on several jobs at once.
 */
public final class Jobs {

    private Jobs() {
    }

    /**
     * Same as {@code firstCompleted(jobs, null)}.
     */
    public static <J extends Job<?, ?>> @NotNull List<J> firstCompleted(@NotNull Collection<J> jobs) throws InterruptedException {
        return firstCompleted(jobs, null);
    }

    /**
     * Blocks until at least one of {@code jobs} reaches a terminal state.
     * <p>
     * If some jobs are already terminal they are returned right away. Otherwise the jobs that
     * end while the call waits are returned; several jobs ending in the same window all show
     * up, and the list is empty when the timeout elapses first.
     * <p>
     * Job locks are always taken in ascending creation order, so concurrent calls over
     * overlapping job sets cannot deadlock.
     *
     * @param timeout upper bound of the wait, {@code null} for no bound
     */
    public static <J extends Job<?, ?>> @NotNull List<J> firstCompleted(@NotNull Collection<J> jobs, @Nullable Duration timeout)
            throws InterruptedException {
        List<J> ordered = distinctBySequence(jobs);
        if (ordered.isEmpty()) return new ArrayList<>();

        FirstCompletedWaiter waiter = new FirstCompletedWaiter();
        int locked = 0;
        try {
            for (J job : ordered) {
                job.lockState();
                locked++;
            }
            List<J> done = new ArrayList<>();
            for (J job : ordered) {
                if (job.doneLocked()) done.add(job);
            }
            if (!done.isEmpty()) return done;

            for (J job : ordered) job.installWaiter(waiter);
        } finally {
            for (int i = locked - 1; i >= 0; i--) ordered.get(i).unlockState();
        }

        try {
            waiter.await(timeout);
        } finally {
            for (J job : ordered) job.removeWaiter(waiter);
        }
        return cast(waiter.finishedJobs());
    }

    /**
     * Waits until every job is terminal or {@code timeout} elapses.
     *
     * @return the jobs still not terminal, empty when all are done
     */
    @Beta
    public static <J extends Job<?, ?>> @NotNull List<J> allDone(@NotNull Collection<J> jobs, @Nullable Duration timeout)
            throws InterruptedException {
        long budget = timeout == null ? 0L : Durations.toNanosSaturated(timeout);
        long start = System.nanoTime();
        List<J> remaining = distinctBySequence(jobs);
        while (true) {
            remaining.removeIf(Job::done);
            if (remaining.isEmpty()) return remaining;

            Duration left = null;
            if (timeout != null) {
                long nanos = budget - (System.nanoTime() - start);
                if (nanos <= 0) return remaining;
                left = Duration.ofNanos(nanos);
            }
            firstCompleted(remaining, left);
        }
    }

    private static <J extends Job<?, ?>> List<J> distinctBySequence(Collection<J> jobs) {
        ObjectsUtils.requireNonNull(jobs, new IllegalArgumentException("jobs should be NotNull"));
        Map<J, Boolean> seen = new IdentityHashMap<>();
        List<J> ordered = new ArrayList<>(jobs.size());
        for (J job : jobs) {
            ObjectsUtils.requireNonNull(job, new IllegalArgumentException("jobs should not contain null"));
            if (seen.put(job, Boolean.TRUE) == null) ordered.add(job);
        }
        ordered.sort(Comparator.comparingLong(Job::sequence));
        return ordered;
    }

    @SuppressWarnings("unchecked")
    private static <J extends Job<?, ?>> List<J> cast(List<Job<?, ?>> jobs) {
        List<J> out = new ArrayList<>(jobs.size());
        for (Job<?, ?> job : jobs) out.add((J) job);
        return out;
    }
}
