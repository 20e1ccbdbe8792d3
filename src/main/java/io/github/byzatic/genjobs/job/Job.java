package io.github.byzatic.genjobs.job;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.genjobs.Durations;
import io.github.byzatic.genjobs.ObjectsUtils;
import io.github.byzatic.genjobs.base_exceptions.AlreadyRunningException;
import io.github.byzatic.genjobs.base_exceptions.JobCancelledException;
import io.github.byzatic.genjobs.base_exceptions.JobExecutionException;
import io.github.byzatic.genjobs.base_exceptions.OperationTimedOutException;
import io.github.byzatic.genjobs.context.Context;
import io.github.byzatic.genjobs.context.Task;
import io.github.byzatic.genjobs.context.TaskFunction;
import io.github.byzatic.genjobs.context.WaitLimits;
import io.github.byzatic.genjobs.executor.Awaiter;
import io.github.byzatic.genjobs.executor.Submission;
import io.github.byzatic.genjobs.executor.TaskExecutor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Job — one generational run driven by a {@link Context}:
 * - the context produces a batch of tasks from the feedback gathered so far;
 * - the batch goes to the context's executor;
 * - the worker waits for as many of all accumulated futures as the context asks for;
 * - finished outputs are scattered into their declared result slots;
 * - repeat until the context returns no tasks or the job is cancelled.
 * <p>
 * Every run gets its own worker thread. All mutable state is guarded by one lock, which the
 * worker never holds while waiting on futures. Result slots are ordered by the slots tasks
 * declare, not by completion order.
 *
 * @param <I> task input type
 * @param <O> type of a single output component
 */
@ThreadSafe
public final class Job<I, O> implements JobInterface<O> {
    private final static Logger logger = LoggerFactory.getLogger(Job.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final UUID id;
    private final long sequence;
    private final Context<I, O> context;
    private final List<JobEventListener> listeners;
    private final CancellationToken token = new CancellationToken();
    private final Thread worker;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition terminated = lock.newCondition();

    @GuardedBy("lock") private JobState state = JobState.PENDING;
    @GuardedBy("lock") private int offset = 0;
    @GuardedBy("lock") private final List<List<Integer>> indexGroups = new ArrayList<>();
    @GuardedBy("lock") private final List<Future<List<O>>> futures = new ArrayList<>();
    @GuardedBy("lock") private final BitSet handled = new BitSet();
    @GuardedBy("lock") private final List<O> results = new ArrayList<>();
    // owning task index per slot, -1 while unclaimed
    @GuardedBy("lock") private final List<Integer> slotOwners = new ArrayList<>();
    @GuardedBy("lock") private final Map<Integer, Throwable> taskErrors = new LinkedHashMap<>();
    @GuardedBy("lock") private final Set<FirstCompletedWaiter> waiters = new LinkedHashSet<>();
    @GuardedBy("lock") private Throwable failure = null;
    @GuardedBy("lock") private Instant startedAt = null;
    @GuardedBy("lock") private Instant endedAt = null;

    public Job(@NotNull Context<I, O> context) {
        this(context, Collections.emptyList(), "genjob-worker-", false);
    }

    private Job(Context<I, O> context, List<JobEventListener> listeners, String threadNamePrefix, boolean daemon) {
        this.context = ObjectsUtils.requireNonNull(context, new IllegalArgumentException("context should be NotNull"));
        this.id = UUID.randomUUID();
        this.sequence = SEQUENCE.incrementAndGet();
        this.listeners = new CopyOnWriteArrayList<>(listeners);
        this.worker = new Thread(this::process, threadNamePrefix + id);
        this.worker.setDaemon(daemon);
        this.worker.setUncaughtExceptionHandler((th, ex) ->
                logger.error("Uncaught exception in {}", th.getName(), ex));
    }

    public static final class Builder<I, O> {
        private Context<I, O> context;
        private final List<JobEventListener> listeners = new ArrayList<>();
        private String threadNamePrefix = "genjob-worker-";
        private boolean daemon = false;

        public Builder<I, O> context(@NotNull Context<I, O> context) {
            this.context = ObjectsUtils.requireNonNull(context, new IllegalArgumentException("context should be NotNull"));
            return this;
        }

        public Builder<I, O> addListener(@NotNull JobEventListener l) {
            listeners.add(ObjectsUtils.requireNonNull(l, new IllegalArgumentException("listener should be NotNull")));
            return this;
        }

        /**
         * Worker thread name prefix; the job id is appended.
         */
        public Builder<I, O> threadNamePrefix(@NotNull String threadNamePrefix) {
            this.threadNamePrefix = ObjectsUtils.requireNonNull(threadNamePrefix, new IllegalArgumentException("threadNamePrefix should be NotNull"));
            return this;
        }

        public Builder<I, O> daemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public Job<I, O> build() {
            ObjectsUtils.requireNonNull(context, new IllegalStateException("context was not set"));
            return new Job<>(context, listeners, threadNamePrefix, daemon);
        }
    }

    // ======== Public API ========

    @Override
    public @NotNull UUID getId() {
        return id;
    }

    @Override
    public void addListener(@NotNull JobEventListener l) {
        listeners.add(ObjectsUtils.requireNonNull(l, new IllegalArgumentException("listener should be NotNull")));
    }

    @Override
    public void removeListener(@NotNull JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Moves the job to RUNNING and starts its worker.
     *
     * @throws AlreadyRunningException if the job is not PENDING; the state is left as it was
     */
    @Override
    public @NotNull Job<I, O> start() throws AlreadyRunningException {
        lock.lock();
        try {
            if (state != JobState.PENDING) {
                throw new AlreadyRunningException("Job " + id + " is already " + state);
            }
            state = JobState.RUNNING;
            startedAt = Instant.now();
            // started under the lock so join() never sees RUNNING with an unstarted thread
            worker.start();
        } finally {
            lock.unlock();
        }
        logger.debug("Job {} started", id);
        return this;
    }

    /**
     * Cancels a running job: no further batch is requested, every known future gets a
     * cancellation request and {@link #result} callers are woken up.
     * <p>
     * A job that was never started is left untouched and stays PENDING.
     */
    @Override
    public @NotNull CancelResult cancel() {
        lock.lock();
        try {
            switch (state) {
                case PENDING:
                    logger.debug("Job {} was never started, cancel ignored", id);
                    return CancelResult.NOT_STARTED;
                case RUNNING:
                    state = JobState.CANCELLED;
                    token.requestStop("Cancelled by caller");
                    cancelFutures();
                    terminated.signalAll();
                    logger.debug("Job {} cancelled at offset {}", id, offset);
                    return CancelResult.CANCELLATION_ISSUED;
                default:
                    return CancelResult.ALREADY_DONE;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean cancelled() {
        return stateSnapshot() == JobState.CANCELLED;
    }

    @Override
    public boolean running() {
        return stateSnapshot() == JobState.RUNNING;
    }

    @Override
    public boolean done() {
        return stateSnapshot().isTerminal();
    }

    public @NotNull JobState state() {
        return stateSnapshot();
    }

    /**
     * Same as {@code result(null)}.
     */
    @Override
    public @NotNull List<O> result() throws JobCancelledException, JobExecutionException, OperationTimedOutException, InterruptedException {
        return result(null);
    }

    /**
     * Waits for the job to end and returns the result buffer, one entry per slot. Slots whose
     * task failed or never completed are {@code null}.
     *
     * @param timeout upper bound of the wait; {@code null} waits without limit, zero only checks
     * @throws JobCancelledException       the job was cancelled; partial results are not exposed
     * @throws JobExecutionException       the job failed outside of its tasks
     * @throws OperationTimedOutException  the job did not end in time
     */
    @Override
    public @NotNull List<O> result(@Nullable Duration timeout)
            throws JobCancelledException, JobExecutionException, OperationTimedOutException, InterruptedException {
        lock.lock();
        try {
            if (timeout == null) {
                while (!state.isTerminal()) terminated.await();
            } else {
                long nanos = Durations.toNanosSaturated(timeout);
                while (!state.isTerminal() && nanos > 0) nanos = terminated.awaitNanos(nanos);
            }

            switch (state) {
                case FINISHED:
                    return Collections.unmodifiableList(new ArrayList<>(results));
                case CANCELLED:
                    throw new JobCancelledException("Job " + id + " was cancelled");
                case FAILED:
                    throw new JobExecutionException("Job " + id + " failed", failure);
                default:
                    throw new OperationTimedOutException("Job " + id + " is still " + state + " after " + timeout);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the worker thread has exited. Returns at once for a job that was never started.
     */
    @Override
    public void join() throws InterruptedException {
        if (stateSnapshot() == JobState.PENDING) return;
        worker.join();
    }

    /**
     * @return {@code true} if no worker is alive on return
     */
    @Override
    public boolean join(@NotNull Duration timeout) throws InterruptedException {
        if (stateSnapshot() == JobState.PENDING) return true;
        worker.join(Math.max(1, timeout.toMillis()));
        return !worker.isAlive();
    }

    @Override
    public @NotNull JobInfo info() {
        lock.lock();
        try {
            int filled = 0;
            for (O result : results) if (result != null) filled++;
            return new JobInfo(id, state, offset, results.size(), filled, taskErrors.size(), startedAt, endedAt,
                    failure == null ? null : String.valueOf(failure));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Failures of individual tasks, by task index in submission order.
     */
    @Override
    public @NotNull Map<Integer, Throwable> taskErrors() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(taskErrors));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", state=" + stateSnapshot() + '}';
    }

    // ======== Multi-job wait support ========

    long sequence() {
        return sequence;
    }

    void lockState() {
        lock.lock();
    }

    void unlockState() {
        lock.unlock();
    }

    /**
     * Caller holds the lock.
     */
    boolean doneLocked() {
        return state.isTerminal();
    }

    /**
     * Caller holds the lock.
     */
    void installWaiter(FirstCompletedWaiter waiter) {
        waiters.add(waiter);
    }

    void removeWaiter(FirstCompletedWaiter waiter) {
        lock.lock();
        try {
            waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    // ======== Worker ========

    private void process() {
        fire(l -> l.onStart(id));
        Throwable cause = null;
        try {
            generations();
        } catch (InterruptedException ie) {
            logger.debug("Job {} worker interrupted, cancelling", id);
            cancel();
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            logger.error("Job {} failed", id, t);
            cause = t;
        } finally {
            terminate(cause);
        }
    }

    private void generations() throws InterruptedException {
        TaskFunction<I, O> fn = ObjectsUtils.requireNonNull(context.getFunction(), new IllegalStateException("Context returned no function"));
        TaskExecutor executor = ObjectsUtils.requireNonNull(context.getExecutor(), new IllegalStateException("Context returned no executor"));
        Awaiter awaiter = ObjectsUtils.requireNonNull(executor.getAwaiter(), new IllegalStateException("Executor returned no awaiter"));

        List<O> feedback = Collections.emptyList();
        List<Task<I>> tasks = nextTasks(feedback, 0);
        while (active() && !tasks.isEmpty()) {
            checkSlots(tasks);
            List<Submission<O>> submissions = executor.submitAll(fn, tasks);
            if (submissions.size() != tasks.size()) {
                throw new IllegalStateException("Executor returned " + submissions.size() + " submission(s) for " + tasks.size() + " task(s)");
            }

            List<Future<List<O>>> outstanding;
            int submitted;
            lock.lock();
            try {
                offset += tasks.size();
                for (Submission<O> submission : submissions) {
                    reserveSlots(futures.size(), submission.indexGroup());
                    indexGroups.add(submission.indexGroup());
                    futures.add(submission.future());
                    // cancel() raced with the submit; it could not see these futures
                    if (state != JobState.RUNNING) submission.future().cancel(true);
                }
                submitted = offset;
                outstanding = new ArrayList<>(futures);
            } finally {
                lock.unlock();
            }

            WaitLimits limits = ObjectsUtils.requireNonNull(context.waitPolicy(feedback, submitted), new IllegalStateException("Context returned no wait limits"));
            logger.trace("Job {}: offset {}, waiting for {} of {} future(s), timeout {}", id, submitted, limits.count(), outstanding.size(), limits.timeout());
            Set<Future<?>> completed = awaiter.await(outstanding, limits.count(), limits.timeout());

            List<Map.Entry<Integer, Throwable>> failed = new ArrayList<>();
            lock.lock();
            try {
                if (state == JobState.RUNNING) {
                    for (int i = 0; i < outstanding.size(); i++) {
                        if (!handled.get(i) && completed.contains(outstanding.get(i))) {
                            Throwable error = handleFuture(i);
                            if (error != null) failed.add(new AbstractMap.SimpleImmutableEntry<>(i, error));
                        }
                    }
                }
                feedback = filledSlots();
            } finally {
                lock.unlock();
            }
            for (Map.Entry<Integer, Throwable> entry : failed) {
                fire(l -> l.onTaskError(id, entry.getKey(), entry.getValue()));
            }
            int generationSize = submissions.size();
            fire(l -> l.onGeneration(id, submitted, generationSize));

            if (!active()) break;
            tasks = nextTasks(feedback, submitted);
        }
    }

    private List<Task<I>> nextTasks(List<O> feedback, int offset) {
        return ObjectsUtils.requireNonNull(context.nextTasks(feedback, offset), new IllegalStateException("Context returned no tasks list"));
    }

    private boolean active() {
        lock.lock();
        try {
            return state == JobState.RUNNING && !token.isStopRequested();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects a batch that claims a slot twice or a slot an earlier task already owns.
     *
     * @throws IllegalStateException on the first conflicting slot; the job then fails
     */
    private void checkSlots(List<Task<I>> tasks) {
        Set<Integer> claimed = new HashSet<>();
        lock.lock();
        try {
            for (int t = 0; t < tasks.size(); t++) {
                for (int slot : tasks.get(t).slots()) {
                    if (slot < slotOwners.size() && slotOwners.get(slot) >= 0) {
                        throw new IllegalStateException("Task " + (offset + t) + " claims slot " + slot
                                + " owned by task " + slotOwners.get(slot));
                    }
                    if (!claimed.add(slot)) {
                        throw new IllegalStateException("Slot " + slot + " claimed twice in the batch at offset " + offset);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void reserveSlots(int owner, List<Integer> indexGroup) {
        for (int slot : indexGroup) {
            while (results.size() <= slot) {
                results.add(null);
                slotOwners.add(-1);
            }
            slotOwners.set(slot, owner);
        }
    }

    /**
     * Scatters the output of future {@code i}, known to be complete. Caller holds the lock.
     *
     * @return the task failure, or {@code null} if the output was scattered or the task was cancelled
     */
    @GuardedBy("lock")
    private Throwable handleFuture(int i) throws InterruptedException {
        handled.set(i);
        List<Integer> indexGroup = indexGroups.get(i);
        try {
            List<O> output = futures.get(i).get(0, TimeUnit.NANOSECONDS);
            if (output == null || output.size() < indexGroup.size()) {
                return recordTaskError(i, new IllegalStateException("Task " + i + " produced "
                        + (output == null ? "no" : output.size()) + " output(s) for " + indexGroup.size() + " slot(s)"));
            }
            for (int j = 0; j < indexGroup.size(); j++) {
                int slot = indexGroup.get(j);
                if (slotOwners.get(slot) == i) results.set(slot, output.get(j));
            }
            return null;
        } catch (CancellationException e) {
            logger.trace("Job {}: task {} was cancelled", id, i);
            return null;
        } catch (ExecutionException e) {
            return recordTaskError(i, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            // reported complete but is not; leave it for a later generation
            logger.warn("Job {}: task {} reported complete but has no result yet", id, i);
            handled.clear(i);
            return null;
        }
    }

    @GuardedBy("lock")
    private Throwable recordTaskError(int i, Throwable error) {
        taskErrors.put(i, error);
        logger.warn("Job {}: task {} failed, keep running", id, i, error);
        return error;
    }

    @GuardedBy("lock")
    private List<O> filledSlots() {
        List<O> filled = new ArrayList<>();
        for (O result : results) if (result != null) filled.add(result);
        return Collections.unmodifiableList(filled);
    }

    @GuardedBy("lock")
    private void cancelFutures() {
        for (Future<List<O>> future : futures) future.cancel(true);
    }

    private void terminate(@Nullable Throwable cause) {
        JobState reached;
        lock.lock();
        try {
            if (state == JobState.RUNNING) {
                if (cause == null) {
                    state = JobState.FINISHED;
                } else {
                    state = JobState.FAILED;
                    failure = cause;
                    cancelFutures();
                }
            }
            endedAt = Instant.now();
            reached = state;
            for (FirstCompletedWaiter waiter : waiters) waiter.addResult(this);
            terminated.signalAll();
        } finally {
            lock.unlock();
        }
        logger.debug("Job {} ended {}", id, reached);

        switch (reached) {
            case FINISHED:
                fire(l -> l.onComplete(id));
                break;
            case CANCELLED:
                fire(l -> l.onCancelled(id));
                break;
            case FAILED:
                Throwable error = cause;
                fire(l -> l.onError(id, error));
                break;
            default:
                break;
        }
    }

    private JobState stateSnapshot() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job {}: listener {} failed, ignoring", id, l, t);
            }
        }
    }
}
