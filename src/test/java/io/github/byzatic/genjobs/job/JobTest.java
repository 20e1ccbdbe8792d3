package io.github.byzatic.genjobs.job;

import io.github.byzatic.genjobs.base_exceptions.AlreadyRunningException;
import io.github.byzatic.genjobs.base_exceptions.JobCancelledException;
import io.github.byzatic.genjobs.base_exceptions.JobExecutionException;
import io.github.byzatic.genjobs.base_exceptions.OperationTimedOutException;
import io.github.byzatic.genjobs.context.Task;
import io.github.byzatic.genjobs.context.TaskFunction;
import io.github.byzatic.genjobs.context.WaitLimits;
import io.github.byzatic.genjobs.executor.Awaiter;
import io.github.byzatic.genjobs.executor.Submission;
import io.github.byzatic.genjobs.executor.TaskExecutor;
import io.github.byzatic.genjobs.executor.ThreadPoolTaskExecutor;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JobTest {

    ThreadPoolTaskExecutor executor;
    final CountDownLatch gate = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor.Builder()
                .threads(4)
                .shutdownGraceMillis(200)
                .build();
    }

    @AfterEach
    void tearDown() {
        gate.countDown();
        executor.close();
    }

    @Test
    void oneTaskPerGeneration_finishesWithResultsInSubmissionOrder() throws Exception {
        SimpleContext<Integer, Integer> context = SimpleContext.oneByOne(3, input -> List.of(input * 10), executor);
        Job<Integer, Integer> job = new Job<>(context);
        assertEquals(JobState.PENDING, job.state());

        job.start();
        List<Integer> result = job.result(Duration.ofSeconds(5));

        assertEquals(List.of(0, 10, 20), result);
        assertEquals(JobState.FINISHED, job.state());
        assertTrue(job.done());
        assertFalse(job.running());
        assertFalse(job.cancelled());
        assertEquals(List.of(0, 1, 2, 3), context.offsets);
    }

    @Test
    void feedbackHoldsEverySlotFilledSoFar() throws Exception {
        SimpleContext<Integer, Integer> context = SimpleContext.oneByOne(3, input -> List.of(input + 1), executor);
        Job<Integer, Integer> job = new Job<>(context).start();
        job.result(Duration.ofSeconds(5));

        assertEquals(List.of(), context.feedbacks.get(0));
        assertEquals(List.of(1), context.feedbacks.get(1));
        assertEquals(List.of(1, 2), context.feedbacks.get(2));
        assertEquals(List.of(1, 2, 3), context.feedbacks.get(3));
    }

    @Test
    void slotsFollowDeclarationNotCompletionOrder() throws Exception {
        // task 0 is the slowest, task 3 the fastest
        SimpleContext<Integer, String> context = SimpleContext.singleBatch(4, input -> {
            Thread.sleep((3 - input) * 40L);
            return List.of("r" + input);
        }, executor);

        List<String> result = new Job<>(context).start().result(Duration.ofSeconds(5));

        assertEquals(List.of("r0", "r1", "r2", "r3"), result);
    }

    @Test
    void multiSlotTask_scattersEachComponentIntoItsSlot() throws Exception {
        SimpleContext<String, String> context = new SimpleContext<>(
                (feedback, offset) -> {
                    if (offset > 0) return List.of();
                    return List.of(Task.of("a", 3, 0), Task.of("b", 1, 2));
                },
                (feedback, offset) -> WaitLimits.all(),
                input -> List.of(input + "-first", input + "-second"),
                executor);

        List<String> result = new Job<>(context).start().result(Duration.ofSeconds(5));

        assertEquals(Arrays.asList("a-second", "b-first", "b-second", "a-first"), result);
    }

    @Test
    void startTwice_failsAndLeavesStateAlone() throws Exception {
        SimpleContext<Integer, Integer> context = SimpleContext.oneByOne(1, input -> {
            gate.await();
            return List.of(input);
        }, executor);
        Job<Integer, Integer> job = new Job<>(context);
        job.start();

        AlreadyRunningException ex = assertThrows(AlreadyRunningException.class, job::start);
        assertTrue(ex.getMessage().contains(job.getId().toString()));
        assertTrue(job.running());

        gate.countDown();
        assertEquals(List.of(0), job.result(Duration.ofSeconds(5)));
        assertThrows(AlreadyRunningException.class, job::start);
        assertEquals(JobState.FINISHED, job.state());
    }

    @Test
    void cancelBeforeAnyTaskCompletes_resultFailsWithCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        SimpleContext<Integer, Integer> context = SimpleContext.singleBatch(2, input -> {
            started.countDown();
            gate.await();
            return List.of(input);
        }, executor);
        Job<Integer, Integer> job = new Job<>(context).start();
        assertTrue(started.await(2, TimeUnit.SECONDS));

        assertEquals(CancelResult.CANCELLATION_ISSUED, job.cancel());
        assertTrue(job.cancelled());
        assertTrue(job.done());
        assertThrows(JobCancelledException.class, job::result);

        assertTrue(job.join(Duration.ofSeconds(5)), "worker did not exit after cancel");
        assertEquals(CancelResult.ALREADY_DONE, job.cancel());
        assertEquals(JobState.CANCELLED, job.state());
        assertThrows(JobCancelledException.class, () -> job.result(Duration.ZERO));
    }

    @Test
    void cancelStopsRequestingBatches() throws Exception {
        CountDownLatch firstDone = new CountDownLatch(1);
        SimpleContext<Integer, Integer> context = new SimpleContext<>(
                (feedback, offset) -> {
                    if (offset == 1) firstDone.countDown();
                    return List.of(Task.of(offset, offset));
                },
                (feedback, offset) -> WaitLimits.all(),
                input -> {
                    if (input > 0) gate.await();
                    return List.of(input);
                },
                executor);
        Job<Integer, Integer> job = new Job<>(context).start();
        assertTrue(firstDone.await(2, TimeUnit.SECONDS));

        job.cancel();
        job.join();

        assertEquals(List.of(0, 1), context.offsets);
        assertEquals(JobState.CANCELLED, job.state());
    }

    @Test
    void cancelPendingJob_isNoOpAndJobStaysPending() throws Exception {
        Job<Integer, Integer> job = new Job<>(SimpleContext.oneByOne(1, input -> List.of(input), executor));

        assertEquals(CancelResult.NOT_STARTED, job.cancel());
        assertEquals(JobState.PENDING, job.state());
        assertFalse(job.done());
        assertFalse(job.cancelled());
        assertThrows(OperationTimedOutException.class, () -> job.result(Duration.ofMillis(50)));
        job.join();
        assertEquals(JobState.PENDING, job.state());
    }

    @Test
    void resultTimesOut_thenSucceedsOnRetry() throws Exception {
        Job<Integer, Integer> job = new Job<>(SimpleContext.oneByOne(1, input -> {
            gate.await();
            return List.of(7);
        }, executor)).start();

        assertThrows(OperationTimedOutException.class, () -> job.result(Duration.ZERO));
        assertThrows(OperationTimedOutException.class, () -> job.result(Duration.ofMillis(50)));

        gate.countDown();
        assertEquals(List.of(7), job.result(Duration.ofSeconds(5)));
    }

    @Test
    void zeroTimeout_onFinishedJob_returnsImmediately() throws Exception {
        Job<Integer, Integer> job = new Job<>(SimpleContext.oneByOne(2, input -> List.of(input), executor)).start();
        job.join();

        assertEquals(List.of(0, 1), job.result(Duration.ZERO));
    }

    @Test
    void failingTask_doesNotStopTheLoop_andLeavesItsSlotEmpty() throws Exception {
        SimpleContext<Integer, Integer> context = SimpleContext.oneByOne(3, input -> {
            if (input == 1) throw new IOException("boom");
            return List.of(input + 100);
        }, executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        List<Integer> result = job.result(Duration.ofSeconds(5));

        assertEquals(Arrays.asList(100, null, 102), result);
        assertEquals(List.of(0, 1, 2, 3), context.offsets);
        Map<Integer, Throwable> errors = job.taskErrors();
        assertEquals(1, errors.size());
        assertInstanceOf(IOException.class, errors.get(1));
        assertEquals(1, job.info().taskErrors);
        assertEquals(JobState.FINISHED, job.state());
    }

    @Test
    void failingPolicy_failsTheJob() throws Exception {
        SimpleContext<Integer, Integer> context = new SimpleContext<>(
                (feedback, offset) -> {
                    if (offset > 0) throw new IllegalStateException("policy broke");
                    return List.of(Task.of(0, 0));
                },
                (feedback, offset) -> WaitLimits.all(),
                input -> List.of(input),
                executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        JobExecutionException ex = assertThrows(JobExecutionException.class, () -> job.result(Duration.ofSeconds(5)));
        assertEquals("policy broke", ex.getCause().getMessage());
        assertEquals(JobState.FAILED, job.state());
        assertTrue(job.done());
        assertNotNull(job.info().failure);
        assertEquals(CancelResult.ALREADY_DONE, job.cancel());
    }

    @Test
    void emptyFirstBatch_finishesWithEmptyResult() throws Exception {
        SimpleContext<Integer, Integer> context = SimpleContext.oneByOne(0, input -> List.of(input), executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        assertEquals(List.of(), job.result(Duration.ofSeconds(5)));
        assertEquals(0, job.info().offset);
    }

    @Test
    void waitTimeout_leavesSlowTaskForALaterGeneration() throws Exception {
        // generation 0 submits a slow and a fast task, waits for one of them
        // generation 1 waits for everything
        SimpleContext<Integer, Integer> context = new SimpleContext<>(
                (feedback, offset) -> {
                    if (offset == 0) return List.of(Task.of(0, 0), Task.of(1, 1));
                    if (offset == 2) return List.of(Task.of(2, 2));
                    return List.of();
                },
                (feedback, offset) -> offset == 2 ? WaitLimits.of(1, Duration.ofSeconds(5)) : WaitLimits.all(),
                input -> {
                    if (input == 0) Thread.sleep(150);
                    return List.of(input);
                },
                executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        assertEquals(List.of(0, 1, 2), job.result(Duration.ofSeconds(5)));
        assertEquals(List.of(1), context.feedbacks.get(1));
    }

    @Test
    void info_reportsProgress() throws Exception {
        Job<Integer, Integer> job = new Job<>(SimpleContext.oneByOne(3, input -> List.of(input), executor)).start();
        job.join();

        JobInfo info = job.info();
        assertEquals(job.getId(), info.id);
        assertEquals(JobState.FINISHED, info.state);
        assertEquals(3, info.offset);
        assertEquals(3, info.slots);
        assertEquals(3, info.filledSlots);
        assertNotNull(info.startedAt);
        assertNotNull(info.endedAt);
        assertNull(info.failure);
    }

    @Test
    void slotReusedAcrossGenerations_failsTheJobAndKeepsTheFirstValue() throws Exception {
        SimpleContext<Integer, Integer> context = new SimpleContext<>(
                (feedback, offset) -> {
                    if (offset > 1) return List.of();
                    return List.of(Task.of(offset + 100, 0));
                },
                (feedback, offset) -> WaitLimits.all(),
                input -> List.of(input),
                executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        JobExecutionException ex = assertThrows(JobExecutionException.class, () -> job.result(Duration.ofSeconds(5)));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("slot 0"), ex.getCause().getMessage());
        assertEquals(JobState.FAILED, job.state());
        assertEquals(List.of(List.of(), List.of(100)), context.feedbacks);
        assertEquals(1, job.info().offset);
    }

    @Test
    void slotClaimedTwiceInOneBatch_failsBeforeSubmitting() throws Exception {
        List<Integer> ran = new CopyOnWriteArrayList<>();
        SimpleContext<Integer, Integer> context = new SimpleContext<>(
                (feedback, offset) -> List.of(Task.of(1, 0, 1), Task.of(2, 1)),
                (feedback, offset) -> WaitLimits.all(),
                input -> {
                    ran.add(input);
                    return List.of(input, input);
                },
                executor);
        Job<Integer, Integer> job = new Job<>(context).start();

        assertThrows(JobExecutionException.class, () -> job.result(Duration.ofSeconds(5)));
        assertEquals(0, job.info().offset);
        assertTrue(ran.isEmpty());
    }

    @Test
    void futureCancelledByExecutor_leavesSlotEmptyWithoutTaskError() throws Exception {
        List<Integer> failedTasks = new CopyOnWriteArrayList<>();
        // cancels the future of the task whose input is 1 as soon as it is submitted
        TaskExecutor cancelling = new TaskExecutor() {
            @Override
            public <I, O> @NotNull List<Submission<O>> submitAll(@NotNull TaskFunction<I, O> fn, @NotNull List<Task<I>> tasks) {
                List<Submission<O>> submissions = executor.submitAll(fn, tasks);
                for (int i = 0; i < tasks.size(); i++) {
                    if (Integer.valueOf(1).equals(tasks.get(i).input())) submissions.get(i).future().cancel(true);
                }
                return submissions;
            }

            @Override
            public @NotNull Awaiter getAwaiter() {
                return executor.getAwaiter();
            }
        };
        Job<Integer, Integer> job = new Job.Builder<Integer, Integer>()
                .context(SimpleContext.oneByOne(3, input -> List.of(input + 10), cancelling))
                .addListener(new JobEventListener() {
                    @Override
                    public void onTaskError(java.util.UUID jobId, int taskIndex, Throwable error) {
                        failedTasks.add(taskIndex);
                    }
                })
                .build()
                .start();

        assertEquals(Arrays.asList(10, null, 12), job.result(Duration.ofSeconds(5)));
        job.join();
        assertTrue(job.taskErrors().isEmpty());
        assertTrue(failedTasks.isEmpty());
        assertEquals(JobState.FINISHED, job.state());
    }

    @Test
    void overlongTimeouts_meanNoLimit() throws Exception {
        Job<Integer, Integer> job = new Job<>(SimpleContext.oneByOne(2, input -> List.of(input), executor)).start();

        assertEquals(List.of(0, 1), job.result(Duration.ofSeconds(Long.MAX_VALUE)));
        assertEquals(List.of(0, 1), job.result(ChronoUnit.CENTURIES.getDuration().multipliedBy(5)));
    }

    @Test
    void builder_namesWorkerAndRegistersListeners() throws Exception {
        List<String> threads = new ArrayList<>();
        CountDownLatch completed = new CountDownLatch(1);
        Job<Integer, Integer> job = new Job.Builder<Integer, Integer>()
                .context(SimpleContext.oneByOne(1, input -> List.of(input), executor))
                .threadNamePrefix("test-worker-")
                .daemon(true)
                .addListener(new JobEventListener() {
                    @Override
                    public void onStart(java.util.UUID jobId) {
                        threads.add(Thread.currentThread().getName());
                    }

                    @Override
                    public void onComplete(java.util.UUID jobId) {
                        completed.countDown();
                    }
                })
                .build();

        job.start();
        assertTrue(completed.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("test-worker-" + job.getId()), threads);
    }

    @Test
    void builder_withoutContext_fails() {
        assertThrows(IllegalStateException.class, () -> new Job.Builder<Integer, Integer>().build());
    }
}
