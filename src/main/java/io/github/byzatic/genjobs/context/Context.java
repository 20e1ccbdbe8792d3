package io.github.byzatic.genjobs.context;

import io.github.byzatic.genjobs.executor.TaskExecutor;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Policy collaborator of a {@link io.github.byzatic.genjobs.job.Job}.
 * <p>
 * The job never decides what to run or how long to wait: it asks the context after every
 * generation, handing over the feedback gathered so far (every filled result slot, in slot
 * order) and the number of tasks submitted so far.
 *
 * @param <I> task input type
 * @param <O> type of a single output component
 */
public interface Context<I, O> {

    /**
     * Produces the next batch. An empty list means there is no more work and the job finishes.
     *
     * @param feedback every result slot filled so far, in slot order
     * @param offset   number of tasks submitted so far
     */
    @NotNull List<Task<I>> nextTasks(@NotNull List<O> feedback, int offset);

    /**
     * Decides how many of the accumulated futures to wait for before the next batch is requested.
     */
    @NotNull WaitLimits waitPolicy(@NotNull List<O> feedback, int offset);

    @NotNull TaskFunction<I, O> getFunction();

    @NotNull TaskExecutor getExecutor();
}
