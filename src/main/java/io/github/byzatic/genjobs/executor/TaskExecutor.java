package io.github.byzatic.genjobs.executor;

import io.github.byzatic.genjobs.context.Task;
import io.github.byzatic.genjobs.context.TaskFunction;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Adapter over whatever actually runs the work function.
 */
public interface TaskExecutor {

    /**
     * Submits one invocation of {@code fn} per task.
     *
     * @return one submission per task, in the order of {@code tasks}
     */
    <I, O> @NotNull List<Submission<O>> submitAll(@NotNull TaskFunction<I, O> fn, @NotNull List<Task<I>> tasks);

    /**
     * Awaiter able to wait on the futures this executor produces.
     */
    @NotNull Awaiter getAwaiter();
}
