package io.github.byzatic.genjobs.job;

import io.github.byzatic.genjobs.base_exceptions.AlreadyRunningException;
import io.github.byzatic.genjobs.base_exceptions.JobCancelledException;
import io.github.byzatic.genjobs.base_exceptions.JobExecutionException;
import io.github.byzatic.genjobs.base_exceptions.OperationTimedOutException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface JobInterface<O> {
    @NotNull UUID getId();

    @NotNull JobInterface<O> start() throws AlreadyRunningException;

    @NotNull CancelResult cancel();

    boolean cancelled();

    boolean running();

    boolean done();

    @NotNull List<O> result() throws JobCancelledException, JobExecutionException, OperationTimedOutException, InterruptedException;

    @NotNull List<O> result(@Nullable Duration timeout) throws JobCancelledException, JobExecutionException, OperationTimedOutException, InterruptedException;

    void join() throws InterruptedException;

    boolean join(@NotNull Duration timeout) throws InterruptedException;

    @NotNull JobInfo info();

    @NotNull Map<Integer, Throwable> taskErrors();

    void addListener(@NotNull JobEventListener l);

    void removeListener(@NotNull JobEventListener l);
}
