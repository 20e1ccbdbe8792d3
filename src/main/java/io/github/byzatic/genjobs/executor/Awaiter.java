package io.github.byzatic.genjobs.executor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * Blocks until enough futures are complete.
 */
@FunctionalInterface
public interface Awaiter {

    /**
     * Waits until at least {@code min(count, futures.size())} of {@code futures} are complete
     * or {@code timeout} elapses. Futures that are already complete count immediately.
     *
     * @param futures futures to watch, none of them is modified
     * @param count   number of completions to wait for
     * @param timeout upper bound of the wait, {@code null} for no bound
     * @return identity set of every future in {@code futures} observed complete on return;
     * may hold more or fewer than {@code count} entries
     */
    @NotNull Set<Future<?>> await(@NotNull List<? extends Future<?>> futures, int count, @Nullable Duration timeout)
            throws InterruptedException;
}
