package io.github.byzatic.genjobs.executor;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.Future;

/**
 * What the executor hands back for one submitted task: the slots its output fills and the
 * future producing that output.
 */
public final class Submission<O> {
    private final List<Integer> indexGroup;
    private final Future<List<O>> future;

    public Submission(@NotNull List<Integer> indexGroup, @NotNull Future<List<O>> future) {
        this.indexGroup = List.copyOf(indexGroup);
        this.future = future;
    }

    public @NotNull List<Integer> indexGroup() {
        return indexGroup;
    }

    public @NotNull Future<List<O>> future() {
        return future;
    }
}
