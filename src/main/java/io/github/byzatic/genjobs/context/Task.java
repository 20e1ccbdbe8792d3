package io.github.byzatic.genjobs.context;

import io.github.byzatic.genjobs.ObjectsUtils;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work: an input for the work function and the result slots its output fills.
 * Output component {@code j} lands in slot {@code slots().get(j)}.
 */
public final class Task<I> {
    private final I input;
    private final List<Integer> slots;

    public Task(@NotNull I input, @NotNull List<Integer> slots) {
        this.input = ObjectsUtils.requireNonNull(input, new IllegalArgumentException("input should be NotNull"));
        ObjectsUtils.requireNonNull(slots, new IllegalArgumentException("slots should be NotNull"));
        List<Integer> copy = new ArrayList<>(slots.size());
        for (Integer slot : slots) {
            ObjectsUtils.requireTrue(slot != null && slot >= 0, new IllegalArgumentException("slot must be >= 0, got " + slot));
            copy.add(slot);
        }
        this.slots = Collections.unmodifiableList(copy);
    }

    public static <I> @NotNull Task<I> of(@NotNull I input, int... slots) {
        List<Integer> list = new ArrayList<>(slots.length);
        for (int slot : slots) list.add(slot);
        return new Task<>(input, list);
    }

    public @NotNull I input() {
        return input;
    }

    public @NotNull List<Integer> slots() {
        return slots;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task)) return false;
        Task<?> task = (Task<?>) o;
        return input.equals(task.input) && slots.equals(task.slots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, slots);
    }

    @Override
    public String toString() {
        return "Task{input=" + input + ", slots=" + slots + '}';
    }
}
