package io.github.byzatic.genjobs.context;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;

/**
 * How many of the outstanding futures a generation waits for, and for how long.
 * A {@code null} timeout means no limit.
 */
public final class WaitLimits {
    private final int count;
    private final Duration timeout;

    private WaitLimits(int count, @Nullable Duration timeout) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative, got " + timeout);
        }
        this.count = count;
        this.timeout = timeout;
    }

    public static @NotNull WaitLimits of(int count, @Nullable Duration timeout) {
        return new WaitLimits(count, timeout);
    }

    /**
     * Wait for every outstanding future, without a time limit.
     */
    public static @NotNull WaitLimits all() {
        return new WaitLimits(Integer.MAX_VALUE, null);
    }

    /**
     * Wait for every outstanding future, at most {@code timeout}.
     */
    public static @NotNull WaitLimits all(@Nullable Duration timeout) {
        return new WaitLimits(Integer.MAX_VALUE, timeout);
    }

    public int count() {
        return count;
    }

    public @Nullable Duration timeout() {
        return timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WaitLimits)) return false;
        WaitLimits that = (WaitLimits) o;
        return count == that.count && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, timeout);
    }

    @Override
    public String toString() {
        return "WaitLimits{count=" + count + ", timeout=" + timeout + '}';
    }
}
