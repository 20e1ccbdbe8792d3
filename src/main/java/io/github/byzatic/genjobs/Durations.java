package io.github.byzatic.genjobs;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Timeout conversions.
 */
public final class Durations {

    private Durations() {
    }

    /**
     * {@link Duration#toNanos()} clamped to {@code [0, Long.MAX_VALUE]}; durations too long for a
     * {@code long} become {@code Long.MAX_VALUE}, negative ones zero.
     */
    public static long toNanosSaturated(@NotNull Duration duration) {
        if (duration.isNegative()) return 0L;
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
