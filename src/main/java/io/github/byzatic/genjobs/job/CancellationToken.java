package io.github.byzatic.genjobs.job;

import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop flag of one job run, checked by the worker before every generation.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public boolean isStopRequested() {
        return reason.get() != null;
    }

    /**
     * @return why the stop was requested, or {@code null} while no stop was requested
     */
    public @Nullable String reason() {
        return reason.get();
    }

    /**
     * Only the first request is kept.
     *
     * @return {@code true} if this call raised the flag
     */
    boolean requestStop(String why) {
        return reason.compareAndSet(null, why == null ? "" : why);
    }
}
