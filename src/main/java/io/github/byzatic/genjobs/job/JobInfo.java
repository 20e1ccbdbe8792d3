package io.github.byzatic.genjobs.job;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time view of a job.
 */
public final class JobInfo {
    public final UUID id;
    public final JobState state;
    public final int offset;
    public final int slots;
    public final int filledSlots;
    public final int taskErrors;
    public final Instant startedAt;
    public final Instant endedAt;
    public final String failure;

    JobInfo(UUID id, JobState state, int offset, int slots, int filledSlots, int taskErrors,
            Instant startedAt, Instant endedAt, String failure) {
        this.id = id;
        this.state = state;
        this.offset = offset;
        this.slots = slots;
        this.filledSlots = filledSlots;
        this.taskErrors = taskErrors;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.failure = failure;
    }

    @Override
    public String toString() {
        return "JobInfo{id=" + id + ", state=" + state + ", offset=" + offset + ", slots=" + filledSlots + "/" + slots +
                ", taskErrors=" + taskErrors + ", startedAt=" + startedAt + ", endedAt=" + endedAt +
                (failure != null ? ", failure='" + failure + '\'' : "") + '}';
    }
}
