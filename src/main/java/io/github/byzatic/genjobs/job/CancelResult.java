package io.github.byzatic.genjobs.job;

/**
 * Outcome of {@link JobInterface#cancel()}.
 */
public enum CancelResult {
    /**
     * The job had already reached a terminal state; nothing to do.
     */
    ALREADY_DONE,
    /**
     * The job was running and is now cancelled.
     */
    CANCELLATION_ISSUED,
    /**
     * The job was never started. Cancellation has no effect and the job stays PENDING.
     */
    NOT_STARTED
}
