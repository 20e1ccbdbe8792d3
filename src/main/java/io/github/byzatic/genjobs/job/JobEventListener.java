package io.github.byzatic.genjobs.job;

import java.util.UUID;

/**
 * Job event listener. Callbacks run on the job's worker thread, outside the job lock.
 */
public interface JobEventListener {
    default void onStart(UUID jobId) {
    }

    /**
     * A generation ended: its batch was submitted, waited on and scattered.
     *
     * @param offset    tasks submitted so far
     * @param submitted tasks submitted by this generation
     */
    default void onGeneration(UUID jobId, int offset, int submitted) {
    }

    default void onTaskError(UUID jobId, int taskIndex, Throwable error) {
    }

    default void onComplete(UUID jobId) {
    }

    default void onCancelled(UUID jobId) {
    }

    default void onError(UUID jobId, Throwable error) {
    }
}
