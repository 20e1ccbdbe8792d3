package io.github.byzatic.genjobs.job;

/**
 * Lifecycle of a job. PENDING -> RUNNING -> one of the terminal states; nothing leaves a terminal state.
 */
public enum JobState {
    PENDING,
    RUNNING,
    FINISHED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED || this == FAILED;
    }
}
