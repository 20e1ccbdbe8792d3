package io.github.byzatic.genjobs.base_exceptions;

public class JobCancelledException extends Exception {
    public JobCancelledException(String message) {
        super(message);
    }

    public JobCancelledException(Throwable cause) {
        super(cause);
    }

    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobCancelledException(Throwable cause, String message) {
        super(message, cause);
    }
}
