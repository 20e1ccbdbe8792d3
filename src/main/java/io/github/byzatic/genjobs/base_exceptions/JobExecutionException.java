package io.github.byzatic.genjobs.base_exceptions;

public class JobExecutionException extends Exception {
    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(Throwable cause) {
        super(cause);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobExecutionException(Throwable cause, String message) {
        super(message, cause);
    }
}
