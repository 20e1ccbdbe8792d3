package io.github.byzatic.genjobs.base_exceptions;

public class AlreadyRunningException extends Exception {
    public AlreadyRunningException(String message) {
        super(message);
    }

    public AlreadyRunningException(Throwable cause) {
        super(cause);
    }

    public AlreadyRunningException(String message, Throwable cause) {
        super(message, cause);
    }

    public AlreadyRunningException(Throwable cause, String message) {
        super(message, cause);
    }
}
