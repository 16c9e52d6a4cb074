package dev.flowlang.task;

/**
 * Failure raised by a task implementation or by the registry while invoking one.
 */
public class TaskException extends Exception {

    private final boolean retryable;

    public TaskException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public TaskException(String message) {
        this(message, null, true);
    }

    public static TaskException nonRetryable(String message) {
        return new TaskException(message, null, false);
    }

    public static TaskException nonRetryable(String message, Throwable cause) {
        return new TaskException(message, cause, false);
    }

    public boolean retryable() {
        return retryable;
    }
}
