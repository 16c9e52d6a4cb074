package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * A task raised an error, after its retry policy (if any) was exhausted.
 */
public class TaskFailedException extends FlowException {

    private final String taskName;
    private final int attempts;

    public TaskFailedException(String taskName, int attempts, Throwable cause) {
        super(ErrorKind.TASK_FAILED, message(taskName, attempts, cause), cause);
        this.taskName = taskName;
        this.attempts = attempts;
    }

    private static String message(String taskName, int attempts, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
        if (attempts > 1) {
            return "Task '%s' failed after %d attempts: %s".formatted(taskName, attempts, detail);
        }
        return "Task '%s' failed: %s".formatted(taskName, detail);
    }

    public String taskName() {
        return taskName;
    }

    public int attempts() {
        return attempts;
    }
}
