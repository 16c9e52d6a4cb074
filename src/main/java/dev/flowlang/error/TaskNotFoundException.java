package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * The registry has no task under the requested name, or only an unimplemented stub.
 */
public class TaskNotFoundException extends FlowException {

    private final String taskName;

    public TaskNotFoundException(String taskName) {
        this(taskName, "Task '%s' not found in registry".formatted(taskName));
    }

    public TaskNotFoundException(String taskName, String message) {
        super(ErrorKind.TASK_NOT_FOUND, message);
        this.taskName = taskName;
    }

    public static TaskNotFoundException notImplemented(String taskName) {
        return new TaskNotFoundException(taskName,
            "Task '%s' is not implemented yet. Please implement this task before running the flow."
                .formatted(taskName));
    }

    public String taskName() {
        return taskName;
    }
}
