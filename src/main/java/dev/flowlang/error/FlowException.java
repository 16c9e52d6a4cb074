package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.FlowError;

/**
 * Base class of every error raised while loading or executing a flow.
 */
public class FlowException extends RuntimeException {

    private final ErrorKind kind;
    private volatile String stepId;

    public FlowException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public FlowException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Id of the innermost step that failed, or null when the error happened outside any step. */
    public String stepId() {
        return stepId;
    }

    /** Records the failing step unless an inner step was already recorded. */
    public FlowException atStep(String id) {
        if (this.stepId == null) {
            this.stepId = id;
        }
        return this;
    }

    /** The exception itself when it is a {@code FlowException}, otherwise a {@code TASK_FAILED} wrapper. */
    public static FlowException wrap(RuntimeException e) {
        if (e instanceof FlowException flow) {
            return flow;
        }
        return new FlowException(ErrorKind.TASK_FAILED, "Unexpected error: " + e, e);
    }

    public FlowError toFlowError() {
        return new FlowError(kind, getMessage(), stepId);
    }
}
