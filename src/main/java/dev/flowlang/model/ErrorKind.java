package dev.flowlang.model;

/**
 * Error taxonomy reported in execution results and {@code step_failed} events.
 */
public enum ErrorKind {
    VALIDATION(true),
    UNDEFINED_REFERENCE(false),
    TYPE_MISMATCH(false),
    TASK_NOT_FOUND(false),
    TASK_FAILED(false),
    CIRCULAR_DEPENDENCY(true),
    REQUIRED_INPUT_MISSING(true),
    CANCELLED(true);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    /** Fatal errors are never retried and bypass {@code on_error} handlers. */
    public boolean fatal() {
        return fatal;
    }
}
