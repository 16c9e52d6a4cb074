package dev.flowlang.task;

import java.util.Map;

/**
 * A unit of work registered under a name and invoked by task steps.
 * Throw {@link TaskException#nonRetryable} to skip the step's retry policy; any other exception
 * is retried.
 */
@FunctionalInterface
public interface Task {

    Map<String, Object> execute(Map<String, Object> inputs, TaskContext context) throws Exception;
}
