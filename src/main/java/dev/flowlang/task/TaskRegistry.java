package dev.flowlang.task;

import java.util.Map;

/**
 * Capability contract the scheduler calls into. The engine never inspects task internals; it
 * only invokes tasks by name and passes connection names through.
 */
public interface TaskRegistry {

    /**
     * Invoke a task.
     *
     * @param name       registered task name
     * @param inputs     resolved inputs
     * @param connection connection name from the step, or null
     * @return the task's outputs
     * @throws dev.flowlang.error.TaskNotFoundException when no implemented task has this name
     * @throws TaskException when the task itself fails
     */
    Map<String, Object> invoke(String name, Map<String, Object> inputs, String connection) throws TaskException;

    /** Whether a task is registered under this name (implemented or not). */
    boolean contains(String name);
}
