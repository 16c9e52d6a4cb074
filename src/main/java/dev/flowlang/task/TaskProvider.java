package dev.flowlang.task;

/**
 * Service-provider hook used by the CLI to discover tasks via {@link java.util.ServiceLoader}.
 */
public interface TaskProvider {

    void registerTasks(MapTaskRegistry registry);
}
