package dev.flowlang.task;

import dev.flowlang.error.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskRegistry} backed by a registration map. Stubs can be registered for tasks that are
 * declared but not implemented yet; invoking one fails with {@link TaskNotFoundException}.
 */
public class MapTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapTaskRegistry.class);

    private final Map<String, Registration> tasks = new ConcurrentHashMap<>();
    private final ConnectionResolver connections;

    public MapTaskRegistry() {
        this(ConnectionResolver.NONE);
    }

    public MapTaskRegistry(ConnectionResolver connections) {
        this.connections = connections;
    }

    public MapTaskRegistry register(String name, Task task) {
        return register(name, null, task);
    }

    public MapTaskRegistry register(String name, String description, Task task) {
        tasks.put(name, new Registration(task, description, true));
        return this;
    }

    public MapTaskRegistry registerStub(String name, String description) {
        tasks.put(name, new Registration(null, description, false));
        return this;
    }

    @Override
    public boolean contains(String name) {
        return tasks.containsKey(name);
    }

    public boolean isImplemented(String name) {
        Registration registration = tasks.get(name);
        return registration != null && registration.implemented();
    }

    public Set<String> taskNames() {
        return new TreeSet<>(tasks.keySet());
    }

    public String description(String name) {
        Registration registration = tasks.get(name);
        return registration != null ? registration.description() : null;
    }

    public ImplementationStatus implementationStatus() {
        var unimplemented = new ArrayList<String>();
        for (String name : taskNames()) {
            if (!tasks.get(name).implemented()) {
                unimplemented.add(name);
            }
        }
        return new ImplementationStatus(tasks.size(), tasks.size() - unimplemented.size(), unimplemented);
    }

    @Override
    public Map<String, Object> invoke(String name, Map<String, Object> inputs, String connection) throws TaskException {
        Registration registration = tasks.get(name);
        if (registration == null) {
            throw new TaskNotFoundException(name);
        }
        if (!registration.implemented()) {
            throw TaskNotFoundException.notImplemented(name);
        }
        Object handle = null;
        if (connection != null) {
            handle = connections.resolve(connection).orElseThrow(
                () -> TaskException.nonRetryable("Connection '%s' is not available".formatted(connection)));
        }
        try {
            Map<String, Object> result = registration.task().execute(inputs, new TaskContext(name, connection, handle));
            return result != null ? result : Map.of();
        } catch (TaskException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TaskException.nonRetryable("Task '%s' was interrupted".formatted(name), e);
        } catch (Exception e) {
            log.debug("Task {} raised {}", name, e.toString());
            throw new TaskException(e.getMessage() != null ? e.getMessage() : e.toString(), e, true);
        }
    }

    private record Registration(Task task, String description, boolean implemented) {}

    /** Counts of implemented and stubbed tasks. */
    public record ImplementationStatus(int total, int implemented, List<String> unimplementedTasks) {

        public String progress() {
            return implemented + "/" + total;
        }
    }
}
