package dev.flowlang.testing;

import dev.flowlang.task.MapTaskRegistry;
import dev.flowlang.task.Task;
import dev.flowlang.task.TaskException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task registry for testing flows: canned results, scripted failures, and a history of every
 * call the engine made.
 *
 * <pre>{@code
 * var tasks = new MockTaskRegistry()
 *     .mockTask("Greet", Map.of("message", "Hello"))
 *     .mockSequence("Flaky", new TaskException("boom"), Map.of("ok", true));
 * }</pre>
 */
public class MockTaskRegistry extends MapTaskRegistry {

    /** One recorded invocation. */
    public record Call(String taskName, Map<String, Object> inputs, String connection) {}

    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());

    /** Task always returns {@code result}. */
    public MockTaskRegistry mockTask(String name, Map<String, Object> result) {
        return mockTask(name, (inputs, context) -> result);
    }

    /** Task runs {@code behaviour}, which may compute a result from its inputs or throw. */
    public MockTaskRegistry mockTask(String name, Task behaviour) {
        register(name, behaviour);
        return this;
    }

    /** Task always fails with {@code error}. */
    public MockTaskRegistry mockFailure(String name, Exception error) {
        return mockTask(name, (inputs, context) -> {
            throw error;
        });
    }

    /**
     * Task answers each call with the next response: a {@code Map} is returned, an
     * {@code Exception} is thrown. The last response repeats once the script runs out.
     */
    public MockTaskRegistry mockSequence(String name, Object... responses) {
        if (responses.length == 0) {
            throw new IllegalArgumentException("mockSequence needs at least one response");
        }
        var script = List.of(responses);
        var position = new int[1];
        return mockTask(name, (inputs, context) -> {
            Object response;
            synchronized (position) {
                response = script.get(Math.min(position[0]++, script.size() - 1));
            }
            if (response instanceof Exception e) {
                throw e;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> result = (Map<String, Object>) response;
            return result;
        });
    }

    @Override
    public Map<String, Object> invoke(String name, Map<String, Object> inputs, String connection) throws TaskException {
        calls.add(new Call(name, Collections.unmodifiableMap(new LinkedHashMap<>(inputs)), connection));
        return super.invoke(name, inputs, connection);
    }

    /** Every recorded call, in invocation order. */
    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    /** Recorded calls of one task, in invocation order. */
    public List<Call> calls(String name) {
        return calls().stream().filter(c -> c.taskName().equals(name)).toList();
    }

    public int callCount(String name) {
        return calls(name).size();
    }

    public boolean wasCalled(String name) {
        return callCount(name) > 0;
    }

    /** Inputs of the most recent call of {@code name}. */
    public Map<String, Object> lastInputs(String name) {
        List<Call> history = calls(name);
        if (history.isEmpty()) {
            throw new AssertionError("Task '" + name + "' was never called");
        }
        return history.get(history.size() - 1).inputs();
    }

    public void clearCalls() {
        calls.clear();
    }
}
