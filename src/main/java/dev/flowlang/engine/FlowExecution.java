package dev.flowlang.engine;

import dev.flowlang.event.EventEmitter;
import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.ExecutionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a flow started with {@link FlowExecutor#start}. Events can be subscribed to at any
 * time; past events are replayed first.
 */
public final class FlowExecution {

    /** Lifecycle of an execution as seen from its handle. */
    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final String executionId;
    private final EventEmitter events;
    private final CancellationToken cancellation;
    private final CompletableFuture<ExecutionResult> result;

    FlowExecution(String executionId, EventEmitter events, CancellationToken cancellation,
                  CompletableFuture<ExecutionResult> result) {
        this.executionId = executionId;
        this.events = events;
        this.cancellation = cancellation;
        this.result = result;
    }

    public String executionId() {
        return executionId;
    }

    /** Append-and-subscribe event stream of this execution. */
    public EventEmitter events() {
        return events;
    }

    /**
     * Request cancellation. No new steps are dispatched, running parallel branches are
     * interrupted, and the flow's {@code on_cancel} steps run once.
     *
     * @return false when the execution already finished or was already cancelled
     */
    public boolean cancel(String reason) {
        if (result.isDone()) {
            return false;
        }
        return cancellation.cancel(reason);
    }

    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    /** Blocks until the execution finishes. */
    public ExecutionResult await() {
        return result.join();
    }

    public Status status() {
        if (!result.isDone()) {
            return Status.RUNNING;
        }
        ExecutionResult r = result.join();
        if (r.success()) {
            return Status.COMPLETED;
        }
        return r.error() != null && r.error().kind() == ErrorKind.CANCELLED ? Status.CANCELLED : Status.FAILED;
    }
}
