package dev.flowlang.engine;

import dev.flowlang.event.EventEmitter;
import dev.flowlang.event.EventType;
import dev.flowlang.expr.ExpressionResolver;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.subflow.FlowSource;
import dev.flowlang.subflow.LoadedFlow;
import dev.flowlang.subflow.SubflowLoader;
import dev.flowlang.task.TaskRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State for one top-level flow invocation, shared by reference through the recursive walk. The
 * event log, cancellation token, subflow cache and worker pool are shared by every frame; the flow
 * being run and the subflow call chain belong to the frame.
 */
public final class ExecutionContext {

    private final String executionId;
    private final EventEmitter events;
    private final CancellationToken cancellation;
    private final ExpressionResolver resolver;
    private final TaskRegistry registry;
    private final SubflowLoader subflows;
    private final ExecutorService workers;
    private final AtomicInteger stepCount;

    private final FlowDocument flow;
    private final List<FlowSource> callChain;

    private ExecutionContext(String executionId, EventEmitter events, CancellationToken cancellation,
                             ExpressionResolver resolver, TaskRegistry registry, SubflowLoader subflows,
                             ExecutorService workers, AtomicInteger stepCount,
                             FlowDocument flow, List<FlowSource> callChain) {
        this.executionId = executionId;
        this.events = events;
        this.cancellation = cancellation;
        this.resolver = resolver;
        this.registry = registry;
        this.subflows = subflows;
        this.workers = workers;
        this.stepCount = stepCount;
        this.flow = flow;
        this.callChain = List.copyOf(callChain);
    }

    /**
     * Context for a top-level invocation of {@code flow}.
     */
    public static ExecutionContext create(FlowDocument flow, EventEmitter events, CancellationToken cancellation,
                                          ExpressionResolver resolver, TaskRegistry registry,
                                          SubflowLoader subflows, ExecutorService workers) {
        return new ExecutionContext(events.executionId(), events, cancellation, resolver, registry, subflows,
            workers, new AtomicInteger(), flow, List.of(FlowSource.of(flow)));
    }

    public String executionId() { return executionId; }
    public EventEmitter events() { return events; }
    public CancellationToken cancellation() { return cancellation; }
    public ExpressionResolver resolver() { return resolver; }
    public TaskRegistry registry() { return registry; }
    public ExecutorService workers() { return workers; }
    public FlowDocument flow() { return flow; }
    public List<FlowSource> callChain() { return callChain; }

    /** Steps dispatched so far across every frame of this invocation. */
    public int stepCount() {
        return stepCount.get();
    }

    /**
     * Frame for a subflow call. Resolution, cycle detection and validation happen here, before
     * anything of the subflow runs.
     */
    public ExecutionContext enterSubflow(String reference) {
        LoadedFlow loaded = subflows.load(reference, callChain);
        var chain = new ArrayList<>(callChain);
        chain.add(loaded.source());
        return new ExecutionContext(executionId, events, cancellation, resolver, registry, subflows, workers,
            stepCount, loaded.document(), chain);
    }

    /**
     * Same frame with a different token. Used to run {@code on_cancel} steps after the
     * execution's own token fired.
     */
    public ExecutionContext withCancellation(CancellationToken token) {
        return new ExecutionContext(executionId, events, token, resolver, registry, subflows, workers,
            stepCount, flow, callChain);
    }

    public void checkCancelled() {
        cancellation.checkCancelled();
    }

    void recordStep() {
        stepCount.incrementAndGet();
    }

    /** Emits an event attributed to the flow of this frame. */
    public void emit(EventType type, String stepId, Map<String, Object> payload) {
        events.emit(type, flow.name(), stepId, payload);
    }
}
