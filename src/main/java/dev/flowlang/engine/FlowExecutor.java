package dev.flowlang.engine;

import dev.flowlang.error.CancelledException;
import dev.flowlang.error.FlowException;
import dev.flowlang.error.ValidationException;
import dev.flowlang.event.EventEmitter;
import dev.flowlang.event.EventType;
import dev.flowlang.expr.ExpressionResolver;
import dev.flowlang.expr.Scope;
import dev.flowlang.model.EngineOptions;
import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.ExecutionResult;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.model.InputSpec;
import dev.flowlang.subflow.FileSystemSubflowResolver;
import dev.flowlang.subflow.SubflowLoader;
import dev.flowlang.subflow.SubflowResolver;
import dev.flowlang.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running flows. One executor can run many flows concurrently; each invocation
 * gets its own {@link ExecutionContext}, event log and subflow cache. Parallel branches and
 * flows started with {@link #start} run on a pool of daemon worker threads owned by the executor.
 */
public final class FlowExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FlowExecutor.class);

    private final TaskRegistry registry;
    private final SubflowResolver subflows;
    private final EngineOptions options;
    private final ExpressionResolver resolver = new ExpressionResolver();
    private final ExecutorService workers;

    public FlowExecutor(TaskRegistry registry) {
        this(registry, EngineOptions.defaults());
    }

    public FlowExecutor(TaskRegistry registry, EngineOptions options) {
        this(registry, new FileSystemSubflowResolver(options), options);
    }

    public FlowExecutor(TaskRegistry registry, SubflowResolver subflows, EngineOptions options) {
        this.registry = registry;
        this.subflows = subflows;
        this.options = options;
        this.workers = Executors.newCachedThreadPool(daemonThreads());
    }

    /**
     * Run a flow to completion on the calling thread.
     */
    public ExecutionResult execute(FlowDocument flow, Map<String, Object> inputs) {
        var events = new EventEmitter(UUID.randomUUID().toString());
        return run(flow, inputs, events, new CancellationToken());
    }

    /**
     * Load a flow file and run it to completion on the calling thread.
     */
    public ExecutionResult execute(Path path, Map<String, Object> inputs) throws IOException {
        return execute(FlowLoader.loadFromFile(path), inputs);
    }

    /**
     * Start a flow on a worker thread. The returned handle streams events and accepts
     * cancellation.
     */
    public FlowExecution start(FlowDocument flow, Map<String, Object> inputs) {
        var events = new EventEmitter(UUID.randomUUID().toString());
        var token = new CancellationToken();
        var result = new CompletableFuture<ExecutionResult>();
        workers.execute(() -> {
            Thread runner = Thread.currentThread();
            try (CancellationToken.Registration registration = token.onCancel(runner::interrupt)) {
                result.complete(run(flow, inputs, events, token));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                // the cancellation interrupt must not leak into the next task on this worker
                Thread.interrupted();
            }
        });
        return new FlowExecution(events.executionId(), events, token, result);
    }

    private ExecutionResult run(FlowDocument flow, Map<String, Object> inputs, EventEmitter events,
                                CancellationToken token) {
        long started = System.currentTimeMillis();

        List<String> errors = FlowValidator.validate(flow);
        if (!errors.isEmpty()) {
            var error = new ValidationException(flow.name(), errors);
            log.warn("Flow '{}' rejected: {}", flow.name(), error.getMessage());
            return ExecutionResult.failed(error.toFlowError(), System.currentTimeMillis() - started);
        }

        var subflowLoader = new SubflowLoader(subflows, options.maxSubflowDepth());
        var ctx = ExecutionContext.create(flow, events, token, resolver, registry, subflowLoader, workers);
        var scheduler = new StepScheduler(ctx);

        Scope scope;
        try {
            scope = scheduler.bindInputs(inputs);
        } catch (FlowException e) {
            log.warn("Flow '{}' not started: {}", flow.name(), e.getMessage());
            return ExecutionResult.failed(e.toFlowError(), System.currentTimeMillis() - started);
        }

        log.info("Flow '{}' started (execution {})", flow.name(), ctx.executionId());
        ctx.emit(EventType.FLOW_STARTED, null, Map.of("inputs", flow.inputs().stream().map(InputSpec::name).toList()));

        try {
            ExitSignal exit = scheduler.runSteps(flow.steps(), scope);
            Map<String, Object> outputs = exit != null ? exit.outputs() : scheduler.resolveOutputs(scope);
            long elapsed = System.currentTimeMillis() - started;

            var payload = new LinkedHashMap<String, Object>();
            payload.put("duration_ms", elapsed);
            payload.put("outputs", List.copyOf(outputs.keySet()));
            payload.put("steps", ctx.stepCount());
            if (exit != null) {
                payload.put("exit_reason", exit.reason());
            }
            ctx.emit(EventType.FLOW_COMPLETED, null, payload);
            log.info("Flow '{}' completed in {} ms", flow.name(), elapsed);
            return exit != null
                ? ExecutionResult.exited(outputs, exit.reason(), elapsed)
                : ExecutionResult.completed(outputs, elapsed);
        } catch (RuntimeException e) {
            FlowException error = FlowException.wrap(e);
            if (token.isCancelled()) {
                if (error.kind() != ErrorKind.CANCELLED) {
                    error = new CancelledException(token.reason()).atStep(error.stepId());
                }
                runOnCancel(ctx, scope);
            }
            long elapsed = System.currentTimeMillis() - started;
            var payload = new LinkedHashMap<String, Object>();
            payload.put("duration_ms", elapsed);
            payload.put("error_kind", error.kind().name());
            payload.put("error_message", error.getMessage());
            payload.put("step", error.stepId());
            ctx.emit(EventType.FLOW_FAILED, null, payload);
            log.info("Flow '{}' failed at step '{}': {}", flow.name(), error.stepId(), error.getMessage());
            return ExecutionResult.failed(error.toFlowError(), elapsed);
        }
    }

    /** Runs the flow's on_cancel steps once, with a fresh token so they are not cancelled themselves. */
    private void runOnCancel(ExecutionContext ctx, Scope scope) {
        if (ctx.flow().onCancel().isEmpty()) {
            return;
        }
        // the runner may still carry the cancellation interrupt
        Thread.interrupted();
        log.info("Running on_cancel steps of flow '{}'", ctx.flow().name());
        try {
            new StepScheduler(ctx.withCancellation(new CancellationToken()))
                .runSteps(ctx.flow().onCancel(), scope.child());
        } catch (FlowException e) {
            log.warn("on_cancel of flow '{}' failed: {}", ctx.flow().name(), e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "flowlang-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
