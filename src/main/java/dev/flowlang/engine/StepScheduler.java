package dev.flowlang.engine;

import dev.flowlang.error.CancelledException;
import dev.flowlang.error.FlowException;
import dev.flowlang.error.RequiredInputMissingException;
import dev.flowlang.error.TaskFailedException;
import dev.flowlang.error.TypeMismatchException;
import dev.flowlang.error.UndefinedReferenceException;
import dev.flowlang.event.EventType;
import dev.flowlang.expr.Scope;
import dev.flowlang.expr.Values;
import dev.flowlang.model.*;
import dev.flowlang.task.TaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Walks a flow's step tree. Sibling steps run in declaration order; each step kind is handled by
 * one visitor method. Step outputs are published into the {@link Scope} of the list the step
 * belongs to, and the ids of nested steps become visible to later siblings once the enclosing
 * compound step completes.
 *
 * <p>An exit step yields an {@link ExitSignal} that every enclosing list returns immediately, up to
 * the flow or subflow boundary. Failures are {@link FlowException}s: the failing step and every
 * failing ancestor emit {@code step_failed}, and the nearest step with {@code on_error} handles it
 * unless its kind is fatal.
 */
public final class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    static final String INPUTS_BINDING = "inputs";
    static final String LOOP_BINDING = "loop";
    static final String ERROR_BINDING = "error";

    private final ExecutionContext ctx;

    public StepScheduler(ExecutionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Run a step list in order.
     *
     * @return the exit signal raised inside the list, or null when the list ran to the end
     */
    public ExitSignal runSteps(List<Step> steps, Scope scope) {
        for (Step step : steps) {
            ExitSignal exit = runStep(step, scope);
            if (exit != null) {
                return exit;
            }
        }
        return null;
    }

    /**
     * Root scope of the current flow, with {@code inputs} bound from the caller's values, declared
     * defaults, or null for optional inputs with no default.
     *
     * @throws RequiredInputMissingException when a required input has no value and no default
     * @throws TypeMismatchException when a supplied value does not match the declared type
     */
    public Scope bindInputs(Map<String, Object> supplied) {
        FlowDocument flow = ctx.flow();
        Map<String, Object> values = supplied == null ? Map.of() : supplied;
        var bound = new LinkedHashMap<String, Object>(values);
        for (InputSpec input : flow.inputs()) {
            if (values.containsKey(input.name())) {
                Object value = values.get(input.name());
                if (!input.type().matches(value)) {
                    throw new TypeMismatchException("Input '%s' of flow '%s' must be %s, got %s"
                        .formatted(input.name(), flow.name(), input.type().typeName(), Values.typeName(value)));
                }
            } else if (input.hasDefault()) {
                bound.put(input.name(), input.defaultValue());
            } else if (input.required()) {
                throw new RequiredInputMissingException(flow.name(), input.name());
            } else {
                bound.put(input.name(), null);
            }
        }
        Scope scope = Scope.root();
        scope.put(INPUTS_BINDING, Collections.unmodifiableMap(bound));
        return scope;
    }

    /** Resolves the current flow's declared outputs, in declaration order. */
    public Map<String, Object> resolveOutputs(Scope scope) {
        var outputs = new LinkedHashMap<String, Object>();
        for (OutputSpec output : ctx.flow().outputs()) {
            outputs.put(output.name(), ctx.resolver().resolve(output.value(), scope));
        }
        return outputs;
    }

    private ExitSignal runStep(Step step, Scope scope) {
        ctx.checkCancelled();
        ctx.recordStep();
        log.debug("Dispatching {} step '{}' of flow '{}'", step.kindName(), step.id(), ctx.flow().name());
        ctx.emit(EventType.STEP_STARTED, step.id(), Map.of("kind", step.kindName()));
        long started = System.nanoTime();

        StepResult result;
        try {
            result = step.kind().accept(new Dispatch(step, scope));
        } catch (RuntimeException e) {
            if (!(e instanceof FlowException)) {
                log.error("Step '{}' of flow '{}' raised an unexpected error", step.id(), ctx.flow().name(), e);
            }
            FlowException error = cancellationOr(FlowException.wrap(e)).atStep(step.id());
            boolean handled = !step.onError().isEmpty() && !error.kind().fatal();
            var payload = new LinkedHashMap<String, Object>();
            payload.put("duration_ms", elapsedMillis(started));
            payload.put("error_kind", error.kind().name());
            payload.put("error_message", error.getMessage());
            payload.put("handled", handled);
            ctx.emit(EventType.STEP_FAILED, step.id(), payload);
            if (!handled) {
                throw error;
            }
            log.warn("Step '{}' failed with {}, running on_error: {}", step.id(), error.kind(), error.getMessage());
            return handleError(step, scope, error);
        }

        if (result.published() != null && !step.hasGeneratedId()) {
            scope.put(step.id(), result.published());
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("duration_ms", elapsedMillis(started));
        payload.put("outputs", result.published() != null ? List.copyOf(result.published().keySet()) : List.of());
        payload.putAll(result.details());
        if (result.exit() != null) {
            payload.put("exit_reason", result.exit().reason());
        }
        ctx.emit(EventType.STEP_COMPLETED, step.id(), payload);
        return result.exit();
    }

    /** Once cancellation was requested, any failure is reported as the cancellation. */
    private FlowException cancellationOr(FlowException error) {
        CancellationToken token = ctx.cancellation();
        if (token.isCancelled() && error.kind() != ErrorKind.CANCELLED) {
            log.debug("Reporting {} as cancellation: {}", error.kind(), error.getMessage());
            return new CancelledException(token.reason());
        }
        return error;
    }

    private ExitSignal handleError(Step step, Scope scope, FlowException error) {
        Scope handlerScope = scope.child();
        var binding = new LinkedHashMap<String, Object>();
        binding.put("kind", error.kind().name());
        binding.put("message", error.getMessage());
        binding.put("step", error.stepId());
        handlerScope.put(ERROR_BINDING, Collections.unmodifiableMap(binding));

        ExitSignal exit = runSteps(step.onError(), handlerScope);

        Map<String, Object> locals = handlerScope.locals();
        locals.remove(ERROR_BINDING);
        promote(locals, scope);
        // handler outputs stand in for the failed step's declared outputs
        if (!step.outputs().isEmpty() && !step.hasGeneratedId()) {
            scope.put(step.id(), collect(step.outputs(), locals.values()));
        }
        return exit;
    }

    private Map<String, Object> resolveInputs(Step step, Scope scope) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : step.inputs().entrySet()) {
            try {
                resolved.put(entry.getKey(), ctx.resolver().resolve(entry.getValue(), scope));
            } catch (UndefinedReferenceException e) {
                if (!step.optionalInputs().contains(entry.getKey())) {
                    throw e;
                }
                log.debug("Optional input '{}' of step '{}' is undefined: {}", entry.getKey(), step.id(), e.getMessage());
                resolved.put(entry.getKey(), null);
            }
        }
        return resolved;
    }

    private boolean evaluate(Condition condition, Scope scope) {
        if (condition instanceof Condition.Expression expression) {
            return ctx.resolver().evaluateCondition(expression.expression(), scope);
        }
        if (condition instanceof Condition.All all) {
            return all.conditions().stream().allMatch(c -> evaluate(c, scope));
        }
        if (condition instanceof Condition.Any any) {
            return any.conditions().stream().anyMatch(c -> evaluate(c, scope));
        }
        return ((Condition.None) condition).conditions().stream().noneMatch(c -> evaluate(c, scope));
    }

    /** Runs a nested list in a child scope, then makes its bindings visible to later siblings. */
    private StepResult runNested(Step step, List<Step> steps, Scope scope, Map<String, Object> details) {
        Scope child = scope.child();
        ExitSignal exit = runSteps(steps, child);
        Map<String, Object> locals = child.locals();
        promote(locals, scope);
        return new StepResult(declared(step, locals.values()), exit, details);
    }

    private static void promote(Map<String, Object> bindings, Scope target) {
        bindings.forEach(target::put);
    }

    private static Map<String, Object> declared(Step step, Collection<Object> published) {
        return step.outputs().isEmpty() ? null : collect(step.outputs(), published);
    }

    /**
     * Picks the declared names out of the output maps published by nested steps. Later
     * publications win; names nobody published are null.
     */
    private static Map<String, Object> collect(List<String> names, Collection<Object> published) {
        var result = new LinkedHashMap<String, Object>();
        names.forEach(name -> result.put(name, null));
        for (Object value : published) {
            if (value instanceof Map<?, ?> map) {
                for (String name : names) {
                    if (map.containsKey(name)) {
                        result.put(name, map.get(name));
                    }
                }
            }
        }
        return result;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    /** What a step handed back to its list. */
    private record StepResult(Map<String, Object> published, ExitSignal exit, Map<String, Object> details) {}

    private final class Dispatch implements StepKind.Visitor<StepResult> {

        private final Step step;
        private final Scope scope;

        Dispatch(Step step, Scope scope) {
            this.step = step;
            this.scope = scope;
        }

        @Override
        public StepResult visitTask(StepKind.Task task) {
            Map<String, Object> inputs = resolveInputs(step, scope);
            String connection = task.connection() == null
                ? null : Values.stringify(ctx.resolver().resolve(task.connection(), scope));
            RetryPolicy retry = step.retryOrDefault();

            Map<String, Object> result;
            int attempt = 0;
            while (true) {
                attempt++;
                if (attempt > 1) {
                    ctx.cancellation().sleep(retry.delayBefore(attempt));
                }
                try {
                    result = invoke(task.taskName(), inputs, connection);
                    break;
                } catch (TaskException e) {
                    ctx.checkCancelled();
                    if (!e.retryable() || attempt >= retry.maxAttempts()) {
                        throw new TaskFailedException(task.taskName(), attempt, e);
                    }
                    log.warn("Task '{}' failed on attempt {}/{}, retrying: {}",
                        task.taskName(), attempt, retry.maxAttempts(), e.getMessage());
                }
            }

            Map<String, Object> published;
            if (step.outputs().isEmpty()) {
                published = result == null ? new LinkedHashMap<>() : new LinkedHashMap<>(result);
            } else {
                published = new LinkedHashMap<>();
                for (String name : step.outputs()) {
                    if (result == null || !result.containsKey(name)) {
                        throw new UndefinedReferenceException(step.id() + "." + name,
                            "Task '%s' did not return declared output '%s'".formatted(task.taskName(), name));
                    }
                    published.put(name, result.get(name));
                }
            }
            return new StepResult(published, null, Map.of("attempts", attempt));
        }

        private Map<String, Object> invoke(String name, Map<String, Object> inputs, String connection) throws TaskException {
            try {
                return ctx.registry().invoke(name, inputs, connection);
            } catch (FlowException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new TaskException(e.getMessage() != null ? e.getMessage() : e.toString(), e, true);
            }
        }

        @Override
        public StepResult visitConditional(StepKind.Conditional conditional) {
            boolean taken = evaluate(conditional.condition(), scope);
            List<Step> branch = taken ? conditional.thenSteps() : conditional.elseSteps();
            return runNested(step, branch, scope, Map.of("branch", taken ? "then" : "else"));
        }

        @Override
        public StepResult visitSwitch(StepKind.Switch switchKind) {
            Object value = ctx.resolver().resolve(switchKind.discriminant(), scope);
            for (int i = 0; i < switchKind.cases().size(); i++) {
                SwitchCase c = switchKind.cases().get(i);
                for (Object candidate : c.when()) {
                    if (Values.equal(value, ctx.resolver().resolve(candidate, scope))) {
                        return runNested(step, c.steps(), scope, Map.of("case", i));
                    }
                }
            }
            return runNested(step, switchKind.defaultSteps(), scope, Map.of("case", "default"));
        }

        @Override
        public StepResult visitLoop(StepKind.Loop loop) {
            Object collection = ctx.resolver().resolve(loop.collection(), scope);
            if (!(collection instanceof Collection<?> items)) {
                throw new TypeMismatchException("for_each expects a list, got " + Values.typeName(collection));
            }

            var lists = new LinkedHashMap<String, List<Object>>();
            var last = new LinkedHashMap<String, Object>();
            for (String name : step.outputs()) {
                lists.put(name, new ArrayList<>());
                last.put(name, null);
            }

            Map<String, Object> lastLocals = Map.of();
            int index = 0;
            for (Object item : items) {
                ctx.checkCancelled();
                Scope iteration = scope.child();
                var loopInfo = new LinkedHashMap<String, Object>();
                loopInfo.put("index", (long) index);
                loopInfo.put("item", item);
                iteration.put(LOOP_BINDING, Collections.unmodifiableMap(loopInfo));
                iteration.put(loop.binding(), item);

                ExitSignal exit = runSteps(loop.body(), iteration);

                Map<String, Object> locals = iteration.locals();
                locals.remove(LOOP_BINDING);
                locals.remove(loop.binding());
                lastLocals = locals;
                if (!step.outputs().isEmpty()) {
                    collect(step.outputs(), locals.values()).forEach((name, value) -> {
                        lists.get(name).add(value);
                        last.put(name, value);
                    });
                }
                index++;
                if (exit != null) {
                    return new StepResult(null, exit, Map.of("iterations", index));
                }
            }

            promote(lastLocals, scope);
            Map<String, Object> published = null;
            if (!step.outputs().isEmpty()) {
                published = loop.collect() == StepKind.CollectMode.LAST ? last : new LinkedHashMap<>(lists);
            }
            return new StepResult(published, null, Map.of("iterations", index));
        }

        @Override
        public StepResult visitParallel(StepKind.Parallel parallel) {
            List<List<Step>> branches = parallel.branches();
            var completions = new ConcurrentHashMap<String, CompletableFuture<Void>>();
            for (List<Step> branch : branches) {
                for (Step s : branch) {
                    completions.putIfAbsent(s.id(), new CompletableFuture<>());
                }
            }
            var failure = new AtomicReference<FlowException>();
            var exit = new AtomicReference<ExitSignal>();
            var running = new HashSet<Thread>();
            var scopes = new ArrayList<Scope>();
            var finished = new ArrayList<CompletableFuture<Void>>();

            try (CancellationToken.Registration registration = ctx.cancellation().onCancel(() -> interruptAll(running))) {
                for (List<Step> branch : branches) {
                    Scope branchScope = scope.child();
                    scopes.add(branchScope);
                    var done = new CompletableFuture<Void>();
                    finished.add(done);
                    ctx.workers().execute(() ->
                        runBranch(branch, branchScope, completions, failure, exit, running, done));
                }
                CompletableFuture.allOf(finished.toArray(new CompletableFuture[0])).join();
            }

            FlowException error = failure.get();
            if (error != null) {
                throw error;
            }
            var details = Map.<String, Object>of("branches", branches.size());
            if (exit.get() != null) {
                return new StepResult(null, exit.get(), details);
            }

            var merged = new LinkedHashMap<String, Object>();
            for (Scope branchScope : scopes) {
                merged.putAll(branchScope.locals());
                scope.mergeFrom(branchScope);
            }
            return new StepResult(declared(step, merged.values()), null, details);
        }

        private void runBranch(List<Step> branch, Scope branchScope,
                               Map<String, CompletableFuture<Void>> completions,
                               AtomicReference<FlowException> failure, AtomicReference<ExitSignal> exit,
                               Set<Thread> running, CompletableFuture<Void> done) {
            Thread current = Thread.currentThread();
            synchronized (running) {
                running.add(current);
            }
            int next = 0;
            try {
                for (; next < branch.size(); next++) {
                    Step s = branch.get(next);
                    if (exit.get() != null || !awaitDependencies(s, completions)) {
                        return;
                    }
                    ExitSignal signal = runStep(s, branchScope);
                    completions.get(s.id()).complete(null);
                    if (signal != null) {
                        exit.compareAndSet(null, signal);
                        return;
                    }
                }
            } catch (RuntimeException e) {
                failure.compareAndSet(null, FlowException.wrap(e));
            } finally {
                for (int i = next; i < branch.size(); i++) {
                    String id = branch.get(i).id();
                    completions.get(id).completeExceptionally(new IllegalStateException("Step '" + id + "' did not complete"));
                }
                synchronized (running) {
                    running.remove(current);
                }
                // clear an interrupt aimed at this branch before the worker is reused
                Thread.interrupted();
                done.complete(null);
            }
        }

        /** Waits for cross-branch dependencies. Returns false when one of them did not complete. */
        private boolean awaitDependencies(Step s, Map<String, CompletableFuture<Void>> completions) {
            for (String dep : s.dependsOn()) {
                CompletableFuture<Void> completion = completions.get(dep);
                if (completion == null) {
                    continue;
                }
                try {
                    completion.get();
                } catch (ExecutionException e) {
                    log.debug("Step '{}' skipped: dependency '{}' did not complete", s.id(), dep);
                    return false;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    ctx.checkCancelled();
                    throw new CancelledException("Interrupted while step '%s' waited for '%s'".formatted(s.id(), dep));
                }
            }
            return true;
        }

        private void interruptAll(Set<Thread> running) {
            synchronized (running) {
                running.forEach(Thread::interrupt);
            }
        }

        @Override
        public StepResult visitSubflow(StepKind.Subflow subflow) {
            Map<String, Object> inputs = resolveInputs(step, scope);
            ExecutionContext child = ctx.enterSubflow(subflow.reference());
            var scheduler = new StepScheduler(child);
            Scope subScope = scheduler.bindInputs(inputs);

            log.debug("Entering subflow '{}' from step '{}'", child.flow().name(), step.id());
            ExitSignal exit = scheduler.runSteps(child.flow().steps(), subScope);
            Map<String, Object> outputs = exit != null ? exit.outputs() : scheduler.resolveOutputs(subScope);

            Map<String, Object> published;
            if (step.outputs().isEmpty()) {
                published = new LinkedHashMap<>(outputs);
            } else {
                published = new LinkedHashMap<>();
                for (String name : step.outputs()) {
                    if (!outputs.containsKey(name)) {
                        throw new UndefinedReferenceException(step.id() + "." + name,
                            "Subflow '%s' has no output '%s'".formatted(child.flow().name(), name));
                    }
                    published.put(name, outputs.get(name));
                }
            }

            var details = new LinkedHashMap<String, Object>();
            details.put("subflow", child.flow().name());
            if (exit != null) {
                details.put("subflow_exit_reason", exit.reason());
            }
            return new StepResult(published, exit != null && subflow.propagateExit() ? exit : null, details);
        }

        @Override
        public StepResult visitExit(StepKind.Exit exitKind) {
            var outputs = new LinkedHashMap<String, Object>();
            for (var entry : exitKind.outputs().entrySet()) {
                outputs.put(entry.getKey(), ctx.resolver().resolve(entry.getValue(), scope));
            }
            String reason = Values.stringify(ctx.resolver().resolve(exitKind.reason(), scope));
            log.info("Exit step '{}' terminating flow '{}': {}", step.id(), ctx.flow().name(), reason);
            return new StepResult(null, new ExitSignal(reason, outputs), Map.of());
        }
    }
}
