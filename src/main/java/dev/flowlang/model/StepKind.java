package dev.flowlang.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The closed set of step kinds. Exactly one of seven forms: task, conditional, switch, loop,
 * parallel, subflow or exit. Dispatch goes through {@link Visitor}, so adding a kind is a
 * compile-time change for every walker.
 */
public sealed interface StepKind {

    <R> R accept(Visitor<R> visitor);

    String kindName();

    interface Visitor<R> {
        R visitTask(Task task);

        R visitConditional(Conditional conditional);

        R visitSwitch(Switch switchKind);

        R visitLoop(Loop loop);

        R visitParallel(Parallel parallel);

        R visitSubflow(Subflow subflow);

        R visitExit(Exit exit);
    }

    /** Invoke a registered task by name, optionally with a named connection. */
    record Task(String taskName, String connection) implements StepKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTask(this);
        }

        @Override
        public String kindName() {
            return "task";
        }
    }

    /** Run exactly one of {@code then} / {@code else}. */
    record Conditional(Condition condition, List<Step> thenSteps, List<Step> elseSteps) implements StepKind {
        public Conditional {
            thenSteps = thenSteps == null ? List.of() : List.copyOf(thenSteps);
            elseSteps = elseSteps == null ? List.of() : List.copyOf(elseSteps);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConditional(this);
        }

        @Override
        public String kindName() {
            return "conditional";
        }
    }

    /** First case whose {@code when} equals the discriminant wins; otherwise {@code default}. */
    record Switch(Object discriminant, List<SwitchCase> cases, List<Step> defaultSteps) implements StepKind {
        public Switch {
            cases = cases == null ? List.of() : List.copyOf(cases);
            defaultSteps = defaultSteps == null ? List.of() : List.copyOf(defaultSteps);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitch(this);
        }

        @Override
        public String kindName() {
            return "switch";
        }
    }

    /** Iterate a collection strictly in order, binding each item under {@code binding}. */
    record Loop(Object collection, String binding, List<Step> body, CollectMode collect) implements StepKind {
        public static final String DEFAULT_BINDING = "item";

        public Loop {
            body = body == null ? List.of() : List.copyOf(body);
            binding = binding == null || binding.isBlank() ? DEFAULT_BINDING : binding;
            collect = collect == null ? CollectMode.LIST : collect;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLoop(this);
        }

        @Override
        public String kindName() {
            return "loop";
        }
    }

    /** Run every branch concurrently and join. */
    record Parallel(List<List<Step>> branches) implements StepKind {
        public Parallel {
            branches = branches == null ? List.of() : branches.stream().map(List::copyOf).toList();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParallel(this);
        }

        @Override
        public String kindName() {
            return "parallel";
        }
    }

    /** Call another flow with an isolated scope. */
    record Subflow(String reference, boolean propagateExit) implements StepKind {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubflow(this);
        }

        @Override
        public String kindName() {
            return "subflow";
        }
    }

    /** Terminate the enclosing flow invocation. */
    record Exit(String reason, Map<String, Object> outputs) implements StepKind {
        public static final String DEFAULT_REASON = "Flow terminated by exit step";

        public Exit {
            reason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
            outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExit(this);
        }

        @Override
        public String kindName() {
            return "exit";
        }
    }

    /** How a loop publishes declared outputs across iterations. */
    enum CollectMode {
        /** Each declared output becomes a list with one entry per iteration. */
        LIST,
        /** Each declared output holds the last iteration's value. */
        LAST
    }
}
