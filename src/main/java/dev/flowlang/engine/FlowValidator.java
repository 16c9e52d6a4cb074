package dev.flowlang.engine;

import dev.flowlang.expr.ExpressionResolver;
import dev.flowlang.model.*;
import dev.flowlang.task.TaskRegistry;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Validates flow documents before execution. Every problem is reported, each prefixed with its
 * location in the document ({@code steps[2].then[0]}).
 */
public final class FlowValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> RESERVED_NAMES = Set.of("inputs", "loop", "error");
    private static final ExpressionResolver SYNTAX = new ExpressionResolver();

    private FlowValidator() {}

    /**
     * Validate a flow document. Returns an empty list if valid, or a list of error messages if
     * invalid.
     */
    public static List<String> validate(FlowDocument flow) {
        return validate(flow, null);
    }

    /**
     * Validate a flow document and, when {@code registry} is not null, check that every task it
     * invokes is registered.
     */
    public static List<String> validate(FlowDocument flow, TaskRegistry registry) {
        var errors = new ArrayList<String>();

        // Rule 1: flow name and steps
        if (flow.name() == null || flow.name().isBlank()) {
            errors.add("Flow definition must have a 'flow' name");
        }
        if (flow.steps().isEmpty()) {
            errors.add("Flow definition must have at least one step");
        }

        // Rule 2: inputs
        var inputNames = new HashSet<String>();
        for (int i = 0; i < flow.inputs().size(); i++) {
            InputSpec input = flow.inputs().get(i);
            String where = "inputs[%d]".formatted(i);
            if (!isIdentifier(input.name())) {
                errors.add("%s: input name '%s' is not a valid identifier".formatted(where, input.name()));
            } else if (!inputNames.add(input.name())) {
                errors.add("%s: duplicate input '%s'".formatted(where, input.name()));
            }
            if (input.hasDefault() && !input.type().matches(input.defaultValue())) {
                errors.add("%s: default of input '%s' is not of type %s"
                    .formatted(where, input.name(), input.type().typeName()));
            }
        }

        // Rule 3: outputs
        var outputNames = new HashSet<String>();
        for (int i = 0; i < flow.outputs().size(); i++) {
            OutputSpec output = flow.outputs().get(i);
            String where = "outputs[%d]".formatted(i);
            if (output.name() == null || output.name().isBlank()) {
                errors.add(where + ": output must have a name");
            } else if (!outputNames.add(output.name())) {
                errors.add("%s: duplicate output '%s'".formatted(where, output.name()));
            }
            syntax(output.value(), where, errors);
        }

        // Rule 4: step tree
        validateSteps(flow.steps(), "steps", registry, errors);
        validateSteps(flow.onCancel(), "on_cancel", registry, errors);

        return errors;
    }

    private static void validateSteps(List<Step> steps, String where, TaskRegistry registry, List<String> errors) {
        var seen = new HashMap<String, Integer>();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            String stepWhere = "%s[%d]".formatted(where, i);
            validateStep(step, stepWhere, registry, errors);

            // ids are unique within their parent list
            if (seen.putIfAbsent(step.id(), i) != null) {
                errors.add("%s: duplicate step id '%s'".formatted(stepWhere, step.id()));
            }

            // depends_on may only name earlier siblings
            for (String dep : step.dependsOn()) {
                dependencyError(step, dep, seen.keySet(), siblingIds(steps))
                    .ifPresent(message -> errors.add(stepWhere + ": " + message));
            }
        }
    }

    private static Optional<String> dependencyError(Step step, String dep, Set<String> earlier, Set<String> all) {
        if (dep.equals(step.id())) {
            return Optional.of("step '%s' depends on itself".formatted(step.id()));
        }
        if (dep.startsWith(Step.GENERATED_ID_PREFIX)) {
            return Optional.of("depends_on cannot reference generated id '%s'".formatted(dep));
        }
        if (earlier.contains(dep)) {
            return Optional.empty();
        }
        if (all.contains(dep)) {
            return Optional.of("depends_on '%s' is a forward reference".formatted(dep));
        }
        return Optional.of("depends_on references unknown step '%s'".formatted(dep));
    }

    private static Set<String> siblingIds(List<Step> steps) {
        var ids = new HashSet<String>();
        steps.forEach(s -> ids.add(s.id()));
        return ids;
    }

    private static void validateStep(Step step, String where, TaskRegistry registry, List<String> errors) {
        // Rule 5: addressable ids
        if (!step.hasGeneratedId()) {
            if (!isIdentifier(step.id())) {
                errors.add("%s: step id '%s' is not a valid identifier".formatted(where, step.id()));
            } else if (RESERVED_NAMES.contains(step.id())) {
                errors.add("%s: step id '%s' is reserved".formatted(where, step.id()));
            }
        }
        syntax(step.inputs(), where + ".inputs", errors);
        for (String optional : step.optionalInputs()) {
            if (!step.inputs().containsKey(optional)) {
                errors.add("%s: optional input '%s' is not bound in inputs".formatted(where, optional));
            }
        }

        // Rule 6: retry bounds
        RetryPolicy retry = step.retry();
        if (retry != null) {
            if (!(step.kind() instanceof StepKind.Task)) {
                errors.add("%s: retry is only supported on task steps".formatted(where));
            }
            if (retry.maxAttempts() < 1) {
                errors.add("%s: retry.max_attempts must be at least 1".formatted(where));
            }
            if (retry.delayMillis() < 0) {
                errors.add("%s: retry.delay must not be negative".formatted(where));
            }
            if (!(retry.backoff() > 0)) {
                errors.add("%s: retry.backoff must be positive".formatted(where));
            }
        }

        validateSteps(step.onError(), where + ".on_error", registry, errors);

        step.kind().accept(new StepKind.Visitor<Void>() {
            @Override
            public Void visitTask(StepKind.Task task) {
                syntax(task.connection(), where + ".connection", errors);
                if (registry != null && !registry.contains(task.taskName())) {
                    errors.add("%s: task '%s' is not registered".formatted(where, task.taskName()));
                }
                return null;
            }

            @Override
            public Void visitConditional(StepKind.Conditional conditional) {
                condition(conditional.condition(), where + ".if", errors);
                validateSteps(conditional.thenSteps(), where + ".then", registry, errors);
                validateSteps(conditional.elseSteps(), where + ".else", registry, errors);
                return null;
            }

            @Override
            public Void visitSwitch(StepKind.Switch switchKind) {
                if (switchKind.discriminant() == null) {
                    errors.add(where + ": switch must have a discriminant");
                }
                syntax(switchKind.discriminant(), where + ".switch", errors);
                if (switchKind.cases().isEmpty() && switchKind.defaultSteps().isEmpty()) {
                    errors.add(where + ": switch must have at least one case or a default");
                }
                for (int i = 0; i < switchKind.cases().size(); i++) {
                    SwitchCase c = switchKind.cases().get(i);
                    String caseWhere = "%s.cases[%d]".formatted(where, i);
                    if (c.when().isEmpty()) {
                        errors.add(caseWhere + ": case must have at least one 'when' value");
                    }
                    validateSteps(c.steps(), caseWhere + ".do", registry, errors);
                }
                validateSteps(switchKind.defaultSteps(), where + ".default", registry, errors);
                return null;
            }

            @Override
            public Void visitLoop(StepKind.Loop loop) {
                if (loop.collection() == null) {
                    errors.add(where + ": for_each must have a collection");
                }
                syntax(loop.collection(), where + ".for_each", errors);
                if (!isIdentifier(loop.binding()) || RESERVED_NAMES.contains(loop.binding())) {
                    errors.add("%s: loop binding '%s' is not a usable name".formatted(where, loop.binding()));
                }
                validateSteps(loop.body(), where + ".do", registry, errors);
                return null;
            }

            @Override
            public Void visitParallel(StepKind.Parallel parallel) {
                validateParallel(step, parallel, where, registry, errors);
                return null;
            }

            @Override
            public Void visitSubflow(StepKind.Subflow subflow) {
                if (subflow.reference() == null || subflow.reference().isBlank()) {
                    errors.add(where + ": subflow must have a reference");
                }
                return null;
            }

            @Override
            public Void visitExit(StepKind.Exit exit) {
                syntax(exit.outputs(), where + ".exit.outputs", errors);
                return null;
            }
        });
    }

    private static void validateParallel(Step step, StepKind.Parallel parallel, String where,
                                         TaskRegistry registry, List<String> errors) {
        if (parallel.branches().isEmpty()) {
            errors.add(where + ": parallel must have at least one branch");
        }

        // owner branch of every id and output name published anywhere inside a branch
        var idOwners = new HashMap<String, Integer>();
        var outputOwners = new HashMap<String, Integer>();
        var branchOf = new HashMap<String, Integer>();
        for (int b = 0; b < parallel.branches().size(); b++) {
            List<Step> branch = parallel.branches().get(b);
            String branchWhere = "%s.parallel[%d]".formatted(where, b);
            var topLevel = new HashSet<String>();
            for (int i = 0; i < branch.size(); i++) {
                Step s = branch.get(i);
                String stepWhere = "%s[%d]".formatted(branchWhere, i);
                validateStep(s, stepWhere, registry, errors);
                if (!topLevel.add(s.id())) {
                    errors.add("%s: duplicate step id '%s'".formatted(stepWhere, s.id()));
                }
                branchOf.putIfAbsent(s.id(), b);
            }
            var ids = new LinkedHashSet<String>();
            var outputs = new LinkedHashSet<String>();
            for (Step nested : publishedSteps(branch)) {
                ids.add(nested.id());
                outputs.addAll(nested.outputs());
            }
            for (String id : ids) {
                if (idOwners.putIfAbsent(id, b) != null) {
                    errors.add("%s: step id '%s' collides across parallel branches".formatted(branchWhere, id));
                }
            }
            for (String output : outputs) {
                if (outputOwners.putIfAbsent(output, b) != null && step.outputs().contains(output)) {
                    errors.add("%s: output '%s' is produced by more than one parallel branch"
                        .formatted(branchWhere, output));
                }
            }
        }

        // depends_on: earlier steps of the same branch, or any step of another branch
        for (int b = 0; b < parallel.branches().size(); b++) {
            List<Step> branch = parallel.branches().get(b);
            var earlier = new HashSet<String>();
            for (int i = 0; i < branch.size(); i++) {
                Step s = branch.get(i);
                String stepWhere = "%s.parallel[%d][%d]".formatted(where, b, i);
                for (String dep : s.dependsOn()) {
                    Integer depBranch = branchOf.get(dep);
                    if (depBranch != null && depBranch != b && !dep.equals(s.id())) {
                        continue;
                    }
                    dependencyError(s, dep, earlier, siblingIds(branch))
                        .ifPresent(message -> errors.add(stepWhere + ": " + message));
                }
                earlier.add(s.id());
            }
        }

        List<String> cycle = dependencyCycle(parallel, branchOf);
        if (!cycle.isEmpty()) {
            errors.add("%s: circular depends_on between parallel branches: %s"
                .formatted(where, String.join(" -> ", cycle)));
        }
    }

    /**
     * Finds a cycle in the graph formed by cross-branch depends_on edges plus the implicit order of
     * steps inside each branch. Returns the cycle as a list of ids, or an empty list.
     */
    private static List<String> dependencyCycle(StepKind.Parallel parallel, Map<String, Integer> branchOf) {
        var edges = new LinkedHashMap<String, List<String>>();
        for (List<Step> branch : parallel.branches()) {
            for (int i = 0; i < branch.size(); i++) {
                Step s = branch.get(i);
                var targets = edges.computeIfAbsent(s.id(), k -> new ArrayList<>());
                if (i > 0) {
                    targets.add(branch.get(i - 1).id());
                }
                for (String dep : s.dependsOn()) {
                    if (branchOf.containsKey(dep)) {
                        targets.add(dep);
                    }
                }
            }
        }
        var visited = new HashSet<String>();
        for (String start : edges.keySet()) {
            var path = new ArrayList<String>();
            if (findCycle(start, edges, visited, new HashSet<>(), path)) {
                return path;
            }
        }
        return List.of();
    }

    private static boolean findCycle(String node, Map<String, List<String>> edges, Set<String> visited,
                                     Set<String> onPath, List<String> path) {
        if (onPath.contains(node)) {
            path.subList(0, path.indexOf(node)).clear();
            path.add(node);
            return true;
        }
        if (!visited.add(node)) {
            return false;
        }
        onPath.add(node);
        path.add(node);
        for (String next : edges.getOrDefault(node, List.of())) {
            if (findCycle(next, edges, visited, onPath, path)) {
                return true;
            }
        }
        onPath.remove(node);
        path.remove(path.size() - 1);
        return false;
    }

    /** Steps whose ids become visible once {@code steps} completes: the list itself plus nested compound bodies. */
    private static List<Step> publishedSteps(List<Step> steps) {
        var result = new ArrayList<Step>();
        for (Step step : steps) {
            if (step.hasGeneratedId()) {
                result.addAll(publishedSteps(nestedSteps(step)));
                continue;
            }
            result.add(step);
            result.addAll(publishedSteps(nestedSteps(step)));
        }
        return result;
    }

    private static List<Step> nestedSteps(Step step) {
        return step.kind().accept(new StepKind.Visitor<List<Step>>() {
            @Override
            public List<Step> visitTask(StepKind.Task task) {
                return List.of();
            }

            @Override
            public List<Step> visitConditional(StepKind.Conditional conditional) {
                var steps = new ArrayList<>(conditional.thenSteps());
                steps.addAll(conditional.elseSteps());
                return steps;
            }

            @Override
            public List<Step> visitSwitch(StepKind.Switch switchKind) {
                var steps = new ArrayList<Step>();
                switchKind.cases().forEach(c -> steps.addAll(c.steps()));
                steps.addAll(switchKind.defaultSteps());
                return steps;
            }

            @Override
            public List<Step> visitLoop(StepKind.Loop loop) {
                return loop.body();
            }

            @Override
            public List<Step> visitParallel(StepKind.Parallel parallel) {
                var steps = new ArrayList<Step>();
                parallel.branches().forEach(steps::addAll);
                return steps;
            }

            @Override
            public List<Step> visitSubflow(StepKind.Subflow subflow) {
                return List.of();
            }

            @Override
            public List<Step> visitExit(StepKind.Exit exit) {
                return List.of();
            }
        });
    }

    private static void condition(Condition condition, String where, List<String> errors) {
        if (condition instanceof Condition.Expression expression) {
            for (String error : SYNTAX.checkConditionSyntax(expression.expression())) {
                errors.add(where + ": " + error);
            }
            return;
        }
        List<Condition> members = condition instanceof Condition.All all ? all.conditions()
            : condition instanceof Condition.Any any ? any.conditions()
            : ((Condition.None) condition).conditions();
        if (members.isEmpty()) {
            errors.add(where + ": condition group must not be empty");
        }
        for (Condition member : members) {
            condition(member, where, errors);
        }
    }

    private static void syntax(Object value, String where, List<String> errors) {
        for (String error : SYNTAX.checkSyntax(value)) {
            errors.add(where + ": " + error);
        }
    }

    private static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }
}
