package dev.flowlang.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.flowlang.error.ValidationException;
import dev.flowlang.model.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads flow documents from YAML or JSON. Structural problems (unknown step kinds, wrong shapes)
 * are reported as {@link ValidationException}; semantic checks live in {@link FlowValidator}.
 */
public final class FlowLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private static final List<String> KIND_KEYS = List.of("task", "if", "switch", "for_each", "parallel", "subflow", "exit");

    private FlowLoader() {}

    /**
     * Load a single flow from a YAML or JSON file. The document remembers its location so
     * subflow references resolve relative to it.
     */
    public static FlowDocument loadFromFile(Path path) throws IOException {
        ObjectMapper mapper = path.toString().endsWith(".json") ? JSON : YAML;
        JsonNode root = mapper.readTree(path.toFile());
        return new Parser().parseFlow(root).withLocation(path.toAbsolutePath().normalize());
    }

    /**
     * Load a single flow from YAML or JSON text.
     */
    public static FlowDocument loadFromString(String text) throws IOException {
        JsonNode root = YAML.readTree(text);
        return new Parser().parseFlow(root);
    }

    /**
     * Load all flows from a directory: {@code *.yaml}, {@code *.yml} and {@code *.json} files, keyed by flow name.
     */
    public static Map<String, FlowDocument> loadFromDirectory(Path dir) throws IOException {
        var flows = new LinkedHashMap<String, FlowDocument>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(FlowLoader::isFlowFile)
                 .sorted()
                 .forEach(p -> {
                     try {
                         FlowDocument flow = loadFromFile(p);
                         flows.put(flow.name(), flow);
                     } catch (IOException e) {
                         throw new UncheckedIOException("Failed to load flow from " + p, e);
                     }
                 });
        }
        return flows;
    }

    /**
     * Parses a YAML scalar or inline collection ({@code 3}, {@code true}, {@code [a, b]}) into a
     * plain value, as input values given on a command line are read.
     */
    public static Object parseValue(String text) throws IOException {
        return toValue(YAML.readTree(text));
    }

    static boolean isFlowFile(Path path) {
        String name = path.getFileName().toString();
        return Files.isRegularFile(path) && (name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json"));
    }

    /** Converts a Jackson tree into plain maps, lists and scalars. Integral numbers become {@code Long}. */
    static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.asLong() : node.numberValue();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>(node.size());
            node.forEach(item -> list.add(toValue(item)));
            return list;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            for (var entry : node.properties()) {
                map.put(entry.getKey(), toValue(entry.getValue()));
            }
            return map;
        }
        return node.asText();
    }

    /** Holds the per-document counter used to generate step ids. */
    private static final class Parser {

        private int generated;

        FlowDocument parseFlow(JsonNode root) {
            if (root == null || !root.isObject()) {
                throw new ValidationException("Flow document must be a mapping");
            }
            String name = text(root, "flow");
            if (name == null) {
                name = text(root, "name");
            }
            String description = text(root, "description");

            List<InputSpec> inputs = parseInputs(root.get("inputs"));
            List<OutputSpec> outputs = parseOutputs(root.get("outputs"));
            List<Step> steps = parseSteps(root.get("steps"), "steps");
            Map<String, ConnectionSpec> connections = parseConnections(root.get("connections"));
            List<TriggerSpec> triggers = parseTriggers(root.get("triggers"));
            List<Step> onCancel = parseSteps(root.get("on_cancel"), "on_cancel");

            return new FlowDocument(name, description, inputs, outputs, steps, connections, triggers, onCancel, null);
        }

        private List<InputSpec> parseInputs(JsonNode node) {
            var inputs = new ArrayList<InputSpec>();
            if (node == null || node.isNull()) {
                return inputs;
            }
            requireArray(node, "inputs");
            int i = 0;
            for (JsonNode input : node) {
                String where = "inputs[%d]".formatted(i++);
                if (input.isTextual()) {
                    inputs.add(new InputSpec(input.asText(), InputType.ANY, true, null));
                    continue;
                }
                requireObject(input, where);
                String name = text(input, "name");
                if (name == null) {
                    throw new ValidationException(where + ": input must have a 'name'");
                }
                String typeName = text(input, "type");
                InputType type = InputType.fromValue(typeName);
                if (type == null) {
                    throw new ValidationException("%s: unknown type '%s' for input '%s'".formatted(where, typeName, name));
                }
                boolean required = !input.has("required") || input.get("required").asBoolean(true);
                inputs.add(new InputSpec(name, type, required, toValue(input.get("default"))));
            }
            return inputs;
        }

        private List<OutputSpec> parseOutputs(JsonNode node) {
            var outputs = new ArrayList<OutputSpec>();
            if (node == null || node.isNull()) {
                return outputs;
            }
            requireArray(node, "outputs");
            int i = 0;
            for (JsonNode output : node) {
                String where = "outputs[%d]".formatted(i++);
                if (output.isTextual()) {
                    outputs.add(OutputSpec.named(output.asText()));
                    continue;
                }
                requireObject(output, where);
                String name = text(output, "name");
                if (name == null) {
                    throw new ValidationException(where + ": output must have a 'name'");
                }
                outputs.add(output.has("value")
                    ? new OutputSpec(name, toValue(output.get("value")))
                    : OutputSpec.named(name));
            }
            return outputs;
        }

        private Map<String, ConnectionSpec> parseConnections(JsonNode node) {
            var connections = new LinkedHashMap<String, ConnectionSpec>();
            if (node == null || node.isNull()) {
                return connections;
            }
            requireObject(node, "connections");
            for (var entry : node.properties()) {
                JsonNode spec = entry.getValue();
                requireObject(spec, "connections." + entry.getKey());
                connections.put(entry.getKey(), new ConnectionSpec(text(spec, "type"), configWithout(spec, "type")));
            }
            return connections;
        }

        private List<TriggerSpec> parseTriggers(JsonNode node) {
            var triggers = new ArrayList<TriggerSpec>();
            if (node == null || node.isNull()) {
                return triggers;
            }
            requireArray(node, "triggers");
            int i = 0;
            for (JsonNode trigger : node) {
                requireObject(trigger, "triggers[%d]".formatted(i++));
                triggers.add(new TriggerSpec(text(trigger, "type"), configWithout(trigger, "type")));
            }
            return triggers;
        }

        private List<Step> parseSteps(JsonNode node, String where) {
            var steps = new ArrayList<Step>();
            if (node == null || node.isNull()) {
                return steps;
            }
            requireArray(node, where);
            int i = 0;
            for (JsonNode step : node) {
                steps.add(parseStep(step, "%s[%d]".formatted(where, i++)));
            }
            return steps;
        }

        private Step parseStep(JsonNode node, String where) {
            requireObject(node, where);

            var kinds = new ArrayList<String>();
            for (String key : KIND_KEYS) {
                if (node.has(key)) {
                    kinds.add(key);
                }
            }
            if (kinds.isEmpty()) {
                throw new ValidationException("%s: step has no recognised kind (expected one of %s)".formatted(where, KIND_KEYS));
            }
            if (kinds.size() > 1) {
                throw new ValidationException("%s: step declares more than one kind %s".formatted(where, kinds));
            }

            StepKind kind = switch (kinds.get(0)) {
                case "task" -> parseTask(node, where);
                case "if" -> parseConditional(node, where);
                case "switch" -> parseSwitch(node, where);
                case "for_each" -> parseLoop(node, where);
                case "parallel" -> parseParallel(node, where);
                case "subflow" -> parseSubflow(node, where);
                default -> parseExit(node, where);
            };

            String id = text(node, "id");
            if (id == null) {
                id = Step.GENERATED_ID_PREFIX + kind.kindName() + "_" + generated++;
            }

            @SuppressWarnings("unchecked")
            Map<String, Object> inputs = node.has("inputs") ? (Map<String, Object>) objectValue(node.get("inputs"), where + ".inputs") : null;
            List<String> outputs = names(node.get("outputs"), where + ".outputs");
            List<String> dependsOn = names(node.get("depends_on"), where + ".depends_on");
            RetryPolicy retry = parseRetry(node.get("retry"), where + ".retry");
            List<Step> onError = parseOnError(node.get("on_error"), where + ".on_error");
            List<String> optional = names(node.get("optional_inputs"), where + ".optional_inputs");

            return new Step(id, inputs, outputs, dependsOn, retry, onError, new LinkedHashSet<>(optional), kind);
        }

        private StepKind parseTask(JsonNode node, String where) {
            JsonNode task = node.get("task");
            if (!task.isTextual() || task.asText().isBlank()) {
                throw new ValidationException(where + ": 'task' must be a task name");
            }
            return new StepKind.Task(task.asText(), text(node, "connection"));
        }

        private StepKind parseConditional(JsonNode node, String where) {
            Condition condition = parseCondition(node.get("if"), where + ".if");
            return new StepKind.Conditional(condition,
                parseSteps(node.get("then"), where + ".then"),
                parseSteps(node.get("else"), where + ".else"));
        }

        private Condition parseCondition(JsonNode node, String where) {
            if (node.isTextual()) {
                return new Condition.Expression(node.asText());
            }
            if (node.isBoolean()) {
                return new Condition.Expression(String.valueOf(node.asBoolean()));
            }
            if (node.isObject() && node.size() == 1) {
                var entry = node.properties().iterator().next();
                String quantifier = entry.getKey();
                JsonNode members = entry.getValue();
                requireArray(members, where + "." + quantifier);
                var conditions = new ArrayList<Condition>();
                int i = 0;
                for (JsonNode member : members) {
                    conditions.add(parseCondition(member, "%s.%s[%d]".formatted(where, quantifier, i++)));
                }
                switch (quantifier) {
                    case "all":
                        return new Condition.All(conditions);
                    case "any":
                        return new Condition.Any(conditions);
                    case "none":
                        return new Condition.None(conditions);
                    default:
                        break;
                }
            }
            throw new ValidationException(where + ": condition must be an expression or one of all/any/none");
        }

        private StepKind parseSwitch(JsonNode node, String where) {
            var cases = new ArrayList<SwitchCase>();
            JsonNode casesNode = node.get("cases");
            if (casesNode != null && !casesNode.isNull()) {
                requireArray(casesNode, where + ".cases");
                int i = 0;
                for (JsonNode c : casesNode) {
                    String caseWhere = "%s.cases[%d]".formatted(where, i++);
                    requireObject(c, caseWhere);
                    if (!c.has("when")) {
                        throw new ValidationException(caseWhere + ": case must have 'when'");
                    }
                    JsonNode when = c.get("when");
                    List<Object> values = new ArrayList<>();
                    if (when.isArray()) {
                        when.forEach(v -> values.add(toValue(v)));
                    } else {
                        values.add(toValue(when));
                    }
                    cases.add(new SwitchCase(values, parseSteps(c.get("do"), caseWhere + ".do")));
                }
            }
            return new StepKind.Switch(toValue(node.get("switch")), cases, parseSteps(node.get("default"), where + ".default"));
        }

        private StepKind parseLoop(JsonNode node, String where) {
            StepKind.CollectMode collect = null;
            String mode = text(node, "collect");
            if (mode != null) {
                try {
                    collect = StepKind.CollectMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("%s: unknown collect mode '%s' (expected list or last)".formatted(where, mode));
                }
            }
            return new StepKind.Loop(toValue(node.get("for_each")), text(node, "as"),
                parseSteps(node.get("do"), where + ".do"), collect);
        }

        private StepKind parseParallel(JsonNode node, String where) {
            JsonNode parallel = node.get("parallel");
            requireArray(parallel, where + ".parallel");
            var branches = new ArrayList<List<Step>>();
            int i = 0;
            for (JsonNode branch : parallel) {
                String branchWhere = "%s.parallel[%d]".formatted(where, i++);
                if (branch.isArray()) {
                    branches.add(parseSteps(branch, branchWhere));
                } else {
                    branches.add(List.of(parseStep(branch, branchWhere)));
                }
            }
            return new StepKind.Parallel(branches);
        }

        private StepKind parseSubflow(JsonNode node, String where) {
            JsonNode subflow = node.get("subflow");
            if (!subflow.isTextual() || subflow.asText().isBlank()) {
                throw new ValidationException(where + ": 'subflow' must be a flow reference");
            }
            boolean propagate = node.has("propagate_exit") && node.get("propagate_exit").asBoolean();
            return new StepKind.Subflow(subflow.asText(), propagate);
        }

        @SuppressWarnings("unchecked")
        private StepKind parseExit(JsonNode node, String where) {
            JsonNode exit = node.get("exit");
            if (exit.isObject()) {
                Map<String, Object> outputs = exit.has("outputs")
                    ? (Map<String, Object>) objectValue(exit.get("outputs"), where + ".exit.outputs") : null;
                return new StepKind.Exit(text(exit, "reason"), outputs);
            }
            if (exit.isTextual()) {
                return new StepKind.Exit(exit.asText(), null);
            }
            if (exit.isBoolean() && exit.asBoolean()) {
                return new StepKind.Exit(null, null);
            }
            throw new ValidationException(where + ": 'exit' must be true, a reason, or a mapping with reason/outputs");
        }

        private RetryPolicy parseRetry(JsonNode node, String where) {
            if (node == null || node.isNull()) {
                return null;
            }
            requireObject(node, where);
            int maxAttempts = node.has("max_attempts")
                ? node.get("max_attempts").asInt() : RetryPolicy.DEFAULT_MAX_ATTEMPTS;
            long delay = node.has("delay")
                ? node.get("delay").asLong() : RetryPolicy.DEFAULT_DELAY_MILLIS;
            double backoff = node.has("backoff")
                ? node.get("backoff").asDouble() : RetryPolicy.DEFAULT_BACKOFF;
            return new RetryPolicy(maxAttempts, delay, backoff);
        }

        private List<Step> parseOnError(JsonNode node, String where) {
            if (node == null || node.isNull()) {
                return null;
            }
            if (node.isObject()) {
                return parseSteps(node.get("steps"), where + ".steps");
            }
            return parseSteps(node, where);
        }
    }

    private static List<String> names(JsonNode node, String where) {
        var names = new ArrayList<String>();
        if (node == null || node.isNull()) {
            return names;
        }
        if (node.isTextual()) {
            names.add(node.asText());
            return names;
        }
        requireArray(node, where);
        for (JsonNode name : node) {
            if (!name.isTextual()) {
                throw new ValidationException(where + ": expected a list of names");
            }
            names.add(name.asText());
        }
        return names;
    }

    private static Object objectValue(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return null;
        }
        requireObject(node, where);
        return toValue(node);
    }

    private static Map<String, Object> configWithout(JsonNode node, String excluded) {
        var config = new LinkedHashMap<String, Object>();
        for (var entry : node.properties()) {
            if (!entry.getKey().equals(excluded)) {
                config.put(entry.getKey(), toValue(entry.getValue()));
            }
        }
        return config;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void requireArray(JsonNode node, String where) {
        if (node == null || !node.isArray()) {
            throw new ValidationException(where + ": expected a list");
        }
    }

    private static void requireObject(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw new ValidationException(where + ": expected a mapping");
        }
    }
}
