package dev.flowlang.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.flowlang.diagram.FlowVisualizer;
import dev.flowlang.engine.FlowExecution;
import dev.flowlang.engine.FlowExecutor;
import dev.flowlang.engine.FlowLoader;
import dev.flowlang.engine.FlowValidator;
import dev.flowlang.error.FlowException;
import dev.flowlang.event.ExecutionEvent;
import dev.flowlang.model.EngineOptions;
import dev.flowlang.model.ExecutionResult;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.subflow.FileSystemSubflowResolver;
import dev.flowlang.task.MapTaskRegistry;
import dev.flowlang.task.TaskProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * CLI entry point for flowlang.
 */
@Command(
    name = "flowlang",
    mixinStandardHelpOptions = true,
    description = "Validate and run declarative flows.",
    subcommands = {FlowCli.Validate.class, FlowCli.Run.class, FlowCli.Subflows.class, FlowCli.Visualize.class}
)
public class FlowCli implements Callable<Integer> {

    static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final MapTaskRegistry registry;

    @Spec
    private CommandSpec spec;

    @Option(names = "--flows-dir", description = "Directory subflow references resolve from (default: current directory)")
    private Path flowsDir;

    /** Uses the tasks contributed by every {@link TaskProvider} on the class path. */
    public FlowCli() {
        this(discoverTasks());
    }

    public FlowCli(MapTaskRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    EngineOptions options() {
        EngineOptions defaults = EngineOptions.defaults();
        return flowsDir != null ? defaults.withFlowsDirectory(flowsDir.toAbsolutePath().normalize()) : defaults;
    }

    static MapTaskRegistry discoverTasks() {
        var registry = new MapTaskRegistry();
        for (TaskProvider provider : ServiceLoader.load(TaskProvider.class)) {
            provider.registerTasks(registry);
        }
        return registry;
    }

    @Command(name = "validate", mixinStandardHelpOptions = true, description = "Check a flow file for errors.")
    static class Validate implements Callable<Integer> {

        @ParentCommand
        private FlowCli parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Flow file (YAML or JSON)")
        private Path file;

        @Option(names = "--check-tasks", description = "Also require every task to be registered")
        private boolean checkTasks;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            List<String> errors;
            FlowDocument flow;
            try {
                flow = FlowLoader.loadFromFile(file);
                errors = FlowValidator.validate(flow, checkTasks ? parent.registry : null);
            } catch (IOException | FlowException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
            if (!errors.isEmpty()) {
                err.printf("Flow '%s' is invalid:%n", flow.name());
                errors.forEach(e -> err.println("  - " + e));
                return 1;
            }
            out.printf("Flow '%s' is valid (%d steps)%n", flow.name(), flow.steps().size());
            return 0;
        }
    }

    @Command(name = "run", mixinStandardHelpOptions = true, description = "Run a flow and print its result as JSON.")
    static class Run implements Callable<Integer> {

        @ParentCommand
        private FlowCli parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Flow file (YAML or JSON)")
        private Path file;

        @Option(names = {"-i", "--input"}, description = "Input value as name=value; values are read as YAML scalars")
        private Map<String, String> inputs = new LinkedHashMap<>();

        @Option(names = "--events", description = "Print execution events as JSON lines before the result")
        private boolean events;

        @Override
        public Integer call() throws JsonProcessingException {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            FlowDocument flow;
            var values = new LinkedHashMap<String, Object>();
            try {
                flow = FlowLoader.loadFromFile(file);
                for (var entry : inputs.entrySet()) {
                    values.put(entry.getKey(), FlowLoader.parseValue(entry.getValue()));
                }
            } catch (IOException | FlowException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }

            ExecutionResult result;
            try (var executor = new FlowExecutor(parent.registry, parent.options())) {
                FlowExecution execution = executor.start(flow, values);
                if (events) {
                    execution.events().subscribe(event -> out.println(eventLine(event)));
                }
                result = execution.await();
            }
            out.println(JSON.writeValueAsString(result));
            out.flush();
            return result.success() ? 0 : 1;
        }

        private static String eventLine(ExecutionEvent event) {
            var line = new LinkedHashMap<String, Object>();
            line.put("sequence", event.sequence());
            line.put("type", event.type().wireName());
            line.put("flow", event.flow());
            line.put("step_id", event.stepId());
            line.put("timestamp", event.timestamp().toString());
            line.put("payload", event.payload());
            try {
                return JSON.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(line);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Event is not serializable: " + event, e);
            }
        }
    }

    @Command(name = "subflows", mixinStandardHelpOptions = true, description = "List subflows discoverable from a directory.")
    static class Subflows implements Callable<Integer> {

        @ParentCommand
        private FlowCli parent;

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Directory to search (default: --flows-dir)")
        private Path dir;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            EngineOptions options = parent.options();
            if (dir != null) {
                options = options.withFlowsDirectory(dir.toAbsolutePath().normalize());
            }
            List<String> names = new FileSystemSubflowResolver(options).listAvailable(null);
            if (names.isEmpty()) {
                out.println("No subflows found in " + options.flowsDirectory());
                return 0;
            }
            out.println("Available subflows:");
            names.forEach(name -> out.println("  " + name));
            return 0;
        }
    }

    @Command(name = "visualize", mixinStandardHelpOptions = true, description = "Render a flow as a Mermaid flowchart.")
    static class Visualize implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Flow file (YAML or JSON)")
        private Path file;

        @Option(names = {"-o", "--output"}, description = "Write the diagram to this file instead of standard output")
        private Path output;

        @Option(names = "--markdown", description = "Wrap the diagram in a ```mermaid fence")
        private boolean markdown;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            String diagram;
            try {
                FlowDocument flow = FlowLoader.loadFromFile(file);
                diagram = markdown ? FlowVisualizer.toMarkdown(flow) : FlowVisualizer.toMermaid(flow);
                if (output != null) {
                    Files.writeString(output, diagram);
                    out.println("Diagram saved to " + output);
                    return 0;
                }
            } catch (IOException | FlowException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
            out.print(diagram);
            out.flush();
            return 0;
        }
    }
}
