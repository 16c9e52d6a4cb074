package dev.flowlang.diagram;

import dev.flowlang.expr.Values;
import dev.flowlang.model.Condition;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.model.InputSpec;
import dev.flowlang.model.OutputSpec;
import dev.flowlang.model.Step;
import dev.flowlang.model.StepKind;
import dev.flowlang.model.SwitchCase;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders a flow as a Mermaid flowchart. Sequential steps become a chain of boxes; conditionals,
 * switches, loops and parallel blocks become decision nodes with a matching merge node, so every
 * compound step has one entry and one exit in the diagram.
 */
public final class FlowVisualizer {

    static final int MAX_CONDITION_LENGTH = 40;

    private static final Pattern TEMPLATE = Pattern.compile("\\$\\{([^}]+)}");

    private FlowVisualizer() {}

    /** Mermaid source starting with {@code flowchart TD}. */
    public static String toMermaid(FlowDocument flow) {
        return new Diagram().render(flow);
    }

    /** The diagram wrapped in a {@code ```mermaid} fence, ready to paste into Markdown. */
    public static String toMarkdown(FlowDocument flow) {
        return "```mermaid\n" + toMermaid(flow) + "```\n";
    }

    /**
     * Display form of a condition: template markers stripped, long text shortened, quantified
     * groups summarised by their size.
     */
    static String describe(Condition condition) {
        if (condition instanceof Condition.All all) {
            return "all of %d conditions".formatted(all.conditions().size());
        }
        if (condition instanceof Condition.Any any) {
            return "any of %d conditions".formatted(any.conditions().size());
        }
        if (condition instanceof Condition.None none) {
            return "none of %d conditions".formatted(none.conditions().size());
        }
        return shorten(((Condition.Expression) condition).expression());
    }

    static String shorten(Object value) {
        String text = TEMPLATE.matcher(Values.stringify(value)).replaceAll("$1").strip();
        if (text.length() > MAX_CONDITION_LENGTH) {
            return text.substring(0, MAX_CONDITION_LENGTH - 3) + "...";
        }
        return text;
    }

    private static String question(Condition condition) {
        String text = describe(condition);
        if (!(condition instanceof Condition.Expression)) {
            return text.replace("conditions", "met?");
        }
        return text.endsWith("?") ? text : text + "?";
    }

    /** Nodes that still need an edge to whatever comes next, and the label that edge carries. */
    private record Tail(List<String> nodes, String label) {

        static Tail of(String node) {
            return new Tail(List.of(node), null);
        }

        Tail labelled(String edgeLabel) {
            return new Tail(nodes, edgeLabel);
        }
    }

    private static final class Diagram {

        private final List<String> nodes = new ArrayList<>();
        private final List<String> edges = new ArrayList<>();
        private final List<String> exits = new ArrayList<>();
        private int counter;

        String render(FlowDocument flow) {
            Tail tail = Tail.of(node("Start", Shape.CIRCLE));
            if (!flow.inputs().isEmpty()) {
                String inputs = "Inputs:<br/>" + flow.inputs().stream().map(InputSpec::name).collect(Collectors.joining("<br/>"));
                tail = Tail.of(link(tail, node(inputs, Shape.PARALLELOGRAM)));
            }

            tail = steps(flow.steps(), tail);

            if (!flow.outputs().isEmpty()) {
                String outputs = "Outputs:<br/>" + flow.outputs().stream().map(OutputSpec::name).collect(Collectors.joining("<br/>"));
                tail = Tail.of(link(tail, node(outputs, Shape.PARALLELOGRAM)));
            }
            String end = link(tail, node("End", Shape.CIRCLE));
            exits.forEach(exit -> edge(exit, end, "exit"));

            var out = new StringBuilder("flowchart TD\n");
            nodes.forEach(n -> out.append("    ").append(n).append('\n'));
            edges.forEach(e -> out.append("    ").append(e).append('\n'));
            return out.toString();
        }

        private Tail steps(List<Step> steps, Tail tail) {
            for (Step step : steps) {
                tail = step.kind().accept(new StepShapes(step, tail));
            }
            return tail;
        }

        private String node(String label, Shape shape) {
            String id = "node" + counter++;
            nodes.add(id + shape.wrap(label));
            return id;
        }

        /** Connects every node of {@code tail} to {@code target} and returns the target. */
        private String link(Tail tail, String target) {
            for (String from : tail.nodes()) {
                edge(from, target, tail.label());
            }
            return target;
        }

        private void edge(String from, String to, String label) {
            if (label == null) {
                edges.add(from + " --> " + to);
            } else {
                edges.add("%s -->|\"%s\"| %s".formatted(from, escape(label), to));
            }
        }

        private static Tail merge(List<Tail> tails) {
            var merged = new ArrayList<String>();
            tails.forEach(t -> merged.addAll(t.nodes()));
            return new Tail(merged, null);
        }

        private final class StepShapes implements StepKind.Visitor<Tail> {

            private final Step step;
            private final Tail tail;

            StepShapes(Step step, Tail tail) {
                this.step = step;
                this.tail = tail;
            }

            @Override
            public Tail visitTask(StepKind.Task task) {
                String label = step.hasGeneratedId() || step.id().equals(task.taskName())
                    ? task.taskName()
                    : task.taskName() + "<br/>" + step.id();
                if (step.retry() != null) {
                    label += "<br/>retry x" + step.retry().maxAttempts();
                }
                return Tail.of(link(tail, node(label, Shape.RECT)));
            }

            @Override
            public Tail visitConditional(StepKind.Conditional conditional) {
                String decision = link(tail, node("If: " + question(conditional.condition()), Shape.DIAMOND));
                Tail then = steps(conditional.thenSteps(), Tail.of(decision).labelled("true"));
                Tail otherwise = steps(conditional.elseSteps(), Tail.of(decision).labelled("false"));
                String merge = node("End If", Shape.DIAMOND);
                link(then, merge);
                link(otherwise, merge);
                return Tail.of(merge);
            }

            @Override
            public Tail visitSwitch(StepKind.Switch switchKind) {
                String decision = link(tail, node("Switch: " + shorten(switchKind.discriminant()), Shape.DIAMOND));
                var branches = new ArrayList<Tail>();
                for (SwitchCase c : switchKind.cases()) {
                    String when = c.when().stream().map(FlowVisualizer::shorten).collect(Collectors.joining(", "));
                    branches.add(steps(c.steps(), Tail.of(decision).labelled(when)));
                }
                branches.add(steps(switchKind.defaultSteps(), Tail.of(decision).labelled("default")));
                String merge = node("End Switch", Shape.DIAMOND);
                branches.forEach(b -> link(b, merge));
                return Tail.of(merge);
            }

            @Override
            public Tail visitLoop(StepKind.Loop loop) {
                String head = link(tail, node("Loop: for each " + loop.binding() + " in " + shorten(loop.collection()),
                    Shape.DIAMOND));
                if (!loop.body().isEmpty()) {
                    link(steps(loop.body(), Tail.of(head)).labelled("next"), head);
                }
                String end = node("End Loop", Shape.DIAMOND);
                edge(head, end, "done");
                return Tail.of(end);
            }

            @Override
            public Tail visitParallel(StepKind.Parallel parallel) {
                String fork = link(tail, node("Fork: Run in Parallel", Shape.HEXAGON));
                var branches = new ArrayList<Tail>();
                for (List<Step> branch : parallel.branches()) {
                    branches.add(steps(branch, Tail.of(fork)));
                }
                String join = node("Join: Wait for All", Shape.HEXAGON);
                link(merge(branches), join);
                return Tail.of(join);
            }

            @Override
            public Tail visitSubflow(StepKind.Subflow subflow) {
                return Tail.of(link(tail, node("Subflow: " + subflow.reference(), Shape.SUBROUTINE)));
            }

            @Override
            public Tail visitExit(StepKind.Exit exit) {
                String label = exit.reason() == null ? "Exit" : "Exit: " + shorten(exit.reason());
                exits.add(link(tail, node(label, Shape.STADIUM)));
                return new Tail(List.of(), null);
            }
        }
    }

    private enum Shape {
        RECT("[\"", "\"]"),
        CIRCLE("((\"", "\"))"),
        DIAMOND("{\"", "\"}"),
        HEXAGON("{{\"", "\"}}"),
        PARALLELOGRAM("[/\"", "\"/]"),
        SUBROUTINE("[[\"", "\"]]"),
        STADIUM("([\"", "\"])");

        private final String open;
        private final String close;

        Shape(String open, String close) {
            this.open = open;
            this.close = close;
        }

        String wrap(String label) {
            return open + escape(label) + close;
        }
    }

    private static String escape(String label) {
        return label.replace("\"", "&quot;").replace("\n", "<br/>");
    }
}
