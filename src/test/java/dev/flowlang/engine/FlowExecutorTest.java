package dev.flowlang.engine;

import dev.flowlang.event.EventType;
import dev.flowlang.event.ExecutionEvent;
import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.ExecutionResult;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.task.TaskException;
import dev.flowlang.testing.MockTaskRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FlowExecutorTest {

    private static final String HELLO_WORLD = """
        flow: HelloWorld
        inputs:
          - name: user_name
            type: string
        outputs:
          - name: message
            value: ${greet.message}
        steps:
          - task: Greet
            id: greet
            inputs:
              name: ${inputs.user_name}
        """;

    private MockTaskRegistry tasks;
    private FlowExecutor executor;

    @BeforeEach
    void setUp() {
        tasks = new MockTaskRegistry();
        executor = new FlowExecutor(tasks);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private ExecutionResult run(String yaml, Map<String, Object> inputs) throws IOException {
        return executor.execute(FlowLoader.loadFromString(yaml), inputs);
    }

    @Nested
    class Basics {

        @Test
        void runsHelloWorld() throws IOException {
            tasks.mockTask("Greet", (inputs, context) -> Map.of("message", "Hello, " + inputs.get("name")));

            ExecutionResult result = run(HELLO_WORLD, Map.of("user_name", "Alice"));

            assertThat(result.success()).isTrue();
            assertThat(result.error()).isNull();
            assertThat(result.exitReason()).isNull();
            assertThat(result.outputs()).isEqualTo(Map.of("message", "Hello, Alice"));
            assertThat(tasks.lastInputs("Greet")).isEqualTo(Map.of("name", "Alice"));
        }

        @Test
        void missingRequiredInputFailsBeforeAnyEvent() throws IOException {
            FlowExecution execution = executor.start(FlowLoader.loadFromString(HELLO_WORLD), Map.of());

            ExecutionResult result = execution.await();

            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.REQUIRED_INPUT_MISSING);
            assertThat(result.error().message()).isEqualTo("Required input 'user_name' not provided to flow 'HelloWorld'");
            assertThat(execution.events().events()).isEmpty();
            assertThat(execution.status()).isEqualTo(FlowExecution.Status.FAILED);
            assertThat(tasks.wasCalled("Greet")).isFalse();
        }

        @Test
        void outputsContainExactlyTheDeclaredNames() throws IOException {
            tasks.mockTask("Compute", Map.of("a", 1L, "b", 2L));

            ExecutionResult result = run("""
                flow: Declared
                outputs:
                  - name: a
                    value: ${compute.a}
                steps:
                  - task: Compute
                    id: compute
                """, Map.of());

            assertThat(result.outputs()).containsOnlyKeys("a").containsEntry("a", 1L);
        }

        @Test
        void rejectsInputOfWrongType() throws IOException {
            ExecutionResult result = run("""
                flow: Typed
                inputs:
                  - name: count
                    type: number
                steps:
                  - task: Count
                """, Map.of("count", "three"));

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
            assertThat(result.error().message()).isEqualTo("Input 'count' of flow 'Typed' must be number, got string");
        }

        @Test
        void optionalInputsUseDefaultOrNull() throws IOException {
            tasks.mockTask("Noop", Map.of());

            ExecutionResult result = run("""
                flow: Optional
                inputs:
                  - name: greeting
                    type: string
                    required: false
                    default: Hi
                  - name: nick
                    required: false
                outputs:
                  - name: greeting
                    value: ${inputs.greeting}
                  - name: nick
                    value: ${inputs.nick}
                steps:
                  - task: Noop
                """, Map.of());

            assertThat(result.success()).isTrue();
            assertThat(result.outputs()).containsEntry("greeting", "Hi").containsEntry("nick", null);
        }

        @Test
        void invalidFlowIsRejectedWithoutRunning() throws IOException {
            tasks.mockTask("A", Map.of());

            ExecutionResult result = run("""
                flow: Invalid
                steps:
                  - task: A
                    id: same
                  - task: A
                    id: same
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(result.error().message()).contains("duplicate step id 'same'");
            assertThat(tasks.calls()).isEmpty();
        }
    }

    @Nested
    class ControlFlow {

        @Test
        void conditionalRunsOnlyTheTakenBranch() throws IOException {
            tasks.mockTask("Big", Map.of()).mockTask("Small", Map.of());

            ExecutionResult result = run("""
                flow: Branch
                inputs:
                  - name: amount
                    type: number
                steps:
                  - if: ${inputs.amount} > 100
                    then:
                      - task: Big
                    else:
                      - task: Small
                """, Map.of("amount", 150L));

            assertThat(result.success()).isTrue();
            assertThat(tasks.wasCalled("Big")).isTrue();
            assertThat(tasks.wasCalled("Small")).isFalse();
        }

        @Test
        void evaluatesStructuredConditions() throws IOException {
            tasks.mockTask("Yes", Map.of()).mockTask("No", Map.of());

            ExecutionResult result = run("""
                flow: Structured
                inputs:
                  - a
                  - b
                steps:
                  - if:
                      all:
                        - ${inputs.a} > 0
                        - any:
                            - ${inputs.b} == 'x'
                            - ${inputs.b} == 'y'
                        - none:
                            - ${inputs.a} > 10
                    then:
                      - task: Yes
                    else:
                      - task: No
                """, Map.of("a", 5L, "b", "y"));

            assertThat(result.success()).isTrue();
            assertThat(tasks.wasCalled("Yes")).isTrue();
            assertThat(tasks.wasCalled("No")).isFalse();
        }

        @Test
        void switchTakesFirstMatchingCase() throws IOException {
            tasks.mockTask("First", Map.of()).mockTask("Second", Map.of()).mockTask("Fallback", Map.of());
            String yaml = """
                flow: Switch
                inputs:
                  - kind
                steps:
                  - switch: ${inputs.kind}
                    cases:
                      - when: [express, priority]
                        do:
                          - task: First
                      - when: express
                        do:
                          - task: Second
                    default:
                      - task: Fallback
                """;

            run(yaml, Map.of("kind", "express"));
            assertThat(tasks.calls()).extracting(MockTaskRegistry.Call::taskName).containsExactly("First");

            tasks.clearCalls();
            run(yaml, Map.of("kind", "standard"));
            assertThat(tasks.calls()).extracting(MockTaskRegistry.Call::taskName).containsExactly("Fallback");
        }

        @Test
        void switchComparesNumbersByValue() throws IOException {
            tasks.mockTask("Two", Map.of());

            run("""
                flow: Numeric
                inputs:
                  - level
                steps:
                  - switch: ${inputs.level}
                    cases:
                      - when: 2
                        do:
                          - task: Two
                """, Map.of("level", 2.0));

            assertThat(tasks.wasCalled("Two")).isTrue();
        }

        @Test
        void loopRunsInOrderAndCollectsLists() throws IOException {
            tasks.mockTask("Double", (inputs, context) ->
                Map.of("value", (Long) inputs.get("n") * 2, "index", inputs.get("index")));

            ExecutionResult result = run("""
                flow: Loop
                inputs:
                  - items
                outputs:
                  - name: values
                    value: ${doubled.value}
                  - name: last
                    value: ${d.value}
                steps:
                  - for_each: ${inputs.items}
                    id: doubled
                    as: n
                    outputs: [value]
                    do:
                      - task: Double
                        id: d
                        inputs:
                          n: ${n}
                          index: ${loop.index}
                """, Map.of("items", List.of(1L, 2L, 3L)));

            assertThat(result.success()).isTrue();
            assertThat(result.outputs()).containsEntry("values", List.of(2L, 4L, 6L)).containsEntry("last", 6L);
            assertThat(tasks.calls("Double")).extracting(c -> c.inputs().get("index")).containsExactly(0L, 1L, 2L);
        }

        @Test
        void loopCanCollectLastValue() throws IOException {
            tasks.mockTask("Echo", (inputs, context) -> Map.of("value", inputs.get("v")));

            ExecutionResult result = run("""
                flow: Last
                outputs:
                  - name: last
                    value: ${each.value}
                steps:
                  - for_each: [a, b, c]
                    id: each
                    collect: last
                    outputs: [value]
                    do:
                      - task: Echo
                        inputs:
                          v: ${item}
                """, Map.of());

            assertThat(result.outputs()).containsEntry("last", "c");
        }

        @Test
        void loopOverNonListIsTypeMismatch() throws IOException {
            ExecutionResult result = run("""
                flow: NotAList
                steps:
                  - for_each: ${inputs.items}
                    id: each
                    do:
                      - task: Anything
                """, Map.of("items", "abc"));

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
            assertThat(result.error().message()).isEqualTo("for_each expects a list, got string");
            assertThat(result.error().stepId()).isEqualTo("each");
        }

        @Test
        void loopFailureStopsRemainingIterations() throws IOException {
            tasks.mockTask("Process", (inputs, context) -> {
                if (Long.valueOf(2L).equals(inputs.get("n"))) {
                    throw TaskException.nonRetryable("cannot process 2");
                }
                return Map.of();
            }).mockTask("After", Map.of());

            ExecutionResult result = run("""
                flow: Abort
                steps:
                  - for_each: [1, 2, 3]
                    do:
                      - task: Process
                        id: process
                        inputs:
                          n: ${item}
                  - task: After
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TASK_FAILED);
            assertThat(result.error().stepId()).isEqualTo("process");
            assertThat(tasks.callCount("Process")).isEqualTo(2);
            assertThat(tasks.wasCalled("After")).isFalse();
        }

        @Test
        void exitUnwindsThroughParallelLoopAndConditional() throws IOException {
            tasks.mockTask("Visit", Map.of()).mockTask("After", Map.of());

            ExecutionResult result = run("""
                flow: Search
                inputs:
                  - items
                outputs:
                  - name: found
                    value: ${never.there}
                steps:
                  - parallel:
                      - - for_each: ${inputs.items}
                          as: n
                          do:
                            - if: ${n} == 2
                              then:
                                - exit:
                                    reason: Found it
                                    outputs:
                                      found: ${n}
                            - task: Visit
                  - task: After
                """, Map.of("items", List.of(1L, 2L, 3L)));

            assertThat(result.success()).isTrue();
            assertThat(result.exitReason()).isEqualTo("Found it");
            assertThat(result.outputs()).isEqualTo(Map.of("found", 2L));
            assertThat(tasks.callCount("Visit")).isEqualTo(1);
            assertThat(tasks.wasCalled("After")).isFalse();
        }
    }

    @Nested
    class ErrorHandling {

        @Test
        void onErrorOutputsStandInForFailedStep() throws IOException {
            tasks.mockFailure("Fetch", TaskException.nonRetryable("service down"))
                .mockTask("Fallback", Map.of("data", "cached"));

            ExecutionResult result = run("""
                flow: Fallback
                outputs:
                  - name: data
                    value: ${fetch.data}
                steps:
                  - task: Fetch
                    id: fetch
                    outputs: [data]
                    on_error:
                      - task: Fallback
                        id: fallback
                        inputs:
                          kind: ${error.kind}
                          reason: ${error.message}
                          step: ${error.step}
                """, Map.of());

            assertThat(result.success()).isTrue();
            assertThat(result.outputs()).containsEntry("data", "cached");
            assertThat(tasks.lastInputs("Fallback"))
                .containsEntry("kind", "TASK_FAILED")
                .containsEntry("reason", "Task 'Fetch' failed: service down")
                .containsEntry("step", "fetch");
        }

        @Test
        void nearestAncestorHandlesNestedFailure() throws IOException {
            tasks.mockFailure("Risky", TaskException.nonRetryable("nope"))
                .mockTask("Recover", Map.of())
                .mockTask("Next", Map.of());

            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Ancestor
                steps:
                  - if: true
                    id: guard
                    then:
                      - task: Risky
                        id: risky
                    on_error:
                      - task: Recover
                  - task: Next
                """), Map.of());
            ExecutionResult result = execution.await();

            assertThat(result.success()).isTrue();
            assertThat(tasks.wasCalled("Recover")).isTrue();
            assertThat(tasks.wasCalled("Next")).isTrue();
            List<ExecutionEvent> failures = execution.events().events().stream()
                .filter(e -> e.type() == EventType.STEP_FAILED)
                .toList();
            assertThat(failures).extracting(ExecutionEvent::stepId).containsExactly("risky", "guard");
            assertThat(failures).extracting(e -> e.payload().get("handled")).containsExactly(false, true);
        }

        @Test
        void retriesWithBackoff() throws IOException {
            tasks.mockSequence("Flaky", new TaskException("boom"), new TaskException("boom again"), Map.of("ok", true));

            long started = System.nanoTime();
            ExecutionResult result = run("""
                flow: Retry
                outputs:
                  - name: ok
                    value: ${flaky.ok}
                steps:
                  - task: Flaky
                    id: flaky
                    retry:
                      max_attempts: 3
                      delay: 50
                      backoff: 2
                """, Map.of());
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(result.success()).isTrue();
            assertThat(result.outputs()).containsEntry("ok", true);
            assertThat(tasks.callCount("Flaky")).isEqualTo(3);
            assertThat(elapsedMillis).isGreaterThanOrEqualTo(140L);
        }

        @Test
        void exhaustedRetriesReportAttemptCount() throws IOException {
            tasks.mockFailure("Down", new TaskException("unavailable"));

            ExecutionResult result = run("""
                flow: Exhausted
                steps:
                  - task: Down
                    id: down
                    retry:
                      max_attempts: 2
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TASK_FAILED);
            assertThat(result.error().message()).isEqualTo("Task 'Down' failed after 2 attempts: unavailable");
            assertThat(result.error().stepId()).isEqualTo("down");
            assertThat(tasks.callCount("Down")).isEqualTo(2);
        }

        @Test
        void nonRetryableFailureIsNotRetried() throws IOException {
            tasks.mockFailure("BadRequest", TaskException.nonRetryable("bad request"));

            ExecutionResult result = run("""
                flow: NoRetry
                steps:
                  - task: BadRequest
                    retry:
                      max_attempts: 5
                """, Map.of());

            assertThat(result.success()).isFalse();
            assertThat(tasks.callCount("BadRequest")).isEqualTo(1);
        }

        @Test
        void unexpectedTaskExceptionsAreRetried() throws IOException {
            tasks.mockFailure("Buggy", new IllegalStateException("state"));

            ExecutionResult result = run("""
                flow: Buggy
                steps:
                  - task: Buggy
                    retry:
                      max_attempts: 2
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TASK_FAILED);
            assertThat(tasks.callCount("Buggy")).isEqualTo(2);
        }

        @Test
        void unknownTaskIsTaskNotFound() throws IOException {
            ExecutionResult result = run("""
                flow: Unknown
                steps:
                  - task: Missing
                    id: missing
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.TASK_NOT_FOUND);
            assertThat(result.error().message()).isEqualTo("Task 'Missing' not found in registry");
            assertThat(result.error().stepId()).isEqualTo("missing");
        }

        @Test
        void missingSubflowBypassesOnError() throws IOException {
            tasks.mockTask("Recover", Map.of());
            ExecutionResult result = run("""
                flow: Fatal
                steps:
                  - subflow: does_not_exist
                    id: call
                    on_error:
                      - task: Recover
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.VALIDATION);
            assertThat(tasks.wasCalled("Recover")).isFalse();
        }

        @Test
        void nanInConditionFailsTheStepWithTerminalEvents() throws IOException {
            tasks.mockTask("Measure", Map.of("v", Double.NaN));

            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Measuring
                steps:
                  - task: Measure
                    id: m
                  - if: ${m.v} > 0
                    id: check
                    then:
                      - task: Report
                """), Map.of());
            ExecutionResult result = execution.await();

            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
            assertThat(result.error().stepId()).isEqualTo("check");
            assertThat(execution.events().events()).extracting(ExecutionEvent::type).containsExactly(
                EventType.FLOW_STARTED, EventType.STEP_STARTED, EventType.STEP_COMPLETED,
                EventType.STEP_STARTED, EventType.STEP_FAILED, EventType.FLOW_FAILED);
            assertThat(tasks.wasCalled("Report")).isFalse();
        }

        @Test
        void integerOverflowInOutputsFailsTheFlow() throws IOException {
            tasks.mockTask("Noop", Map.of());

            ExecutionResult result = run("""
                flow: Doubling
                inputs:
                  - name: n
                    type: number
                outputs:
                  - name: r
                    value: ${inputs.n * 2}
                steps:
                  - task: Noop
                """, Map.of("n", Long.MAX_VALUE));

            assertThat(result.success()).isFalse();
            assertThat(result.outputs()).isEmpty();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
            assertThat(result.error().message()).isEqualTo("Integer overflow in '*'");
        }
    }

    @Nested
    class References {

        @Test
        void undefinedReferenceFailsTheStep() throws IOException {
            tasks.mockTask("Use", Map.of());

            ExecutionResult result = run("""
                flow: Undefined
                steps:
                  - task: Use
                    id: use
                    inputs:
                      value: ${inputs.nope}
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.UNDEFINED_REFERENCE);
            assertThat(result.error().message()).contains("inputs.nope");
            assertThat(result.error().stepId()).isEqualTo("use");
            assertThat(tasks.wasCalled("Use")).isFalse();
        }

        @Test
        void missingDeclaredOutputIsUndefinedReference() throws IOException {
            tasks.mockTask("Partial", Map.of("other", 1L));

            ExecutionResult result = run("""
                flow: Partial
                steps:
                  - task: Partial
                    id: partial
                    outputs: [data]
                """, Map.of());

            assertThat(result.error().kind()).isEqualTo(ErrorKind.UNDEFINED_REFERENCE);
            assertThat(result.error().message()).isEqualTo("Task 'Partial' did not return declared output 'data'");
        }

        @Test
        void optionalInputsResolveToNull() throws IOException {
            tasks.mockTask("Greet", Map.of());

            ExecutionResult result = run("""
                flow: OptionalRefs
                steps:
                  - task: Greet
                    inputs:
                      name: Bob
                      nick: ${inputs.nick}
                    optional_inputs: [nick]
                """, Map.of());

            assertThat(result.success()).isTrue();
            assertThat(tasks.lastInputs("Greet")).containsEntry("name", "Bob").containsEntry("nick", null);
        }

        @Test
        void generatedIdsAreNotPublished() throws IOException {
            tasks.mockTask("Anon", Map.of("x", 1L));

            ExecutionResult result = run("""
                flow: Anonymous
                outputs:
                  - name: x
                    value: ${default(x, 'none')}
                steps:
                  - task: Anon
                """, Map.of());

            assertThat(result.outputs()).containsEntry("x", "none");
        }
    }

    @Nested
    class Events {

        @Test
        void emitsOrderedEventsForSuccessfulRun() throws IOException {
            tasks.mockTask("Greet", Map.of("message", "hi"));

            FlowExecution execution = executor.start(FlowLoader.loadFromString(HELLO_WORLD), Map.of("user_name", "Al"));
            execution.await();

            List<ExecutionEvent> events = execution.events().events();
            assertThat(events).extracting(ExecutionEvent::type).containsExactly(
                EventType.FLOW_STARTED, EventType.STEP_STARTED, EventType.STEP_COMPLETED, EventType.FLOW_COMPLETED);
            assertThat(events).extracting(ExecutionEvent::sequence).containsExactly(1L, 2L, 3L, 4L);
            assertThat(events).allSatisfy(e -> {
                assertThat(e.executionId()).isEqualTo(execution.executionId());
                assertThat(e.flow()).isEqualTo("HelloWorld");
            });
            assertThat(events.get(1).stepId()).isEqualTo("greet");
            assertThat(events.get(2).payload()).containsEntry("outputs", List.of("message"));
            assertThat(events.get(3).payload()).containsEntry("outputs", List.of("message")).containsEntry("steps", 1);
            assertThat(execution.status()).isEqualTo(FlowExecution.Status.COMPLETED);
        }

        @Test
        void stepFailedPrecedesFlowFailed() throws IOException {
            tasks.mockFailure("Boom", TaskException.nonRetryable("kaput"));

            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Failing
                steps:
                  - task: Boom
                    id: boom
                """), Map.of());
            execution.await();

            List<ExecutionEvent> events = execution.events().events();
            assertThat(events).extracting(ExecutionEvent::type).containsExactly(
                EventType.FLOW_STARTED, EventType.STEP_STARTED, EventType.STEP_FAILED, EventType.FLOW_FAILED);
            assertThat(events.get(2).payload())
                .containsEntry("error_kind", "TASK_FAILED")
                .containsEntry("handled", false);
            assertThat(events.get(3).payload()).containsEntry("step", "boom");
        }

        @Test
        void exitIsReportedOnFlowCompleted() throws IOException {
            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Early
                steps:
                  - exit: Nothing to do
                """), Map.of());
            ExecutionResult result = execution.await();

            assertThat(result.exitReason()).isEqualTo("Nothing to do");
            ExecutionEvent last = execution.events().events().get(execution.events().events().size() - 1);
            assertThat(last.type()).isEqualTo(EventType.FLOW_COMPLETED);
            assertThat(last.payload()).containsEntry("exit_reason", "Nothing to do");
        }
    }

    @Nested
    class Cancellation {

        @Test
        void cancelInterruptsRunningTaskAndRunsOnCancel() throws Exception {
            var started = new CountDownLatch(1);
            tasks.mockTask("Block", (inputs, context) -> {
                started.countDown();
                Thread.sleep(10_000);
                return Map.of();
            }).mockTask("Cleanup", Map.of()).mockTask("Never", Map.of());

            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Cancellable
                steps:
                  - task: Block
                    id: block
                  - task: Never
                on_cancel:
                  - task: Cleanup
                """), Map.of());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(execution.cancel("user abort")).isTrue();
            ExecutionResult result = execution.result().get(5, TimeUnit.SECONDS);

            assertThat(result.success()).isFalse();
            assertThat(result.error().kind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.error().message()).isEqualTo("user abort");
            assertThat(execution.status()).isEqualTo(FlowExecution.Status.CANCELLED);
            assertThat(tasks.callCount("Cleanup")).isEqualTo(1);
            assertThat(tasks.wasCalled("Never")).isFalse();
            assertThat(execution.cancel("again")).isFalse();
        }

        @Test
        void cancelDuringRetryWaitStopsRetrying() throws Exception {
            var firstAttempt = new CountDownLatch(1);
            tasks.mockTask("Flaky", (inputs, context) -> {
                firstAttempt.countDown();
                throw new TaskException("try later");
            });

            FlowExecution execution = executor.start(FlowLoader.loadFromString("""
                flow: Waiting
                steps:
                  - task: Flaky
                    retry:
                      max_attempts: 3
                      delay: 10000
                """), Map.of());
            assertThat(firstAttempt.await(5, TimeUnit.SECONDS)).isTrue();

            execution.cancel(null);
            ExecutionResult result = execution.result().get(5, TimeUnit.SECONDS);

            assertThat(result.error().kind()).isEqualTo(ErrorKind.CANCELLED);
            assertThat(result.error().message()).isEqualTo("Flow execution cancelled");
            assertThat(tasks.callCount("Flaky")).isEqualTo(1);
        }
    }
}
