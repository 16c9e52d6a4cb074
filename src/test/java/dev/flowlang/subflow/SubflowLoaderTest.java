package dev.flowlang.subflow;

import dev.flowlang.error.CircularDependencyException;
import dev.flowlang.error.FlowException;
import dev.flowlang.error.ValidationException;
import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.FlowDocument;
import dev.flowlang.model.Step;
import dev.flowlang.model.StepKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubflowLoaderTest {

    private static final FlowSource CALLER = new FlowSource("/flows/main/flow.yaml", "main", null);
    private static final FlowSource CHILD = new FlowSource("/flows/child/flow.yaml", "child", null);

    @Mock
    private SubflowResolver resolver;

    private static FlowDocument flow(String name) {
        return new FlowDocument(name, null, null, null,
            List.of(Step.of("work", new StepKind.Task("Work", null))), null, null, null, null);
    }

    @Test
    void readsEachDocumentOnce() throws IOException {
        FlowDocument child = flow("child");
        when(resolver.resolve(eq("child"), any())).thenReturn(Optional.of(CHILD));
        when(resolver.read(CHILD)).thenReturn(child);
        var loader = new SubflowLoader(resolver, 8);

        LoadedFlow first = loader.load("child", List.of(CALLER));
        LoadedFlow second = loader.load("child", List.of(CALLER));

        assertThat(first.document()).isSameAs(child);
        assertThat(second.document()).isSameAs(child);
        assertThat(first.source()).isEqualTo(CHILD);
        verify(resolver, times(1)).read(CHILD);
    }

    @Test
    void unresolvedReferenceIsValidationError() {
        when(resolver.resolve(eq("ghost"), any())).thenReturn(Optional.empty());
        var loader = new SubflowLoader(resolver, 8);

        assertThatThrownBy(() -> loader.load("ghost", List.of(CALLER)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Subflow 'ghost' not found (called from 'main')");
    }

    @Test
    void refusesToReenterFlowOnTheChain() {
        when(resolver.resolve(eq("main"), any())).thenReturn(Optional.of(CALLER));
        var loader = new SubflowLoader(resolver, 8);

        assertThatThrownBy(() -> loader.load("main", List.of(CALLER, CHILD)))
            .isInstanceOf(CircularDependencyException.class)
            .hasMessage("Circular subflow dependency detected: main -> child -> main");
    }

    @Test
    void cycleCheckComparesIdentitiesNotNames() {
        var sameNameElsewhere = new FlowSource("/other/main/flow.yaml", "main", null);

        SubflowLoader.checkCycle(List.of(CALLER), sameNameElsewhere);

        assertThatThrownBy(() -> SubflowLoader.checkCycle(List.of(CALLER, CHILD),
                new FlowSource(CHILD.identity(), "renamed", null)))
            .isInstanceOfSatisfying(CircularDependencyException.class,
                e -> assertThat(e.chain()).containsExactly("main", "child", "renamed"));
    }

    @Test
    void enforcesMaximumDepth() {
        when(resolver.resolve(eq("child"), any())).thenReturn(Optional.of(CHILD));
        var loader = new SubflowLoader(resolver, 2);
        var middle = new FlowSource("/flows/middle/flow.yaml", "middle", null);

        assertThatThrownBy(() -> loader.load("child", List.of(CALLER, middle)))
            .isInstanceOfSatisfying(FlowException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.CIRCULAR_DEPENDENCY))
            .hasMessageContaining("maximum depth of 2");
    }

    @Test
    void invalidSubflowIsRejected() throws IOException {
        FlowDocument broken = new FlowDocument("child", null, null, null, null, null, null, null, null);
        when(resolver.resolve(eq("child"), any())).thenReturn(Optional.of(CHILD));
        when(resolver.read(CHILD)).thenReturn(broken);
        var loader = new SubflowLoader(resolver, 8);

        assertThatThrownBy(() -> loader.load("child", List.of(CALLER)))
            .isInstanceOfSatisfying(ValidationException.class,
                e -> assertThat(e.errors()).containsExactly("Flow definition must have at least one step"));
    }

    @Test
    void readFailureIsReportedAsValidation() throws IOException {
        when(resolver.resolve(eq("child"), any())).thenReturn(Optional.of(CHILD));
        when(resolver.read(CHILD)).thenThrow(new IOException("disk on fire"));
        var loader = new SubflowLoader(resolver, 8);

        assertThatThrownBy(() -> loader.load("child", List.of(CALLER)))
            .isInstanceOfSatisfying(FlowException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION))
            .hasMessage("Failed to load subflow 'child': disk on fire");
    }
}
