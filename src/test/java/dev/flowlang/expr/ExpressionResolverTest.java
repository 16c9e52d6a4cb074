package dev.flowlang.expr;

import dev.flowlang.error.TypeMismatchException;
import dev.flowlang.error.UndefinedReferenceException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionResolverTest {

    private final ExpressionResolver resolver = new ExpressionResolver();

    private final Scope scope = Scope.root(Map.of(
        "inputs", Map.of("name", "Alice", "count", 3L, "items", List.of(1L, 2L, 3L)),
        "fetch", Map.of("user", Map.of("email", "alice@example.com", "roles", List.of("admin", "dev")))
    ));

    @Test
    void interpolatesIntoSurroundingText() {
        assertThat(resolver.resolve("Hello, ${inputs.name}!", scope)).isEqualTo("Hello, Alice!");
    }

    @Test
    void singleExpressionKeepsNativeType() {
        assertThat(resolver.resolve("${inputs.count}", scope)).isEqualTo(3L);
        assertThat(resolver.resolve("${inputs.items}", scope)).isEqualTo(List.of(1L, 2L, 3L));
    }

    @Test
    void stringsWithoutMarkersPassThrough() {
        assertThat(resolver.resolve("plain text", scope)).isEqualTo("plain text");
        assertThat(resolver.resolve(42L, scope)).isEqualTo(42L);
    }

    @Test
    void escapedMarkerIsLiteral() {
        assertThat(resolver.resolve("cost: $${inputs.name}", scope)).isEqualTo("cost: ${inputs.name}");
    }

    @Test
    void rendersCollectionsAsJsonInsideText() {
        assertThat(resolver.resolve("items=${inputs.items}", scope)).isEqualTo("items=[1,2,3]");
    }

    @Test
    void resolvesNestedMapsAndLists() {
        Object resolved = resolver.resolve(Map.of(
            "to", "${fetch.user.email}",
            "tags", List.of("${fetch.user.roles[0]}", "static")
        ), scope);

        assertThat(resolved).isEqualTo(Map.of("to", "alice@example.com", "tags", List.of("admin", "static")));
    }

    @Test
    void evaluatesArithmeticAndFunctions() {
        assertThat(resolver.resolve("${inputs.count + 1}", scope)).isEqualTo(4L);
        assertThat(resolver.resolve("${7 / 2}", scope)).isEqualTo(3.5);
        assertThat(resolver.resolve("${length(inputs.items)}", scope)).isEqualTo(3L);
        assertThat(resolver.resolve("${upper(inputs.name)}", scope)).isEqualTo("ALICE");
        assertThat(resolver.resolve("${inputs.items[-1]}", scope)).isEqualTo(3L);
    }

    @Test
    void defaultFallsBackForMissingPaths() {
        assertThat(resolver.resolve("${default(inputs.nickname, 'anon')}", scope)).isEqualTo("anon");
        assertThat(resolver.resolve("${default(inputs.name, 'anon')}", scope)).isEqualTo("Alice");
    }

    @Test
    void missingRootIsUndefinedReference() {
        assertThatThrownBy(() -> resolver.resolve("${missing.value}", scope))
            .isInstanceOf(UndefinedReferenceException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void missingKeyIsUndefinedReference() {
        assertThatThrownBy(() -> resolver.resolve("${fetch.user.phone}", scope))
            .isInstanceOf(UndefinedReferenceException.class)
            .hasMessageContaining("phone");
    }

    @Test
    void incompatibleOperandsAreTypeMismatch() {
        assertThatThrownBy(() -> resolver.resolve("${inputs.name * 2}", scope))
            .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> resolver.resolve("${inputs.count / 0}", scope))
            .isInstanceOf(TypeMismatchException.class);
    }

    @Test
    void conditionsMixReferencesWithOperators() {
        assertThat(resolver.evaluateCondition("${inputs.count} > 2", scope)).isTrue();
        assertThat(resolver.evaluateCondition("${inputs.count} > 2 and ${inputs.name} == 'Bob'", scope)).isFalse();
        assertThat(resolver.evaluateCondition("inputs.name == 'Alice'", scope)).isTrue();
        assertThat(resolver.evaluateCondition("4 not in inputs.items", scope)).isTrue();
        assertThat(resolver.evaluateCondition("'admin' in fetch.user.roles", scope)).isTrue();
    }

    @Test
    void conditionsUseTruthiness() {
        assertThat(resolver.evaluateCondition("${inputs.items}", scope)).isTrue();
        assertThat(resolver.evaluateCondition("${inputs.count - 3}", scope)).isFalse();
    }

    @Test
    void numericComparisonIgnoresRepresentation() {
        assertThat(resolver.evaluateCondition("${inputs.count} == 3.0", scope)).isTrue();
    }

    @Test
    void reportsSyntaxErrors() {
        assertThat(resolver.checkSyntax("${inputs.}")).hasSize(1);
        assertThat(resolver.checkSyntax(Map.of("a", "${unknownFn(1)}"))).singleElement()
            .asString().contains("unknown function");
        assertThat(resolver.checkSyntax("Hello ${inputs.name}")).isEmpty();
        assertThat(resolver.checkConditionSyntax("${a} >")).isNotEmpty();
    }

    @Test
    void integerOverflowIsTypeMismatch() {
        Scope limits = Scope.root(Map.of("big", Long.MAX_VALUE, "small", Long.MIN_VALUE));

        assertThatThrownBy(() -> resolver.resolve("${big * 2}", limits))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessage("Integer overflow in '*'");
        assertThatThrownBy(() -> resolver.resolve("${big + 1}", limits))
            .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> resolver.resolve("${small - 1}", limits))
            .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> resolver.resolve("${-small}", limits))
            .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> resolver.resolve("${abs(small)}", limits))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessage("Integer overflow in 'abs'");
        assertThat(resolver.resolve("${big - 1}", limits)).isEqualTo(Long.MAX_VALUE - 1);
    }

    @Test
    void nonFiniteNumbersCompareWithoutExactConversion() {
        Scope measured = Scope.root(Map.of("inf", Double.POSITIVE_INFINITY, "nan", Double.NaN));

        assertThat(resolver.evaluateCondition("${inf} > 1000", measured)).isTrue();
        assertThat(resolver.evaluateCondition("${inf} == ${inf}", measured)).isTrue();
        assertThat(resolver.evaluateCondition("${nan} == ${nan}", measured)).isFalse();
        assertThat(resolver.evaluateCondition("${nan} != 1", measured)).isTrue();
        assertThatThrownBy(() -> resolver.evaluateCondition("${nan} > 0", measured))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessage("Cannot apply '>' to NaN");
    }

    @Test
    void numberParsesExponentNotation() {
        assertThat(resolver.resolve("${number('1e5')}", scope)).isEqualTo(100000.0);
        assertThat(resolver.resolve("${number('2.5E-1')}", scope)).isEqualTo(0.25);
        assertThat(resolver.resolve("${number('42')}", scope)).isEqualTo(42L);
    }
}
