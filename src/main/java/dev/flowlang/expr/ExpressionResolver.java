package dev.flowlang.expr;

import dev.flowlang.error.FlowException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code ${...}} references and expressions against a {@link Scope}.
 *
 * <p>Strings without an interpolation marker pass through unchanged. A string that is exactly one
 * {@code ${expr}} yields the expression's native value; any other string is resolved segment by
 * segment and concatenated. Maps and lists are resolved recursively.
 *
 * <p>Instances are stateless apart from a parse cache and may be shared across threads.
 */
public final class ExpressionResolver {

    private final Map<String, Template> templates = new ConcurrentHashMap<>();
    private final Map<String, Expression> expressions = new ConcurrentHashMap<>();

    /**
     * Resolve a value from a flow document against the scope.
     *
     * @throws dev.flowlang.error.UndefinedReferenceException when a referenced path does not exist
     * @throws dev.flowlang.error.TypeMismatchException when an operator gets incompatible operands
     */
    public Object resolve(Object value, Scope scope) {
        if (value instanceof String text) {
            return resolveString(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            var resolved = new LinkedHashMap<String, Object>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                resolved.put(String.valueOf(entry.getKey()), resolve(entry.getValue(), scope));
            }
            return resolved;
        }
        if (value instanceof List<?> list) {
            var resolved = new ArrayList<Object>(list.size());
            for (Object item : list) {
                resolved.add(resolve(item, scope));
            }
            return resolved;
        }
        return value;
    }

    /** Evaluate a bare expression (no {@code ${}} markers), e.g. {@code inputs.count + 1}. */
    public Object evaluate(String expression, Scope scope) {
        return Evaluator.evaluate(expression(expression), scope);
    }

    /**
     * Evaluate a condition to a boolean. Accepts {@code ${expr}}, a bare expression, or text
     * mixing references with operators such as {@code ${values.a} > 0}. Non-boolean results are
     * judged by truthiness.
     */
    public boolean evaluateCondition(String condition, Scope scope) {
        return Values.isTruthy(Evaluator.evaluate(conditionExpression(condition), scope));
    }

    /**
     * Syntax errors in every string nested in {@code value}; empty when all parse.
     */
    public List<String> checkSyntax(Object value) {
        var errors = new ArrayList<String>();
        collectSyntaxErrors(value, errors, false);
        return errors;
    }

    /** Syntax errors of a condition string; empty when it parses. */
    public List<String> checkConditionSyntax(String condition) {
        var errors = new ArrayList<String>();
        collectSyntaxErrors(condition, errors, true);
        return errors;
    }

    private void collectSyntaxErrors(Object value, List<String> errors, boolean condition) {
        if (value instanceof String text) {
            try {
                if (condition) {
                    conditionExpression(text);
                } else if (Template.containsMarker(text)) {
                    template(text);
                }
            } catch (FlowException e) {
                errors.add(e.getMessage());
            }
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collectSyntaxErrors(v, errors, condition));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> collectSyntaxErrors(v, errors, condition));
        }
    }

    private Object resolveString(String text, Scope scope) {
        if (!Template.containsMarker(text)) {
            return text;
        }
        Template template = template(text);
        if (template.isSingleExpression()) {
            return Evaluator.evaluate(template.parts().get(0).expression(), scope);
        }
        var sb = new StringBuilder();
        for (Template.Part part : template.parts()) {
            if (part.isExpression()) {
                sb.append(Values.stringify(Evaluator.evaluate(part.expression(), scope)));
            } else {
                sb.append(part.literal());
            }
        }
        return sb.toString();
    }

    private Template template(String text) {
        return templates.computeIfAbsent(text, Template::parse);
    }

    private Expression expression(String source) {
        return expressions.computeIfAbsent(source, ExpressionParser::parse);
    }

    private Expression conditionExpression(String condition) {
        if (!Template.containsMarker(condition)) {
            return expression(condition.trim());
        }
        Template template = template(condition);
        if (template.isSingleExpression()) {
            return template.parts().get(0).expression();
        }
        return expression(template.toExpressionSource());
    }
}
