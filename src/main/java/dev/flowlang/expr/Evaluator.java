package dev.flowlang.expr;

import dev.flowlang.error.TypeMismatchException;
import dev.flowlang.error.UndefinedReferenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking evaluator. Pure: reads the scope, never writes it.
 */
final class Evaluator {

    private Evaluator() {}

    static Object evaluate(Expression expression, Scope scope) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }
        if (expression instanceof Expression.Reference reference) {
            return scope.get(reference.name());
        }
        if (expression instanceof Expression.Member member) {
            return member(member, evaluate(member.target(), scope));
        }
        if (expression instanceof Expression.Index index) {
            return index(index, evaluate(index.target(), scope), evaluate(index.index(), scope));
        }
        if (expression instanceof Expression.ListLiteral list) {
            var values = new ArrayList<Object>(list.elements().size());
            for (Expression element : list.elements()) {
                values.add(evaluate(element, scope));
            }
            return values;
        }
        if (expression instanceof Expression.Call call) {
            return call(call, scope);
        }
        if (expression instanceof Expression.Unary unary) {
            return unary(unary, scope);
        }
        if (expression instanceof Expression.Binary binary) {
            return binary(binary, scope);
        }
        throw new IllegalStateException("Unhandled expression: " + expression);
    }

    private static Object member(Expression.Member member, Object target) {
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(member.name())) {
                return map.get(member.name());
            }
            throw new UndefinedReferenceException(member.describe(),
                "Cannot resolve path: %s (no key '%s')".formatted(member.describe(), member.name()));
        }
        throw new UndefinedReferenceException(member.describe(),
            "Cannot resolve path: %s (%s has no attribute '%s')"
                .formatted(member.describe(), Values.typeName(target), member.name()));
    }

    private static Object index(Expression.Index index, Object target, Object key) {
        if (target instanceof List<?> list) {
            if (!Values.isIntegral(key)) {
                throw new TypeMismatchException("List index must be an integer in %s, got %s"
                    .formatted(index.describe(), Values.typeName(key)));
            }
            long i = ((Number) key).longValue();
            if (i < 0) {
                i += list.size();
            }
            if (i < 0 || i >= list.size()) {
                throw new UndefinedReferenceException(index.describe(),
                    "Index %s out of range in %s (size %d)".formatted(key, index.describe(), list.size()));
            }
            return list.get((int) i);
        }
        if (target instanceof Map<?, ?> map) {
            Object mapKey = key instanceof String ? key : Values.stringify(key);
            if (map.containsKey(mapKey)) {
                return map.get(mapKey);
            }
            throw new UndefinedReferenceException(index.describe(),
                "Cannot resolve path: %s (no key '%s')".formatted(index.describe(), mapKey));
        }
        if (target instanceof String s && Values.isIntegral(key)) {
            long i = ((Number) key).longValue();
            if (i < 0) {
                i += s.length();
            }
            if (i < 0 || i >= s.length()) {
                throw new UndefinedReferenceException(index.describe(), "Index %s out of range in %s".formatted(key, index.describe()));
            }
            return String.valueOf(s.charAt((int) i));
        }
        throw new TypeMismatchException("Cannot index %s in %s".formatted(Values.typeName(target), index.describe()));
    }

    private static Object call(Expression.Call call, Scope scope) {
        if (call.function().equals(Functions.DEFAULT)) {
            if (call.arguments().size() != 2) {
                throw new TypeMismatchException("default() takes 2 argument(s), got " + call.arguments().size());
            }
            Object value;
            try {
                value = evaluate(call.arguments().get(0), scope);
            } catch (UndefinedReferenceException e) {
                value = null;
            }
            return value != null ? value : evaluate(call.arguments().get(1), scope);
        }
        var args = new ArrayList<Object>(call.arguments().size());
        for (Expression argument : call.arguments()) {
            args.add(evaluate(argument, scope));
        }
        return Functions.call(call.function(), args);
    }

    private static Object unary(Expression.Unary unary, Scope scope) {
        Object operand = evaluate(unary.operand(), scope);
        if (unary.operator().equals("not")) {
            return !Values.isTruthy(operand);
        }
        if (operand instanceof Number n) {
            if (!Values.isIntegral(n)) {
                return -n.doubleValue();
            }
            try {
                return Math.negateExact(n.longValue());
            } catch (ArithmeticException e) {
                throw overflow("-", e);
            }
        }
        throw new TypeMismatchException("Cannot negate " + Values.typeName(operand));
    }

    private static Object binary(Expression.Binary binary, Scope scope) {
        String op = binary.operator();
        if (op.equals("and")) {
            return Values.isTruthy(evaluate(binary.left(), scope)) && Values.isTruthy(evaluate(binary.right(), scope));
        }
        if (op.equals("or")) {
            return Values.isTruthy(evaluate(binary.left(), scope)) || Values.isTruthy(evaluate(binary.right(), scope));
        }
        Object left = evaluate(binary.left(), scope);
        Object right = evaluate(binary.right(), scope);
        switch (op) {
            case "==":
                return Values.equal(left, right);
            case "!=":
                return !Values.equal(left, right);
            case "<":
                return Values.compare(left, right, op) < 0;
            case "<=":
                return Values.compare(left, right, op) <= 0;
            case ">":
                return Values.compare(left, right, op) > 0;
            case ">=":
                return Values.compare(left, right, op) >= 0;
            case "in":
                return contains(right, left);
            case "+":
                return plus(left, right);
            default:
                return arithmetic(op, left, right);
        }
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof Collection<?> c) {
            for (Object element : c) {
                if (Values.equal(element, item)) return true;
            }
            return false;
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(item);
        }
        if (container instanceof String s && item instanceof String sub) {
            return s.contains(sub);
        }
        throw new TypeMismatchException("Cannot apply 'in' to %s and %s"
            .formatted(Values.typeName(item), Values.typeName(container)));
    }

    private static Object plus(Object left, Object right) {
        if (left instanceof String a && right instanceof String b) {
            return a + b;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            var joined = new ArrayList<Object>(a);
            joined.addAll(b);
            return joined;
        }
        return arithmetic("+", left, right);
    }

    private static Object arithmetic(String op, Object left, Object right) {
        if (!(left instanceof Number a) || !(right instanceof Number b)) {
            throw new TypeMismatchException("Cannot apply '%s' to %s and %s"
                .formatted(op, Values.typeName(left), Values.typeName(right)));
        }
        boolean integral = Values.isIntegral(a) && Values.isIntegral(b);
        try {
            return arithmetic(op, a, b, integral);
        } catch (ArithmeticException e) {
            throw overflow(op, e);
        }
    }

    private static Object arithmetic(String op, Number a, Number b, boolean integral) {
        switch (op) {
            case "+":
                return integral ? (Object) Math.addExact(a.longValue(), b.longValue()) : (Object) (a.doubleValue() + b.doubleValue());
            case "-":
                return integral ? (Object) Math.subtractExact(a.longValue(), b.longValue()) : (Object) (a.doubleValue() - b.doubleValue());
            case "*":
                return integral ? (Object) Math.multiplyExact(a.longValue(), b.longValue()) : (Object) (a.doubleValue() * b.doubleValue());
            case "/":
                if (b.doubleValue() == 0.0) {
                    throw new TypeMismatchException("Division by zero");
                }
                return a.doubleValue() / b.doubleValue();
            case "%":
                if (b.doubleValue() == 0.0) {
                    throw new TypeMismatchException("Division by zero");
                }
                return integral ? (Object) (a.longValue() % b.longValue()) : (Object) (a.doubleValue() % b.doubleValue());
            default:
                throw new IllegalStateException("Unhandled operator: " + op);
        }
    }

    static TypeMismatchException overflow(String op, ArithmeticException cause) {
        return new TypeMismatchException("Integer overflow in '%s'".formatted(op), cause);
    }
}
