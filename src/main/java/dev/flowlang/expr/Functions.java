package dev.flowlang.expr;

import dev.flowlang.error.TypeMismatchException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in functions callable from expressions. This is a closed set; expressions cannot reach
 * any other code.
 */
final class Functions {

    /** {@code default} is evaluated lazily by the evaluator and only listed here. */
    static final String DEFAULT = "default";

    private static final Set<String> NAMES = Set.of(
        "length", "now", "lower", "upper", "string", "number", "abs", "min", "max", "keys", DEFAULT);

    private Functions() {}

    static boolean isDefined(String name) {
        return NAMES.contains(name);
    }

    static Object call(String name, List<Object> args) {
        switch (name) {
            case "length":
                arity(name, args, 1);
                return length(args.get(0));
            case "now":
                arity(name, args, 0);
                return Instant.now().toString();
            case "lower":
                arity(name, args, 1);
                return string(name, args.get(0)).toLowerCase(Locale.ROOT);
            case "upper":
                arity(name, args, 1);
                return string(name, args.get(0)).toUpperCase(Locale.ROOT);
            case "string":
                arity(name, args, 1);
                return Values.stringify(args.get(0));
            case "number":
                arity(name, args, 1);
                return number(args.get(0));
            case "abs":
                arity(name, args, 1);
                Number n = numeric(name, args.get(0));
                if (!Values.isIntegral(n)) {
                    return Math.abs(n.doubleValue());
                }
                try {
                    return Math.absExact(n.longValue());
                } catch (ArithmeticException e) {
                    throw Evaluator.overflow("abs", e);
                }
            case "min":
            case "max":
                return extreme(name, args);
            case "keys":
                arity(name, args, 1);
                if (args.get(0) instanceof Map<?, ?> m) {
                    return new ArrayList<Object>(m.keySet());
                }
                throw new TypeMismatchException("keys() expects an object, got " + Values.typeName(args.get(0)));
            default:
                throw new IllegalStateException("Unhandled function: " + name);
        }
    }

    private static long length(Object value) {
        if (value instanceof CharSequence s) return s.length();
        if (value instanceof Collection<?> c) return c.size();
        if (value instanceof Map<?, ?> m) return m.size();
        throw new TypeMismatchException("length() expects a string, array or object, got " + Values.typeName(value));
    }

    private static Object number(Object value) {
        if (value instanceof Number) return value;
        if (value instanceof String s) {
            try {
                String text = s.trim();
                boolean decimal = text.contains(".") || text.contains("e") || text.contains("E");
                return decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new TypeMismatchException("number() cannot convert '" + s + "'");
            }
        }
        throw new TypeMismatchException("number() cannot convert " + Values.typeName(value));
    }

    private static Object extreme(String name, List<Object> args) {
        List<?> items = args.size() == 1 && args.get(0) instanceof List<?> list ? list : args;
        if (items.isEmpty()) {
            throw new TypeMismatchException(name + "() needs at least one value");
        }
        Object best = items.get(0);
        for (Object candidate : items) {
            int cmp = Values.compare(candidate, best, name);
            if (name.equals("min") ? cmp < 0 : cmp > 0) {
                best = candidate;
            }
        }
        return best;
    }

    private static String string(String function, Object value) {
        if (value instanceof String s) return s;
        throw new TypeMismatchException(function + "() expects a string, got " + Values.typeName(value));
    }

    private static Number numeric(String function, Object value) {
        if (value instanceof Number n) return n;
        throw new TypeMismatchException(function + "() expects a number, got " + Values.typeName(value));
    }

    private static void arity(String function, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw new TypeMismatchException("%s() takes %d argument(s), got %d".formatted(function, expected, args.size()));
        }
    }
}
