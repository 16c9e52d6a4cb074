package dev.flowlang.expr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowlang.error.TypeMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value semantics shared by the evaluator: truthiness, numeric-aware equality, ordering and
 * string rendering.
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Values() {}

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    /** Equality where numbers compare by value regardless of boxed type (1 == 1.0). */
    public static boolean equal(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (!isFinite(x) || !isFinite(y)) {
                return x.doubleValue() == y.doubleValue();
            }
            return toBigDecimal(x).compareTo(toBigDecimal(y)) == 0;
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) return false;
            Iterator<?> i = x.iterator();
            Iterator<?> j = y.iterator();
            while (i.hasNext()) {
                if (!equal(i.next(), j.next())) return false;
            }
            return true;
        }
        if (a instanceof Map<?, ?> x && b instanceof Map<?, ?> y) {
            if (x.size() != y.size()) return false;
            for (Map.Entry<?, ?> e : x.entrySet()) {
                if (!y.containsKey(e.getKey()) || !equal(e.getValue(), y.get(e.getKey()))) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    public static int compare(Object a, Object b, String operator) {
        if (a instanceof Number x && b instanceof Number y) {
            if (!isFinite(x) || !isFinite(y)) {
                if (Double.isNaN(x.doubleValue()) || Double.isNaN(y.doubleValue())) {
                    throw new TypeMismatchException("Cannot apply '%s' to NaN".formatted(operator));
                }
                return Double.compare(x.doubleValue(), y.doubleValue());
            }
            return toBigDecimal(x).compareTo(toBigDecimal(y));
        }
        if (a instanceof String x && b instanceof String y) {
            return x.compareTo(y);
        }
        throw new TypeMismatchException("Cannot apply '%s' to %s and %s".formatted(operator, typeName(a), typeName(b)));
    }

    /** Renders a value for string interpolation. Maps and lists render as JSON. */
    public static String stringify(Object value) {
        if (value == null) return "null";
        if (value instanceof String s) return s;
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new TypeMismatchException("Cannot render " + typeName(value) + " as text: " + e.getOriginalMessage());
            }
        }
        return value.toString();
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    /** False for NaN and the infinities, which have no {@link BigDecimal} form. */
    public static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return Double.isFinite(n.doubleValue());
        }
        return true;
    }

    /**
     * @throws TypeMismatchException for NaN and the infinities
     */
    public static BigDecimal toBigDecimal(Number n) {
        if (!isFinite(n)) {
            throw new TypeMismatchException("Cannot use " + n + " as an exact number");
        }
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        return BigDecimal.valueOf(n.doubleValue());
    }

    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        if (value instanceof Map<?, ?>) return "object";
        if (value instanceof Collection<?>) return "array";
        return value.getClass().getSimpleName();
    }
}
