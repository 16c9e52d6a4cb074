package dev.flowlang.expr;

import java.util.List;

/**
 * Parsed expression tree.
 */
sealed interface Expression {

    /** Source-like rendering, used in error messages. */
    String describe();

    record Literal(Object value) implements Expression {
        @Override
        public String describe() {
            return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
        }
    }

    record ListLiteral(List<Expression> elements) implements Expression {
        @Override
        public String describe() {
            return "[" + String.join(", ", elements.stream().map(Expression::describe).toList()) + "]";
        }
    }

    record Reference(String name) implements Expression {
        @Override
        public String describe() {
            return name;
        }
    }

    record Member(Expression target, String name) implements Expression {
        @Override
        public String describe() {
            return target.describe() + "." + name;
        }
    }

    record Index(Expression target, Expression index) implements Expression {
        @Override
        public String describe() {
            return target.describe() + "[" + index.describe() + "]";
        }
    }

    record Call(String function, List<Expression> arguments) implements Expression {
        @Override
        public String describe() {
            return function + "(" + String.join(", ", arguments.stream().map(Expression::describe).toList()) + ")";
        }
    }

    record Unary(String operator, Expression operand) implements Expression {
        @Override
        public String describe() {
            return operator + " " + operand.describe();
        }
    }

    record Binary(String operator, Expression left, Expression right) implements Expression {
        @Override
        public String describe() {
            return left.describe() + " " + operator + " " + right.describe();
        }
    }
}
