package dev.flowlang.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A string split into literal text and {@code ${...}} expression segments. {@code $${} escapes a
 * literal {@code ${}.
 */
record Template(List<Part> parts) {

    record Part(String literal, String source, Expression expression) {
        boolean isExpression() {
            return expression != null;
        }
    }

    static boolean containsMarker(String text) {
        return text.contains("${");
    }

    static Template parse(String text) {
        var parts = new ArrayList<Part>();
        var literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith("$${", i)) {
                literal.append("${");
                i += 3;
            } else if (text.startsWith("${", i)) {
                int end = findClosingBrace(text, i + 2);
                if (end < 0) {
                    throw new ExpressionSyntaxException(text, "unterminated '${' at position " + i);
                }
                if (literal.length() > 0) {
                    parts.add(new Part(literal.toString(), null, null));
                    literal.setLength(0);
                }
                String source = text.substring(i + 2, end).trim();
                parts.add(new Part(null, source, ExpressionParser.parse(source)));
                i = end + 1;
            } else {
                literal.append(text.charAt(i));
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(new Part(literal.toString(), null, null));
        }
        return new Template(List.copyOf(parts));
    }

    boolean isSingleExpression() {
        return parts.size() == 1 && parts.get(0).isExpression();
    }

    boolean hasExpressions() {
        return parts.stream().anyMatch(Part::isExpression);
    }

    /** Rewrites the template as one expression, each segment parenthesised: {@code ${a} > 0} becomes {@code (a) > 0}. */
    String toExpressionSource() {
        var sb = new StringBuilder();
        for (Part part : parts) {
            if (part.isExpression()) {
                sb.append('(').append(part.source()).append(')');
            } else {
                sb.append(part.literal());
            }
        }
        return sb.toString();
    }

    private static int findClosingBrace(String text, int from) {
        char quote = 0;
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }
}
