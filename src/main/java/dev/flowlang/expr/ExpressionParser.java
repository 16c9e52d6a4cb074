package dev.flowlang.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the expression language used inside {@code ${...}}.
 *
 * <pre>
 * or         := and (('or' | '||') and)*
 * and        := not (('and' | '&&') not)*
 * not        := ('not' | '!') not | comparison
 * comparison := additive (('==' | '!=' | '<' | '<=' | '>' | '>=' | 'in' | 'not' 'in') additive)?
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := '-' unary | postfix
 * postfix    := primary ('.' IDENT | '[' or ']')*
 * primary    := NUMBER | STRING | 'true' | 'false' | 'null' | IDENT | IDENT '(' args ')'
 *             | '(' or ')' | '[' args ']'
 * </pre>
 */
final class ExpressionParser {

    private static final Set<String> KEYWORDS = Set.of("and", "or", "not", "in", "true", "false", "null");
    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", "<=", ">", ">=");

    private enum TokenType { NUMBER, STRING, IDENT, OPERATOR, EOF }

    private record Token(TokenType type, String text, Object value, int position) {}

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = tokenize(source);
    }

    static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionSyntaxException(String.valueOf(source), "empty expression");
        }
        var parser = new ExpressionParser(source);
        Expression expression = parser.parseOr();
        if (parser.peek().type() != TokenType.EOF) {
            throw parser.error("unexpected '" + parser.peek().text() + "'");
        }
        return expression;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (matchKeyword("or") || matchOperator("||")) {
            left = new Expression.Binary("or", left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (matchKeyword("and") || matchOperator("&&")) {
            left = new Expression.Binary("and", left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (isKeyword(peek(), "not") && !isKeyword(peekAt(1), "in")) {
            pos++;
            return new Expression.Unary("not", parseNot());
        }
        if (matchOperator("!")) {
            return new Expression.Unary("not", parseNot());
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && COMPARISONS.contains(token.text())) {
            pos++;
            return new Expression.Binary(token.text(), left, parseAdditive());
        }
        if (matchKeyword("in")) {
            return new Expression.Binary("in", left, parseAdditive());
        }
        if (isKeyword(token, "not") && isKeyword(peekAt(1), "in")) {
            pos += 2;
            return new Expression.Unary("not", new Expression.Binary("in", left, parseAdditive()));
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseTerm();
        while (true) {
            if (matchOperator("+")) {
                left = new Expression.Binary("+", left, parseTerm());
            } else if (matchOperator("-")) {
                left = new Expression.Binary("-", left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expression parseTerm() {
        Expression left = parseUnary();
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.OPERATOR
                && (token.text().equals("*") || token.text().equals("/") || token.text().equals("%"))) {
                pos++;
                left = new Expression.Binary(token.text(), left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary() {
        if (matchOperator("-")) {
            return new Expression.Unary("-", parseUnary());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expression = parsePrimary();
        while (true) {
            if (matchOperator(".")) {
                Token name = next();
                if (name.type() != TokenType.IDENT) {
                    throw error("expected attribute name after '.'");
                }
                expression = new Expression.Member(expression, name.text());
            } else if (matchOperator("[")) {
                Expression index = parseOr();
                expect("]");
                expression = new Expression.Index(expression, index);
            } else {
                return expression;
            }
        }
    }

    private Expression parsePrimary() {
        Token token = next();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                return new Expression.Literal(token.value());
            case IDENT:
                return identifier(token);
            case OPERATOR:
                if (token.text().equals("(")) {
                    Expression inner = parseOr();
                    expect(")");
                    return inner;
                }
                if (token.text().equals("[")) {
                    return new Expression.ListLiteral(arguments("]"));
                }
                throw error("unexpected '" + token.text() + "'");
            default:
                throw error("unexpected end of expression");
        }
    }

    private Expression identifier(Token token) {
        String name = token.text();
        switch (name) {
            case "true":
                return new Expression.Literal(Boolean.TRUE);
            case "false":
                return new Expression.Literal(Boolean.FALSE);
            case "null":
                return new Expression.Literal(null);
            default:
                break;
        }
        if (KEYWORDS.contains(name)) {
            throw error("unexpected keyword '" + name + "'");
        }
        if (matchOperator("(")) {
            if (!Functions.isDefined(name)) {
                throw error("unknown function '" + name + "'");
            }
            return new Expression.Call(name, arguments(")"));
        }
        return new Expression.Reference(name);
    }

    private List<Expression> arguments(String closing) {
        var args = new ArrayList<Expression>();
        if (matchOperator(closing)) {
            return args;
        }
        do {
            args.add(parseOr());
        } while (matchOperator(","));
        expect(closing);
        return args;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private boolean matchOperator(String text) {
        Token token = peek();
        if (token.type() == TokenType.OPERATOR && token.text().equals(text)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean matchKeyword(String keyword) {
        if (isKeyword(peek(), keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private static boolean isKeyword(Token token, String keyword) {
        return token.type() == TokenType.IDENT && token.text().equals(keyword);
    }

    private void expect(String text) {
        if (!matchOperator(text)) {
            throw error("expected '" + text + "'");
        }
    }

    private ExpressionSyntaxException error(String detail) {
        return new ExpressionSyntaxException(source, detail + " at position " + peek().position());
    }

    private static List<Token> tokenize(String source) {
        var tokens = new ArrayList<Token>();
        int i = 0;
        int length = source.length();
        while (i < length) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < length && Character.isDigit(source.charAt(i))) i++;
                boolean decimal = false;
                if (i + 1 < length && source.charAt(i) == '.' && Character.isDigit(source.charAt(i + 1))) {
                    decimal = true;
                    i++;
                    while (i < length && Character.isDigit(source.charAt(i))) i++;
                }
                String text = source.substring(start, i);
                Object value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
                tokens.add(new Token(TokenType.NUMBER, text, value, start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) i++;
                tokens.add(new Token(TokenType.IDENT, source.substring(start, i), null, start));
            } else if (c == '\'' || c == '"') {
                int start = i;
                var sb = new StringBuilder();
                i++;
                while (i < length && source.charAt(i) != c) {
                    char ch = source.charAt(i);
                    if (ch == '\\' && i + 1 < length) {
                        i++;
                        ch = source.charAt(i);
                        if (ch == 'n') ch = '\n';
                        else if (ch == 't') ch = '\t';
                    }
                    sb.append(ch);
                    i++;
                }
                if (i >= length) {
                    throw new ExpressionSyntaxException(source, "unterminated string at position " + start);
                }
                i++;
                tokens.add(new Token(TokenType.STRING, source.substring(start, i), sb.toString(), start));
            } else {
                String two = i + 1 < length ? source.substring(i, i + 2) : "";
                if (two.equals("==") || two.equals("!=") || two.equals("<=") || two.equals(">=")
                    || two.equals("&&") || two.equals("||")) {
                    tokens.add(new Token(TokenType.OPERATOR, two, null, i));
                    i += 2;
                } else if ("<>+-*/%!().[],".indexOf(c) >= 0) {
                    tokens.add(new Token(TokenType.OPERATOR, String.valueOf(c), null, i));
                    i++;
                } else {
                    throw new ExpressionSyntaxException(source, "unexpected character '" + c + "' at position " + i);
                }
            }
        }
        tokens.add(new Token(TokenType.EOF, "<end>", null, length));
        return tokens;
    }
}
