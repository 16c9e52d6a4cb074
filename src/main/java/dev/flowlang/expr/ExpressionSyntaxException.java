package dev.flowlang.expr;

import dev.flowlang.error.FlowException;
import dev.flowlang.model.ErrorKind;

/**
 * An expression or template string could not be parsed. Reported at load time.
 */
public class ExpressionSyntaxException extends FlowException {

    public ExpressionSyntaxException(String source, String detail) {
        super(ErrorKind.VALIDATION, "Invalid expression '%s': %s".formatted(source, detail));
    }
}
