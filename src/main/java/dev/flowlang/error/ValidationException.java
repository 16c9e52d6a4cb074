package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

import java.util.List;

/**
 * A flow document violates a load-time invariant. Carries every problem found, not just the first.
 */
public class ValidationException extends FlowException {

    private final List<String> errors;

    public ValidationException(String flowName, List<String> errors) {
        super(ErrorKind.VALIDATION, "Flow '%s' is invalid: %s".formatted(flowName, String.join("; ", errors)));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
        this.errors = List.of(message);
    }

    public List<String> errors() {
        return errors;
    }
}
