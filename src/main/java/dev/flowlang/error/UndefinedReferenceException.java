package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * An expression path segment does not exist in scope. Never silently treated as null.
 */
public class UndefinedReferenceException extends FlowException {

    private final String reference;

    public UndefinedReferenceException(String reference, String message) {
        super(ErrorKind.UNDEFINED_REFERENCE, message);
        this.reference = reference;
    }

    public UndefinedReferenceException(String reference) {
        this(reference, "Undefined reference: " + reference);
    }

    public String reference() {
        return reference;
    }
}
