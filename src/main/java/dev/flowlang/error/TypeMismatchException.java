package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * An operator or declared input type was applied to an incompatible value.
 */
public class TypeMismatchException extends FlowException {

    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(ErrorKind.TYPE_MISMATCH, message, cause);
    }
}
