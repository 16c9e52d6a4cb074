package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * Raised at the next dispatch point after cancellation was requested.
 */
public class CancelledException extends FlowException {

    public CancelledException(String reason) {
        super(ErrorKind.CANCELLED, reason);
    }
}
