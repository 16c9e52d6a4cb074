package dev.flowlang.error;

import dev.flowlang.model.ErrorKind;

/**
 * A required flow input without default was not supplied.
 */
public class RequiredInputMissingException extends FlowException {

    private final String inputName;

    public RequiredInputMissingException(String flowName, String inputName) {
        super(ErrorKind.REQUIRED_INPUT_MISSING,
            "Required input '%s' not provided to flow '%s'".formatted(inputName, flowName));
        this.inputName = inputName;
    }

    public String inputName() {
        return inputName;
    }
}
