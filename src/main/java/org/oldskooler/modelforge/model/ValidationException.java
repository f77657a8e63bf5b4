package org.oldskooler.modelforge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when input does not satisfy a validated model. Carries every error found, not just the first.
 */
public class ValidationException extends RuntimeException {
    private final String model;
    private final List<ValidationError> errors;

    public ValidationException(String model, List<ValidationError> errors) {
        super(render(model, errors));
        this.model = model;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public String getModel() {
        return model;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String render(String model, List<ValidationError> errors) {
        StringBuilder b = new StringBuilder()
                .append(errors.size())
                .append(errors.size() == 1 ? " validation error for " : " validation errors for ")
                .append(model);
        for (ValidationError e : errors) {
            b.append('\n').append(e);
        }
        return b.toString();
    }
}
