package org.oldskooler.modelforge;

/**
 * Base of every failure raised while deriving a model from a record model.
 * Synthesis is all-or-nothing: when one of these is thrown no model was produced.
 */
public class SynthesisException extends RuntimeException {
    private final String field;

    public SynthesisException(String field, String message) {
        super(message);
        this.field = field;
    }

    public SynthesisException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /** Property of the offending column, or null when not tied to one. */
    public String getField() {
        return field;
    }
}
