package org.oldskooler.modelforge;

/**
 * A metadata entry uses a vocabulary key that does not apply to the field's kind,
 * or carries a value of the wrong type.
 */
public class InvalidConstraintException extends SynthesisException {
    private final String key;

    public InvalidConstraintException(String field, String key, String message) {
        super(field, "Column '" + field + "': " + message);
        this.key = key;
    }

    public InvalidConstraintException(String field, String key, String message, Throwable cause) {
        super(field, "Column '" + field + "': " + message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
