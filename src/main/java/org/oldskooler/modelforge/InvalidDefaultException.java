package org.oldskooler.modelforge;

/** A static column default cannot be converted to the field type. */
public class InvalidDefaultException extends SynthesisException {
    public InvalidDefaultException(String field, String message, Throwable cause) {
        super(field, "Column '" + field + "': " + message, cause);
    }
}
