package org.oldskooler.modelforge;

/**
 * A constraint declared on the column type disagrees with the same constraint in the column metadata.
 */
public class ConstraintConflictException extends SynthesisException {
    private final String key;
    private final Object infoValue;
    private final Object columnValue;

    public ConstraintConflictException(String field, String key, Object infoValue, Object columnValue) {
        super(field, key + " (" + infoValue + ") differs from length set for column type (" + columnValue + ")."
                + " Either remove " + key + " from info (preferred) or set them to equal values");
        this.key = key;
        this.infoValue = infoValue;
        this.columnValue = columnValue;
    }

    public String getKey() {
        return key;
    }

    public Object getInfoValue() {
        return infoValue;
    }

    public Object getColumnValue() {
        return columnValue;
    }
}
