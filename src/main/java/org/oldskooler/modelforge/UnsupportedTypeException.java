package org.oldskooler.modelforge;

/** The Java type of a column has no mapping rule. */
public class UnsupportedTypeException extends SynthesisException {
    private final transient java.lang.reflect.Type type;

    public UnsupportedTypeException(String field, java.lang.reflect.Type type) {
        super(field, "Column '" + field + "' has unsupported type " + type.getTypeName());
        this.type = type;
    }

    public java.lang.reflect.Type getType() {
        return type;
    }
}
