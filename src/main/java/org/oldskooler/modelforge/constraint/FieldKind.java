package org.oldskooler.modelforge.constraint;

/**
 * Primitive kind of a synthesized field. Decides which constraints apply and
 * which JSON-Schema type keywords describe the field.
 */
public enum FieldKind {
    INTEGER("integer", null),
    NUMBER("number", null),
    STRING("string", null),
    BOOLEAN("boolean", null),
    DATE_TIME("string", "date-time"),
    DATE("string", "date"),
    TIME("string", "time"),
    UUID("string", "uuid"),
    ENUM(null, null),
    SEQUENCE("array", null),
    ANY(null, null);

    private final String jsonType;
    private final String format;

    FieldKind(String jsonType, String format) {
        this.jsonType = jsonType;
        this.format = format;
    }

    /** JSON-Schema {@code type}, or null when the kind has none of its own. */
    public String jsonType() {
        return jsonType;
    }

    /** JSON-Schema {@code format}, or null. */
    public String format() {
        return format;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT).replace('_', ' ');
    }
}
