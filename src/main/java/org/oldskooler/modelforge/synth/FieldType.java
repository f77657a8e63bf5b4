package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.constraint.FieldKind;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved type of a synthesized field: its kind, the Java class values are held as,
 * whether null is accepted, and for sequences and enums the item type or enum definition.
 */
public final class FieldType {
    private static final FieldType ANY = new FieldType(FieldKind.ANY, Object.class, false, null, null);

    private final FieldKind kind;
    private final Class<?> javaType;
    private final boolean optional;
    private final FieldType itemType;
    private final EnumDefinition enumDefinition;

    private FieldType(FieldKind kind, Class<?> javaType, boolean optional, FieldType itemType, EnumDefinition enumDefinition) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.optional = optional;
        this.itemType = itemType;
        this.enumDefinition = enumDefinition;
    }

    public static FieldType scalar(FieldKind kind, Class<?> boxedType) {
        if (kind == FieldKind.ENUM || kind == FieldKind.SEQUENCE) {
            throw new IllegalArgumentException(kind + " is not a scalar kind");
        }
        return new FieldType(kind, boxedType, false, null, null);
    }

    public static FieldType enumeration(EnumDefinition definition) {
        return new FieldType(FieldKind.ENUM, definition.enumType(), false, null, definition);
    }

    /** Sequence of {@code itemType}; {@code unique} sequences are held as sets. */
    public static FieldType sequence(FieldType itemType, boolean unique) {
        return new FieldType(FieldKind.SEQUENCE, unique ? Set.class : List.class, false,
                Objects.requireNonNull(itemType, "itemType"), null);
    }

    public static FieldType any() {
        return ANY;
    }

    public FieldType withOptional(boolean optional) {
        if (optional == this.optional) return this;
        return new FieldType(kind, javaType, optional, itemType, enumDefinition);
    }

    public FieldKind kind() { return kind; }

    public Class<?> javaType() { return javaType; }

    public boolean isOptional() { return optional; }

    /** Item type of a sequence, null otherwise. */
    public FieldType itemType() { return itemType; }

    /** Enum definition of an enum field, null otherwise. */
    public EnumDefinition enumDefinition() { return enumDefinition; }

    public boolean isUnique() {
        return kind == FieldKind.SEQUENCE && javaType == Set.class;
    }

    @Override
    public String toString() {
        String base;
        switch (kind) {
            case SEQUENCE:
                base = (isUnique() ? "Set[" : "List[") + itemType + "]";
                break;
            case ENUM:
                base = enumDefinition.name();
                break;
            case ANY:
                base = "Any";
                break;
            default:
                base = javaType.getSimpleName();
        }
        return optional ? "Optional[" + base + "]" : base;
    }
}
