package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.constraint.FieldConstraints;

import java.util.*;
import java.util.function.Supplier;

/**
 * Reconciled description of one model field. Immutable.
 * Exactly one of "required", a static default or a default factory holds.
 */
public final class FieldSpec {
    public enum DefaultKind { REQUIRED, VALUE, FACTORY }

    private final String name;
    private final FieldType type;
    private final DefaultKind defaultKind;
    private final Object defaultValue;
    private final Supplier<?> defaultFactory;
    private final FieldConstraints constraints;

    private FieldSpec(String name, FieldType type, DefaultKind defaultKind, Object defaultValue,
                      Supplier<?> defaultFactory, FieldConstraints constraints) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.defaultKind = defaultKind;
        this.defaultValue = defaultValue;
        this.defaultFactory = defaultFactory;
        this.constraints = constraints == null ? FieldConstraints.NONE : constraints;
    }

    public static FieldSpec required(String name, FieldType type, FieldConstraints constraints) {
        return new FieldSpec(name, type, DefaultKind.REQUIRED, null, null, constraints);
    }

    public static FieldSpec withDefault(String name, FieldType type, Object defaultValue, FieldConstraints constraints) {
        return new FieldSpec(name, type, DefaultKind.VALUE, defaultValue, null, constraints);
    }

    public static FieldSpec withFactory(String name, FieldType type, Supplier<?> factory, FieldConstraints constraints) {
        return new FieldSpec(name, type, DefaultKind.FACTORY, null, Objects.requireNonNull(factory, "factory"), constraints);
    }

    /** Internal field name, the record model property. */
    public String name() { return name; }

    /** External name: the alias when one is declared, else the field name. */
    public String alias() {
        String alias = constraints.getAlias();
        return alias == null ? name : alias;
    }

    public FieldType type() { return type; }

    public DefaultKind defaultKind() { return defaultKind; }

    public boolean isRequired() { return defaultKind == DefaultKind.REQUIRED; }

    public boolean hasDefaultValue() { return defaultKind == DefaultKind.VALUE; }

    public boolean hasDefaultFactory() { return defaultKind == DefaultKind.FACTORY; }

    public Object defaultValue() { return defaultValue; }

    public Supplier<?> defaultFactory() { return defaultFactory; }

    public FieldConstraints constraints() { return constraints; }

    /**
     * Value for a construction that did not supply this field: a copy of the static default
     * (collections and dates are copied, other values are shared) or a fresh result of the factory.
     *
     * @throws IllegalStateException for required fields
     */
    public Object newDefault() {
        switch (defaultKind) {
            case VALUE:
                return copyOf(defaultValue);
            case FACTORY:
                return defaultFactory.get();
            default:
                throw new IllegalStateException("Field '" + name + "' is required and has no default");
        }
    }

    private static Object copyOf(Object value) {
        if (value instanceof Set) return Collections.unmodifiableSet(new LinkedHashSet<>((Set<?>) value));
        if (value instanceof Collection) return Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        // Timestamp and java.sql.Date keep their runtime type
        if (value instanceof Date) return ((Date) value).clone();
        return value;
    }

    @Override
    public String toString() {
        String dflt;
        switch (defaultKind) {
            case VALUE:
                dflt = " = " + defaultValue;
                break;
            case FACTORY:
                dflt = " = <factory>";
                break;
            default:
                dflt = " (required)";
        }
        return name + ": " + type + dflt + " " + constraints;
    }
}
