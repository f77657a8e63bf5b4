package org.oldskooler.modelforge.mapping;

import java.util.Objects;
import java.util.function.Supplier;

/** Default declared on a column: nothing, a static value, or a factory called per construction. */
public final class ColumnDefault {
    public enum Kind { NONE, VALUE, FACTORY }

    private static final ColumnDefault NONE = new ColumnDefault(Kind.NONE, null, null);

    private final Kind kind;
    private final Object value;
    private final Supplier<?> factory;

    private ColumnDefault(Kind kind, Object value, Supplier<?> factory) {
        this.kind = kind;
        this.value = value;
        this.factory = factory;
    }

    public static ColumnDefault none() {
        return NONE;
    }

    public static ColumnDefault value(Object value) {
        return new ColumnDefault(Kind.VALUE, value, null);
    }

    public static ColumnDefault factory(Supplier<?> factory) {
        return new ColumnDefault(Kind.FACTORY, null, Objects.requireNonNull(factory, "factory"));
    }

    public Kind kind() { return kind; }

    public boolean isNone() { return kind == Kind.NONE; }

    public boolean isValue() { return kind == Kind.VALUE; }

    public boolean isFactory() { return kind == Kind.FACTORY; }

    public Object value() { return value; }

    public Supplier<?> factory() { return factory; }

    @Override
    public String toString() {
        switch (kind) {
            case VALUE:
                return "default=" + value;
            case FACTORY:
                return "default_factory=" + factory;
            default:
                return "no default";
        }
    }
}
