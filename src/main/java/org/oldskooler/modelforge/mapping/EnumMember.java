package org.oldskooler.modelforge.mapping;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One member of an enumerated column: the constant name and its stored value.
 * The value is the constant's Gson {@link SerializedName}, or the constant name when it has none.
 */
public final class EnumMember {
    public final String name;
    public final String value;
    public final Enum<?> constant;

    private EnumMember(String name, String value, Enum<?> constant) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
        this.constant = constant;
    }

    /** Members of the enum type in declaration order. */
    public static List<EnumMember> listOf(Class<?> enumType) {
        if (!enumType.isEnum()) {
            throw new IllegalArgumentException(enumType.getName() + " is not an enum");
        }
        Object[] constants = enumType.getEnumConstants();
        List<EnumMember> out = new ArrayList<>(constants.length);
        for (Object c : constants) {
            out.add(of((Enum<?>) c));
        }
        return Collections.unmodifiableList(out);
    }

    public static EnumMember of(Enum<?> constant) {
        return new EnumMember(constant.name(), valueOf(constant), constant);
    }

    /** Stored value of an enum constant. */
    public static String valueOf(Enum<?> constant) {
        try {
            SerializedName serialized = constant.getDeclaringClass()
                    .getField(constant.name())
                    .getAnnotation(SerializedName.class);
            return serialized == null ? constant.name() : serialized.value();
        } catch (NoSuchFieldException e) {
            throw new IllegalStateException("Enum constant field missing: " + constant, e);
        }
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
