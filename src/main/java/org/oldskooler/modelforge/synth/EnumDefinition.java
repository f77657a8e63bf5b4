package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.mapping.EnumMember;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enumeration type of the synthesized model. Reuses the members of the source enum and is
 * shared by every field of one synthesis run that references that enum.
 */
public final class EnumDefinition {
    private final String name;
    private final Class<?> enumType;
    private final List<EnumMember> members;

    EnumDefinition(String name, Class<?> enumType) {
        this.name = Objects.requireNonNull(name, "name");
        this.enumType = Objects.requireNonNull(enumType, "enumType");
        this.members = EnumMember.listOf(enumType);
    }

    /** Definition name, also the key under {@code definitions} in the schema. */
    public String name() { return name; }

    public Class<?> enumType() { return enumType; }

    public List<EnumMember> members() { return members; }

    public List<String> values() {
        List<String> out = new ArrayList<>(members.size());
        for (EnumMember m : members) out.add(m.value);
        return Collections.unmodifiableList(out);
    }

    /**
     * Resolves a constant of the source enum, or a member value, to the enum constant.
     *
     * @throws IllegalArgumentException when the input matches no member
     */
    public Enum<?> resolve(Object input) {
        if (enumType.isInstance(input)) return (Enum<?>) input;
        if (input instanceof CharSequence) {
            String s = input.toString();
            for (EnumMember m : members) {
                if (m.value.equals(s)) return m.constant;
            }
        }
        throw new IllegalArgumentException("'" + input + "' is not a member of " + name + "; permitted: " + permitted());
    }

    /** {@code 'F', 'T'} */
    public String permitted() {
        StringBuilder b = new StringBuilder();
        for (EnumMember m : members) {
            if (b.length() > 0) b.append(", ");
            b.append('\'').append(m.value).append('\'');
        }
        return b.toString();
    }

    @Override
    public String toString() {
        return "EnumDefinition{" + name + members + "}";
    }
}
