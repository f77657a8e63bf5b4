package org.oldskooler.modelforge.synth;

import java.util.*;

/**
 * State of a single model synthesis: the enum definitions built so far, keyed by source enum.
 * A fresh context is created per run and dropped once the model is built.
 */
public final class SynthesisContext {
    private final Map<Class<?>, EnumDefinition> enums = new IdentityHashMap<>();
    private final Map<String, EnumDefinition> byName = new LinkedHashMap<>();

    /** The definition for {@code enumType}, created on first use. */
    public EnumDefinition enumDefinition(Class<?> enumType) {
        EnumDefinition existing = enums.get(enumType);
        if (existing != null) return existing;

        String name = enumType.getSimpleName();
        if (byName.containsKey(name)) {
            // two different enums share a simple name
            name = enumType.getName().replace(".", "__").replace("$", "__");
        }
        EnumDefinition created = new EnumDefinition(name, enumType);
        enums.put(enumType, created);
        byName.put(name, created);
        return created;
    }

    /** Definitions in first-use order. */
    public List<EnumDefinition> definitions() {
        return Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }
}
