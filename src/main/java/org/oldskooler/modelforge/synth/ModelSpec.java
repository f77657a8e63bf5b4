package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.model.ModelConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to build a validated model: its name, fields in declaration order,
 * the enum definitions they reference and the caller's configuration, if any.
 */
public final class ModelSpec {
    private final String name;
    private final List<FieldSpec> fields;
    private final List<EnumDefinition> definitions;
    private final ModelConfig config;

    public ModelSpec(String name, List<FieldSpec> fields, List<EnumDefinition> definitions, ModelConfig config) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.definitions = definitions == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(definitions));
        this.config = config;
    }

    public String name() { return name; }

    public List<FieldSpec> fields() { return fields; }

    public List<EnumDefinition> definitions() { return definitions; }

    /** Configuration as supplied by the caller; null when none was given. */
    public ModelConfig config() { return config; }
}
