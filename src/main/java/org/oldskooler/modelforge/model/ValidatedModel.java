package org.oldskooler.modelforge.model;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.oldskooler.modelforge.schema.JsonSchemaWriter;
import org.oldskooler.modelforge.synth.EnumDefinition;
import org.oldskooler.modelforge.synth.FieldSpec;
import org.oldskooler.modelforge.synth.ModelSpec;
import org.oldskooler.modelforge.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.util.*;

/**
 * A synthesized model type. Validates keyword construction, builds instances from live
 * record objects and describes itself as JSON Schema.
 * <p>
 * Immutable and safe to share between threads; the instances it creates are not.
 * </p>
 */
public final class ValidatedModel {
    private final String name;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> byName;
    private final List<EnumDefinition> definitions;
    private final ModelConfig config;

    private ValidatedModel(ModelSpec spec) {
        this.name = spec.name();
        this.fields = spec.fields();
        this.definitions = spec.definitions();
        this.config = spec.config() == null ? ModelConfig.DEFAULT : spec.config();

        Map<String, FieldSpec> m = new LinkedHashMap<>();
        for (FieldSpec f : fields) m.put(f.name(), f);
        this.byName = Collections.unmodifiableMap(m);
    }

    public static ValidatedModel of(ModelSpec spec) {
        return new ValidatedModel(Objects.requireNonNull(spec, "spec"));
    }

    public String name() { return name; }

    /** Fields in declaration order. */
    public List<FieldSpec> fields() { return fields; }

    /** Field by internal name, or null. */
    public FieldSpec field(String fieldName) { return byName.get(fieldName); }

    public List<EnumDefinition> definitions() { return definitions; }

    public ModelConfig config() { return config; }

    /**
     * Validating construction. Keys are external field names (aliases), plus internal names
     * when the config allows population by name.
     *
     * @throws ValidationException with every problem found
     */
    public ModelInstance create(Map<String, ?> values) {
        return instantiate(values, true, config.isPopulateByName());
    }

    /**
     * Construction without validation. Defaults are still applied; missing required fields stay unset.
     */
    public ModelInstance construct(Map<String, ?> values) {
        return instantiate(values, false, true);
    }

    /**
     * Reads the current value of every field off {@code record} (by property name) and validates it.
     * Properties the record does not have are treated as not supplied.
     * <p>
     * Array-typed properties are sequence fields, so they read back as an unmodifiable
     * {@code List} of the elements rather than as the record's array.
     * </p>
     *
     * @throws ValidationException when the record's values do not satisfy the model
     */
    public ModelInstance fromRecord(Object record) {
        Objects.requireNonNull(record, "record");
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldSpec f : fields) {
            Field field = ReflectionUtils.findField(record.getClass(), f.name());
            if (field == null) continue;
            try {
                values.put(f.name(), ReflectionUtils.getField(record, field));
            } catch (IllegalAccessException | RuntimeException e) {
                throw new IllegalStateException("Cannot read '" + f.name() + "' from " + record.getClass().getName(), e);
            }
        }
        return instantiate(values, true, true, Extra.IGNORE);
    }

    public JsonObject schema() {
        return JsonSchemaWriter.write(this);
    }

    public String schemaJson() {
        return new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .create()
                .toJson(schema());
    }

    private ModelInstance instantiate(Map<String, ?> input, boolean validate, boolean byName) {
        return instantiate(input, validate, byName, config.getExtra());
    }

    private ModelInstance instantiate(Map<String, ?> input, boolean validate, boolean byName, Extra extraPolicy) {
        Objects.requireNonNull(input, "values");
        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>();
        List<ValidationError> errors = new ArrayList<>();

        for (FieldSpec f : fields) {
            String key = lookupKey(f, input, byName);
            if (key == null) {
                if (f.isRequired()) {
                    if (validate) {
                        errors.add(new ValidationError(Collections.singletonList(f.alias()), "field required", "value_error.missing"));
                    }
                } else {
                    values.put(f.name(), f.newDefault());
                }
                continue;
            }

            consumed.add(key);
            Object raw = input.get(key);
            values.put(f.name(), validate ? FieldValidator.validate(f, raw, errors) : raw);
        }

        Map<String, Object> extras = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : input.entrySet()) {
            if (consumed.contains(e.getKey())) continue;
            if (!validate || extraPolicy == Extra.ALLOW) {
                extras.put(e.getKey(), e.getValue());
            } else if (extraPolicy == Extra.FORBID) {
                errors.add(new ValidationError(Collections.singletonList(e.getKey()), "extra fields not permitted", "value_error.extra"));
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(name, errors);
        }
        return new ModelInstance(this, values, extras);
    }

    private String lookupKey(FieldSpec f, Map<String, ?> input, boolean byName) {
        if (input.containsKey(f.alias())) return f.alias();
        if (byName && input.containsKey(f.name())) return f.name();
        return null;
    }

    @Override
    public String toString() {
        return "ValidatedModel{" + name + ", fields=" + fields.size() + "}";
    }
}
