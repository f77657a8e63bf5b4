package org.oldskooler.modelforge.model;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.oldskooler.modelforge.synth.FieldSpec;
import org.oldskooler.modelforge.util.JsonValues;

import java.util.*;

/**
 * One value of a {@link ValidatedModel}. Field values are keyed by internal field name.
 * <p>
 * Not thread-safe when mutation is allowed.
 * </p>
 */
public final class ModelInstance {
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private final ValidatedModel model;
    private final Map<String, Object> values;
    private final Map<String, Object> extras;

    ModelInstance(ValidatedModel model, Map<String, Object> values, Map<String, Object> extras) {
        this.model = model;
        this.values = values;
        this.extras = extras;
    }

    public ValidatedModel model() {
        return model;
    }

    /** Whether the field was populated; fields skipped by {@code construct} are not. */
    public boolean isSet(String fieldName) {
        return values.containsKey(fieldName);
    }

    /**
     * Value of a field by internal name or alias, or of a kept extra key.
     *
     * @throws IllegalArgumentException for a name the instance does not know
     */
    public Object get(String name) {
        FieldSpec field = lookup(name);
        if (field != null) return values.get(field.name());
        if (extras.containsKey(name)) return extras.get(name);
        throw new IllegalArgumentException("'" + model.name() + "' has no field '" + name + "'");
    }

    public <V> V get(String name, Class<V> type) {
        return type.cast(get(name));
    }

    /**
     * Assigns a field. Validated like construction when the config asks for assignment validation.
     *
     * @throws ImmutableFieldException  when the model or the field does not allow mutation
     * @throws ValidationException      when assignment validation rejects the value
     * @throws IllegalArgumentException for an unknown field, unless extras are allowed
     */
    public void set(String name, Object value) {
        ModelConfig config = model.config();
        if (!config.isAllowMutation()) {
            throw new ImmutableFieldException("\"" + model.name() + "\" is immutable and does not support item assignment");
        }

        FieldSpec field = lookup(name);
        if (field == null) {
            if (config.getExtra() != Extra.ALLOW) {
                throw new IllegalArgumentException("\"" + model.name() + "\" object has no field \"" + name + "\"");
            }
            extras.put(name, value);
            return;
        }

        if (!config.isValidateAssignment()) {
            values.put(field.name(), value);
            return;
        }

        if (!field.constraints().isMutable()) {
            throw new ImmutableFieldException("\"" + field.name() + "\" has allow_mutation set to False and cannot be assigned");
        }
        List<ValidationError> errors = new ArrayList<>();
        Object coerced = FieldValidator.validate(field, value, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(model.name(), errors);
        }
        values.put(field.name(), coerced);
    }

    /** Field values keyed by internal name, followed by kept extras. */
    public Map<String, Object> toMap() {
        return toMap(false);
    }

    public Map<String, Object> toMap(boolean byAlias) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (FieldSpec f : model.fields()) {
            if (!values.containsKey(f.name())) continue;
            out.put(byAlias ? f.alias() : f.name(), values.get(f.name()));
        }
        for (Map.Entry<String, Object> e : extras.entrySet()) {
            out.putIfAbsent(e.getKey(), e.getValue());
        }
        return out;
    }

    /** JSON object keyed by external names. Enums are written as their values, dates in ISO form. */
    public String toJson() {
        return GSON.toJson(JsonValues.toJson(toMap(true)));
    }

    private FieldSpec lookup(String name) {
        FieldSpec field = model.field(name);
        if (field != null) return field;
        for (FieldSpec f : model.fields()) {
            if (f.alias().equals(name)) return f;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelInstance)) return false;
        ModelInstance other = (ModelInstance) o;
        return model == other.model && values.equals(other.values) && extras.equals(other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(model), values, extras);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder(model.name()).append('(');
        boolean first = true;
        for (Map.Entry<String, Object> e : toMap().entrySet()) {
            if (!first) b.append(", ");
            b.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return b.append(')').toString();
    }
}
