package org.oldskooler.modelforge.constraint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reconciled constraints of one field: the typed per-kind structs, the documentation keys,
 * and the metadata entries outside the vocabulary, kept verbatim in {@link #getExtras()}.
 */
public final class FieldConstraints {
    public static final FieldConstraints NONE = builder().build();

    private final NumericConstraints numeric;
    private final StringConstraints string;
    private final SequenceConstraints sequence;
    private final String alias;
    private final String title;
    private final String description;
    private final boolean constant;
    private final boolean hasExample;
    private final Object example;
    private final Boolean allowMutation;
    private final Map<String, Object> extras;

    private FieldConstraints(Builder b) {
        this.numeric = b.numeric;
        this.string = b.string;
        this.sequence = b.sequence;
        this.alias = b.alias;
        this.title = b.title;
        this.description = b.description;
        this.constant = b.constant;
        this.hasExample = b.hasExample;
        this.example = b.example;
        this.allowMutation = b.allowMutation;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
    }

    public NumericConstraints getNumeric() { return numeric; }

    public StringConstraints getString() { return string; }

    public SequenceConstraints getSequence() { return sequence; }

    /** External name of the field, or null when it is exposed under its own name. */
    public String getAlias() { return alias; }

    public String getTitle() { return title; }

    public String getDescription() { return description; }

    /** Whether the value is pinned to the field's static default. */
    public boolean isConstant() { return constant; }

    public boolean hasExample() { return hasExample; }

    public Object getExample() { return example; }

    /** Declared mutability flag, or null when the metadata does not mention it. */
    public Boolean getAllowMutation() { return allowMutation; }

    public boolean isMutable() {
        return allowMutation == null || allowMutation;
    }

    public Map<String, Object> getExtras() { return extras; }

    public FieldConstraints withDescription(String description) {
        return toBuilder().description(description).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.numeric = numeric;
        b.string = string;
        b.sequence = sequence;
        b.alias = alias;
        b.title = title;
        b.description = description;
        b.constant = constant;
        b.hasExample = hasExample;
        b.example = example;
        b.allowMutation = allowMutation;
        b.extras.putAll(extras);
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder("FieldConstraints{");
        if (!numeric.isEmpty()) s.append(numeric).append(", ");
        if (!string.isEmpty()) s.append(string).append(", ");
        if (!sequence.isEmpty()) s.append(sequence).append(", ");
        if (alias != null) s.append("alias=").append(alias).append(", ");
        if (title != null) s.append("title=").append(title).append(", ");
        if (constant) s.append("const, ");
        if (allowMutation != null) s.append("allowMutation=").append(allowMutation).append(", ");
        if (!extras.isEmpty()) s.append("extras=").append(extras).append(", ");
        if (s.charAt(s.length() - 1) == ' ') s.setLength(s.length() - 2);
        return s.append('}').toString();
    }

    public static class Builder {
        private NumericConstraints numeric = NumericConstraints.NONE;
        private StringConstraints string = StringConstraints.NONE;
        private SequenceConstraints sequence = SequenceConstraints.NONE;
        private String alias;
        private String title;
        private String description;
        private boolean constant;
        private boolean hasExample;
        private Object example;
        private Boolean allowMutation;
        private final Map<String, Object> extras = new LinkedHashMap<>();

        public Builder numeric(NumericConstraints numeric) { this.numeric = numeric; return this; }

        public Builder string(StringConstraints string) { this.string = string; return this; }

        public Builder sequence(SequenceConstraints sequence) { this.sequence = sequence; return this; }

        public Builder alias(String alias) { this.alias = alias; return this; }

        public Builder title(String title) { this.title = title; return this; }

        public Builder description(String description) { this.description = description; return this; }

        public Builder constant(boolean constant) { this.constant = constant; return this; }

        public Builder example(Object example) {
            this.hasExample = true;
            this.example = example;
            return this;
        }

        public Builder allowMutation(Boolean allowMutation) { this.allowMutation = allowMutation; return this; }

        public Builder extra(String key, Object value) {
            extras.put(key, value);
            return this;
        }

        public FieldConstraints build() {
            return new FieldConstraints(this);
        }
    }
}
