package org.oldskooler.modelforge.constraint;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed constraint vocabulary understood in column metadata.
 * Each key knows its JSON-Schema keyword and the field kinds it is legal for.
 */
public enum ConstraintKey {
    GE("ge", "minimum", Scope.NUMERIC),
    GT("gt", "exclusiveMinimum", Scope.NUMERIC),
    LE("le", "maximum", Scope.NUMERIC),
    LT("lt", "exclusiveMaximum", Scope.NUMERIC),
    MULTIPLE_OF("multiple_of", "multipleOf", Scope.NUMERIC),
    MIN_ITEMS("min_items", "minItems", Scope.SEQUENCE),
    MAX_ITEMS("max_items", "maxItems", Scope.SEQUENCE),
    MIN_LENGTH("min_length", "minLength", Scope.STRING),
    MAX_LENGTH("max_length", "maxLength", Scope.STRING),
    REGEX("regex", "pattern", Scope.STRING),
    ALIAS("alias", null, Scope.ANY),
    TITLE("title", "title", Scope.ANY),
    DESCRIPTION("description", "description", Scope.ANY),
    CONST("const", "const", Scope.ANY),
    EXAMPLE("example", "example", Scope.ANY),
    ALLOW_MUTATION("allow_mutation", "allow_mutation", Scope.ANY);

    /** Field kinds a key applies to. */
    public enum Scope { NUMERIC, STRING, SEQUENCE, ANY }

    private static final Map<String, ConstraintKey> BY_KEY = new HashMap<>();

    static {
        for (ConstraintKey k : values()) {
            BY_KEY.put(k.key, k);
        }
    }

    private final String key;
    private final String schemaKeyword;
    private final Scope scope;

    ConstraintKey(String key, String schemaKeyword, Scope scope) {
        this.key = key;
        this.schemaKeyword = schemaKeyword;
        this.scope = scope;
    }

    /** Metadata key, e.g. {@code multiple_of}. */
    public String key() {
        return key;
    }

    /** JSON-Schema keyword, or null when the key never shows up in the schema ({@code alias}). */
    public String schemaKeyword() {
        return schemaKeyword;
    }

    public Scope scope() {
        return scope;
    }

    public boolean legalFor(FieldKind kind) {
        switch (scope) {
            case NUMERIC:
                return kind.isNumeric();
            case STRING:
                return kind == FieldKind.STRING;
            case SEQUENCE:
                return kind == FieldKind.SEQUENCE;
            default:
                return true;
        }
    }

    public static Optional<ConstraintKey> byKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
