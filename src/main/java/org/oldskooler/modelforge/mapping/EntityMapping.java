package org.oldskooler.modelforge.mapping;

import org.oldskooler.modelforge.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Immutable, annotation-free mapping of an entity class to its columns.
 * Only the properties named in the builder are mapped, in the order they were added.
 *
 * <pre>
 * EntityMapping&lt;Person&gt; m = EntityMapping.builder(Person.class)
 *         .column("id", c -&gt; c.primaryKey())
 *         .column("age", c -&gt; c.nullable(false).defaultValue(0).info("ge", 0))
 *         .column("createdAt", c -&gt; c.defaultFactory(LocalDateTime::now))
 *         .build();
 * </pre>
 */
public final class EntityMapping<T> {
    public final Class<T> type;

    /** property - ColumnMeta */
    public final Map<String, ColumnMeta> columns;

    private EntityMapping(Class<T> type, Map<String, ColumnBuilder> builders) {
        this.type = Objects.requireNonNull(type, "type");

        Map<String, ColumnMeta> cMap = new LinkedHashMap<>();
        for (Map.Entry<String, ColumnBuilder> e : builders.entrySet()) {
            String prop = e.getKey();
            Field f = ReflectionUtils.findField(type, prop);
            if (f == null) {
                throw new IllegalArgumentException("No field '" + prop + "' on " + type.getName());
            }
            cMap.put(prop, e.getValue().toMeta(prop, f));
        }
        this.columns = Collections.unmodifiableMap(cMap);
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    public static final class Builder<T> {
        private final Class<T> type;
        private final Map<String, ColumnBuilder> columns = new LinkedHashMap<>();

        private Builder(Class<T> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        /** Maps a property with convention defaults (nullable, no default, unbounded). */
        public Builder<T> column(String property) {
            return column(property, c -> { });
        }

        public Builder<T> column(String property, Consumer<ColumnBuilder> spec) {
            if (columns.containsKey(property)) {
                throw new IllegalArgumentException("Property '" + property + "' mapped twice on " + type.getName());
            }
            ColumnBuilder c = new ColumnBuilder();
            spec.accept(c);
            columns.put(property, c);
            return this;
        }

        public EntityMapping<T> build() {
            return new EntityMapping<>(type, columns);
        }
    }

    public static final class ColumnBuilder {
        private boolean nullable = true;
        private boolean primaryKey;
        private ColumnDefault defaultValue = ColumnDefault.none();
        private int length = -1;
        private final Map<String, Object> info = new LinkedHashMap<>();
        private String doc = "";

        private ColumnBuilder() {}

        public ColumnBuilder nullable(boolean nullable) { this.nullable = nullable; return this; }

        public ColumnBuilder primaryKey() { this.primaryKey = true; return this; }

        public ColumnBuilder length(int length) { this.length = length; return this; }

        public ColumnBuilder doc(String doc) { this.doc = doc; return this; }

        public ColumnBuilder defaultValue(Object value) {
            if (defaultValue.isFactory()) throw new IllegalStateException("defaultFactory already set");
            this.defaultValue = ColumnDefault.value(value);
            return this;
        }

        public ColumnBuilder defaultFactory(Supplier<?> factory) {
            if (defaultValue.isValue()) throw new IllegalStateException("defaultValue already set");
            this.defaultValue = ColumnDefault.factory(factory);
            return this;
        }

        public ColumnBuilder info(String key, Object value) {
            info.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public ColumnBuilder info(Map<String, ?> values) {
            info.putAll(values);
            return this;
        }

        private ColumnMeta toMeta(String prop, Field f) {
            boolean isNullable = nullable && !f.getType().isPrimitive();
            return new ColumnMeta(prop, f.getType(), f.getGenericType(), isNullable, primaryKey,
                    defaultValue, length, info, doc);
        }
    }
}
