package org.oldskooler.modelforge.mapping;

import org.oldskooler.modelforge.annotations.Column;
import org.oldskooler.modelforge.annotations.Id;
import org.oldskooler.modelforge.annotations.Info;
import org.oldskooler.modelforge.annotations.NotMapped;
import org.oldskooler.modelforge.util.JsonValues;
import org.oldskooler.modelforge.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.Supplier;

/**
 * Column metadata of a record model class.
 * Merge behavior:
 *   - First tries MappingRegistry
 *   - Else reads annotations (@Column, @Id, @Info, @NotMapped)
 *   - Fields without @Column fall back to convention (nullable, no default, unbounded)
 * Columns keep the declaration order of the class.
 */
public final class TableMeta<T> {
    public final Class<T> type;

    /**
     * property - ColumnMeta, in declaration order
     */
    public final Map<String, ColumnMeta> columns;

    /**
     * Preferred factory: registry-aware, then annotations.
     */
    public static <T> TableMeta<T> of(Class<T> type, MappingRegistry registry) {
        Objects.requireNonNull(type, "type");
        Optional<EntityMapping<T>> mapped = registry == null ? Optional.empty() : registry.find(type);

        if (mapped.isPresent()) {
            return from(mapped.get());
        }

        return fromAnnotations(type);
    }

    public static <T> TableMeta<T> of(Class<T> type) {
        return of(type, null);
    }

    /**
     * Build from fluent mapping (MappingRegistry)
     */
    private static <T> TableMeta<T> from(EntityMapping<T> em) {
        return new TableMeta<>(em.type, em.columns);
    }

    private static <T> TableMeta<T> fromAnnotations(Class<T> type) {
        if (type.isInterface() || type.isPrimitive() || type.isArray() || type.isEnum()) {
            throw new IllegalArgumentException("Not a record model class: " + type.getName());
        }

        LinkedHashMap<String, ColumnMeta> cols = new LinkedHashMap<>();

        for (Field f : ReflectionUtils.getInstanceFields(type)) {
            if (Modifier.isTransient(f.getModifiers())) continue;
            // Skip @NotMapped entirely
            if (f.getAnnotation(NotMapped.class) != null) continue;

            String prop = f.getName();
            Column colAnn = f.getAnnotation(Column.class);
            Id idAnn = f.getAnnotation(Id.class);
            Info infoAnn = f.getAnnotation(Info.class);

            // Column hints / defaults
            boolean nullable = !f.getType().isPrimitive();
            ColumnDefault defaultValue = ColumnDefault.none();
            int length = -1;
            String doc = "";

            if (colAnn != null) {
                nullable     = nullable && colAnn.nullable();
                defaultValue = readDefault(type, prop, colAnn);
                length       = colAnn.length();
                doc          = colAnn.doc();
            }

            Map<String, Object> info = Collections.emptyMap();
            if (infoAnn != null) {
                try {
                    info = JsonValues.parseObject(infoAnn.value());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid @Info on " + type.getName() + "." + prop + ": " + e.getMessage(), e);
                }
            }

            cols.put(prop, new ColumnMeta(prop, f.getType(), f.getGenericType(), nullable, idAnn != null,
                    defaultValue, length, info, doc));
        }

        return new TableMeta<>(type, cols);
    }

    private static ColumnDefault readDefault(Class<?> type, String prop, Column colAnn) {
        boolean hasValue = !Column.DEFAULT_NONE.equals(colAnn.defaultValue());
        boolean hasFactory = colAnn.defaultFactory() != Column.NoFactory.class;

        if (hasValue && hasFactory) {
            throw new IllegalArgumentException("Column " + type.getName() + "." + prop
                    + " declares both defaultValue and defaultFactory; pick one");
        }
        if (hasFactory) {
            try {
                Supplier<?> factory = ReflectionUtils.newInstance(colAnn.defaultFactory());
                return ColumnDefault.factory(factory);
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException("Cannot instantiate default factory " + colAnn.defaultFactory().getName()
                        + " of " + type.getName() + "." + prop + "; it needs a no-arg constructor", e);
            }
        }
        if (hasValue) {
            return ColumnDefault.value(colAnn.defaultValue());
        }
        return ColumnDefault.none();
    }

    public TableMeta(Class<T> type, Map<String, ColumnMeta> columns) {
        this.type = Objects.requireNonNull(type, "type");
        this.columns = (columns == null) ? Collections.unmodifiableMap(new LinkedHashMap<>())
                : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
