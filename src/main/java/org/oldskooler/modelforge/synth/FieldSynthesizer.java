package org.oldskooler.modelforge.synth;

import org.oldskooler.modelforge.InvalidConstraintException;
import org.oldskooler.modelforge.InvalidDefaultException;
import org.oldskooler.modelforge.UnsupportedTypeException;
import org.oldskooler.modelforge.constraint.ConstraintResolver;
import org.oldskooler.modelforge.constraint.FieldConstraints;
import org.oldskooler.modelforge.constraint.FieldKind;
import org.oldskooler.modelforge.mapping.ColumnDefault;
import org.oldskooler.modelforge.mapping.ColumnMeta;
import org.oldskooler.modelforge.util.JsonValues;
import org.oldskooler.modelforge.util.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.util.*;

/**
 * Turns one record model column into a {@link FieldSpec}.
 * <p>
 * The column's Java type decides the field kind, nullability and the primary-key flag decide
 * optionality and requiredness, and the declared length is merged with the metadata bag into
 * the field constraints. Stateless; per-run state lives in the {@link SynthesisContext}.
 * </p>
 */
public class FieldSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(FieldSynthesizer.class);

    private static final Map<Class<?>, FieldKind> SCALARS = new HashMap<>();

    static {
        for (Class<?> c : Arrays.asList(int.class, Integer.class, long.class, Long.class, short.class, Short.class,
                byte.class, Byte.class, BigInteger.class)) {
            SCALARS.put(c, FieldKind.INTEGER);
        }
        for (Class<?> c : Arrays.asList(double.class, Double.class, float.class, Float.class, BigDecimal.class)) {
            SCALARS.put(c, FieldKind.NUMBER);
        }
        for (Class<?> c : Arrays.asList(String.class, char.class, Character.class)) {
            SCALARS.put(c, FieldKind.STRING);
        }
        SCALARS.put(boolean.class, FieldKind.BOOLEAN);
        SCALARS.put(Boolean.class, FieldKind.BOOLEAN);
        for (Class<?> c : Arrays.asList(LocalDateTime.class, OffsetDateTime.class, Instant.class,
                Date.class, java.sql.Timestamp.class)) {
            SCALARS.put(c, FieldKind.DATE_TIME);
        }
        SCALARS.put(LocalDate.class, FieldKind.DATE);
        SCALARS.put(java.sql.Date.class, FieldKind.DATE);
        SCALARS.put(LocalTime.class, FieldKind.TIME);
        SCALARS.put(UUID.class, FieldKind.UUID);
    }

    /**
     * @throws UnsupportedTypeException     when the column type has no mapping rule
     * @throws org.oldskooler.modelforge.ConstraintConflictException when the metadata length disagrees with the declared one
     * @throws InvalidConstraintException   when a metadata constraint does not fit the field
     * @throws InvalidDefaultException      when the static default does not convert to the field type
     */
    public FieldSpec synthesize(ColumnMeta column, SynthesisContext context) {
        FieldType base = resolveType(column.property, column.javaType, column.genericType, context);
        boolean optional = column.primaryKey || (column.nullable && !column.javaType.isPrimitive());
        FieldType type = base.withOptional(optional);

        Integer declaredLength = (base.kind() == FieldKind.STRING && column.hasLength()) ? column.length : null;
        FieldConstraints constraints = ConstraintResolver.resolve(column.property, base.kind(), column.info, declaredLength);
        if (constraints.getDescription() == null && !column.doc.isEmpty()) {
            constraints = constraints.withDescription(column.doc);
        }

        FieldSpec spec = resolveDefault(column, type, constraints);
        if (constraints.isConstant() && (column.primaryKey || !column.defaultValue.isValue())) {
            throw new InvalidConstraintException(column.property, "const", "'const' needs a static default");
        }

        log.debug("Synthesized field {}", spec);
        return spec;
    }

    private FieldSpec resolveDefault(ColumnMeta column, FieldType type, FieldConstraints constraints) {
        ColumnDefault d = column.defaultValue;

        // identity values are never fabricated
        if (column.primaryKey) {
            if (!d.isNone()) {
                log.warn("Ignoring {} of primary key column '{}'; primary keys are always required", d, column.property);
            }
            return FieldSpec.required(column.property, type, constraints);
        }

        switch (d.kind()) {
            case FACTORY:
                return FieldSpec.withFactory(column.property, type, d.factory(), constraints);
            case VALUE:
                return FieldSpec.withDefault(column.property, type, convertDefault(column.property, type, d.value()), constraints);
            default:
                return type.isOptional()
                        ? FieldSpec.withDefault(column.property, type, null, constraints)
                        : FieldSpec.required(column.property, type, constraints);
        }
    }

    private Object convertDefault(String field, FieldType type, Object raw) {
        if (raw == null) return null;
        try {
            switch (type.kind()) {
                case ENUM:
                    return type.enumDefinition().resolve(raw);
                case SEQUENCE: {
                    Object source = raw instanceof CharSequence ? JsonValues.parseArray(raw.toString()) : raw;
                    List<Object> items = ValueConverter.toItems(source);
                    if (items == null) {
                        throw new IllegalArgumentException("not a sequence: " + raw);
                    }
                    Collection<Object> out = type.isUnique() ? new LinkedHashSet<>() : new ArrayList<>();
                    for (Object item : items) {
                        out.add(convertDefault(field, type.itemType(), item));
                    }
                    return type.isUnique() ? Collections.unmodifiableSet((Set<Object>) out)
                            : Collections.unmodifiableList((List<Object>) out);
                }
                case ANY:
                    return raw;
                default:
                    return ValueConverter.convert(raw, type.javaType());
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidDefaultException(field, "default '" + raw + "' is not a valid " + type, e);
        }
    }

    private FieldType resolveType(String field, Class<?> raw, Type generic, SynthesisContext context) {
        if (raw.isEnum()) {
            return FieldType.enumeration(context.enumDefinition(raw));
        }

        FieldKind kind = SCALARS.get(raw);
        if (kind != null) {
            return FieldType.scalar(kind, ValueConverter.box(raw));
        }

        if (raw.isArray() && raw != byte[].class) {
            Class<?> component = raw.getComponentType();
            return FieldType.sequence(resolveType(field, component, component, context), false);
        }

        if (Collection.class.isAssignableFrom(raw) || raw == Iterable.class) {
            boolean unique = Set.class.isAssignableFrom(raw);
            return FieldType.sequence(itemType(field, generic, context), unique);
        }

        throw new UnsupportedTypeException(field, generic);
    }

    private FieldType itemType(String field, Type generic, SynthesisContext context) {
        if (!(generic instanceof ParameterizedType)) return FieldType.any();

        Type[] args = ((ParameterizedType) generic).getActualTypeArguments();
        if (args.length != 1) return FieldType.any();

        Type arg = args[0];
        if (arg instanceof WildcardType) {
            Type[] upper = ((WildcardType) arg).getUpperBounds();
            arg = upper.length > 0 ? upper[0] : Object.class;
        }
        if (arg == Object.class) return FieldType.any();
        if (arg instanceof Class) {
            return resolveType(field, (Class<?>) arg, arg, context);
        }
        if (arg instanceof ParameterizedType) {
            return resolveType(field, (Class<?>) ((ParameterizedType) arg).getRawType(), arg, context);
        }
        // type variables and generic arrays carry no usable item type
        return FieldType.any();
    }
}
