package org.oldskooler.modelforge.model;

import org.oldskooler.modelforge.constraint.FieldConstraints;
import org.oldskooler.modelforge.constraint.FieldKind;
import org.oldskooler.modelforge.constraint.NumericConstraints;
import org.oldskooler.modelforge.constraint.SequenceConstraints;
import org.oldskooler.modelforge.constraint.StringConstraints;
import org.oldskooler.modelforge.synth.FieldSpec;
import org.oldskooler.modelforge.synth.FieldType;
import org.oldskooler.modelforge.util.ValueConverter;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.util.*;

/**
 * Coerces an input value to a field's type and checks the field constraints.
 * Problems are appended to an error list instead of thrown, so a whole model can be
 * validated in one pass.
 */
final class FieldValidator {
    /** Marks a value that failed coercion; never stored on an instance. */
    private static final Object INVALID = new Object();

    private FieldValidator() {}

    /**
     * @return the coerced value; meaningless when errors were added
     */
    static Object validate(FieldSpec field, Object raw, List<ValidationError> errors) {
        List<Object> loc = new ArrayList<>();
        loc.add(field.alias());

        if (raw == null) {
            if (!field.type().isOptional()) {
                errors.add(new ValidationError(loc, "none is not an allowed value", "type_error.none.not_allowed"));
            }
            return null;
        }

        int before = errors.size();
        Object value = coerce(field.type(), raw, loc, errors);
        if (value == INVALID || errors.size() > before) return null;

        checkConstraints(field, value, loc, errors);
        return value;
    }

    private static Object coerce(FieldType type, Object raw, List<Object> loc, List<ValidationError> errors) {
        switch (type.kind()) {
            case ANY:
                return raw;
            case ENUM:
                try {
                    return type.enumDefinition().resolve(raw);
                } catch (IllegalArgumentException e) {
                    errors.add(new ValidationError(loc, "value is not a valid enumeration member; permitted: "
                            + type.enumDefinition().permitted(), "type_error.enum"));
                    return INVALID;
                }
            case SEQUENCE:
                return coerceSequence(type, raw, loc, errors);
            default:
                try {
                    return ValueConverter.convert(raw, type.javaType());
                } catch (IllegalArgumentException | DateTimeException e) {
                    errors.add(new ValidationError(loc, typeMessage(type), typeError(type)));
                    return INVALID;
                }
        }
    }

    private static Object coerceSequence(FieldType type, Object raw, List<Object> loc, List<ValidationError> errors) {
        List<Object> items = (raw instanceof CharSequence || raw instanceof Map) ? null : ValueConverter.toItems(raw);
        if (items == null) {
            errors.add(new ValidationError(loc, typeMessage(type), typeError(type)));
            return INVALID;
        }

        Collection<Object> out = type.isUnique() ? new LinkedHashSet<>() : new ArrayList<>(items.size());
        FieldType itemType = type.itemType();
        boolean failed = false;
        for (int i = 0; i < items.size(); i++) {
            List<Object> itemLoc = new ArrayList<>(loc);
            itemLoc.add(i);
            Object item = items.get(i);
            if (item == null) {
                if (itemType.kind() != FieldKind.ANY) {
                    errors.add(new ValidationError(itemLoc, "none is not an allowed value", "type_error.none.not_allowed"));
                    failed = true;
                }
                out.add(null);
                continue;
            }
            Object v = coerce(itemType, item, itemLoc, errors);
            if (v == INVALID) {
                failed = true;
            } else {
                out.add(v);
            }
        }
        if (failed) return INVALID;
        return type.isUnique()
                ? Collections.unmodifiableSet((Set<Object>) out)
                : Collections.unmodifiableList((List<Object>) out);
    }

    private static void checkConstraints(FieldSpec field, Object value, List<Object> loc, List<ValidationError> errors) {
        FieldConstraints c = field.constraints();

        if (value instanceof Number && !c.getNumeric().isEmpty()) {
            checkNumeric(c.getNumeric(), (Number) value, loc, errors);
        }
        if ((value instanceof String || value instanceof Character) && !c.getString().isEmpty()) {
            checkString(c.getString(), value.toString(), loc, errors);
        }
        if (value instanceof Collection && !c.getSequence().isEmpty()) {
            checkSequence(c.getSequence(), ((Collection<?>) value).size(), loc, errors);
        }
        if (c.isConstant() && !Objects.equals(value, field.defaultValue())) {
            errors.add(new ValidationError(loc, "unexpected value; permitted: " + repr(field.defaultValue()), "value_error.const"));
        }
    }

    private static void checkNumeric(NumericConstraints c, Number value, List<Object> loc, List<ValidationError> errors) {
        if (c.getGt() != null && compare(value, c.getGt()) <= 0) {
            errors.add(new ValidationError(loc, "ensure this value is greater than " + c.getGt(), "value_error.number.not_gt"));
        }
        if (c.getGe() != null && compare(value, c.getGe()) < 0) {
            errors.add(new ValidationError(loc, "ensure this value is greater than or equal to " + c.getGe(), "value_error.number.not_ge"));
        }
        if (c.getLt() != null && compare(value, c.getLt()) >= 0) {
            errors.add(new ValidationError(loc, "ensure this value is less than " + c.getLt(), "value_error.number.not_lt"));
        }
        if (c.getLe() != null && compare(value, c.getLe()) > 0) {
            errors.add(new ValidationError(loc, "ensure this value is less than or equal to " + c.getLe(), "value_error.number.not_le"));
        }
        if (c.getMultipleOf() != null && !isMultiple(value, c.getMultipleOf())) {
            errors.add(new ValidationError(loc, "ensure this value is a multiple of " + c.getMultipleOf(), "value_error.number.not_multiple"));
        }
    }

    private static void checkString(StringConstraints c, String value, List<Object> loc, List<ValidationError> errors) {
        int length = value.codePointCount(0, value.length());
        if (c.getMinLength() != null && length < c.getMinLength()) {
            errors.add(new ValidationError(loc, "ensure this value has at least " + c.getMinLength() + " characters", "value_error.any_str.min_length"));
        }
        if (c.getMaxLength() != null && length > c.getMaxLength()) {
            errors.add(new ValidationError(loc, "ensure this value has at most " + c.getMaxLength() + " characters", "value_error.any_str.max_length"));
        }
        if (c.getRegex() != null && !c.getRegex().matcher(value).lookingAt()) {
            errors.add(new ValidationError(loc, "string does not match regex \"" + c.getRegex().pattern() + "\"", "value_error.str.regex"));
        }
    }

    private static void checkSequence(SequenceConstraints c, int size, List<Object> loc, List<ValidationError> errors) {
        if (c.getMinItems() != null && size < c.getMinItems()) {
            errors.add(new ValidationError(loc, "ensure this value has at least " + c.getMinItems() + " items", "value_error.list.min_items"));
        }
        if (c.getMaxItems() != null && size > c.getMaxItems()) {
            errors.add(new ValidationError(loc, "ensure this value has at most " + c.getMaxItems() + " items", "value_error.list.max_items"));
        }
    }

    private static int compare(Number a, Number b) {
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return ValueConverter.toBigDecimal(a).compareTo(ValueConverter.toBigDecimal(b));
    }

    private static boolean isMultiple(Number value, Number of) {
        if (!isFinite(value)) return false;
        BigDecimal remainder = ValueConverter.toBigDecimal(value).remainder(ValueConverter.toBigDecimal(of));
        return remainder.signum() == 0;
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double) return Double.isFinite((Double) n);
        if (n instanceof Float) return Float.isFinite((Float) n);
        return true;
    }

    private static String repr(Object v) {
        if (v instanceof CharSequence) return "'" + v + "'";
        return String.valueOf(v);
    }

    private static String typeMessage(FieldType type) {
        switch (type.kind()) {
            case INTEGER:
                return "value is not a valid integer";
            case NUMBER:
                return type.javaType() == BigDecimal.class ? "value is not a valid decimal" : "value is not a valid float";
            case STRING:
                return "str type expected";
            case BOOLEAN:
                return "value could not be parsed to a boolean";
            case DATE_TIME:
                return "invalid datetime format";
            case DATE:
                return "invalid date format";
            case TIME:
                return "invalid time format";
            case UUID:
                return "value is not a valid uuid";
            case SEQUENCE:
                return type.isUnique() ? "value is not a valid set" : "value is not a valid list";
            default:
                return "invalid value";
        }
    }

    private static String typeError(FieldType type) {
        switch (type.kind()) {
            case INTEGER:
                return "type_error.integer";
            case NUMBER:
                return type.javaType() == BigDecimal.class ? "type_error.decimal" : "type_error.float";
            case STRING:
                return "type_error.str";
            case BOOLEAN:
                return "type_error.bool";
            case DATE_TIME:
                return "value_error.datetime";
            case DATE:
                return "value_error.date";
            case TIME:
                return "value_error.time";
            case UUID:
                return "type_error.uuid";
            case SEQUENCE:
                return type.isUnique() ? "type_error.set" : "type_error.list";
            default:
                return "value_error";
        }
    }
}
