package org.oldskooler.modelforge.util;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Lenient scalar conversions shared by default parsing and model validation.
 * Every failure surfaces as an {@link IllegalArgumentException}.
 */
public final class ValueConverter {
    private static final DateTimeFormatter SQL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueConverter() {}

    public static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        return type;
    }

    public static Object convert(Object val, Class<?> targetType) {
        if (val == null) return null;
        Class<?> target = box(targetType);
        if (target.isInstance(val)) return val;

        if (Number.class.isAssignableFrom(target)) return toNumber(val, target);
        if (target == Boolean.class) return toBoolean(val);
        if (target == String.class) {
            if (val instanceof CharSequence || val instanceof Number || val instanceof Character) return String.valueOf(val);
            throw mismatch(val, target);
        }
        if (target == Character.class) {
            String s = String.valueOf(val);
            if (val instanceof CharSequence && s.length() == 1) return s.charAt(0);
            throw mismatch(val, target);
        }
        if (target == UUID.class) {
            if (val instanceof CharSequence) return UUID.fromString(val.toString().trim());
            throw mismatch(val, target);
        }

        try {
            if (target == LocalDate.class) {
                if (val instanceof java.sql.Date) return ((java.sql.Date) val).toLocalDate();
                if (val instanceof LocalDateTime) return ((LocalDateTime) val).toLocalDate();
                if (val instanceof CharSequence) return LocalDate.parse(val.toString().trim());
            }

            if (target == LocalDateTime.class) {
                if (val instanceof Timestamp) return ((Timestamp) val).toLocalDateTime();
                if (val instanceof CharSequence) {
                    String s = val.toString().trim();
                    try {
                        return LocalDateTime.parse(s); // ISO-8601, e.g. 2025-09-27T15:30:00
                    } catch (DateTimeException e) {
                        return LocalDateTime.parse(s, SQL_DATE_TIME);
                    }
                }
            }

            if (target == OffsetDateTime.class) {
                if (val instanceof Date) return OffsetDateTime.ofInstant(((Date) val).toInstant(), ZoneId.systemDefault());
                if (val instanceof Instant) return OffsetDateTime.ofInstant((Instant) val, ZoneId.systemDefault());
                if (val instanceof CharSequence) return OffsetDateTime.parse(val.toString().trim());
            }

            if (target == Instant.class) {
                if (val instanceof Date) return ((Date) val).toInstant();
                if (val instanceof OffsetDateTime) return ((OffsetDateTime) val).toInstant();
                if (val instanceof CharSequence) return Instant.parse(val.toString().trim());
            }

            if (target == LocalTime.class) {
                if (val instanceof Time) return ((Time) val).toLocalTime();
                if (val instanceof CharSequence) return LocalTime.parse(val.toString().trim());
            }

            if (target == Timestamp.class) {
                if (val instanceof LocalDateTime) return Timestamp.valueOf((LocalDateTime) val);
                if (val instanceof CharSequence) return Timestamp.valueOf((LocalDateTime) convert(val, LocalDateTime.class));
            }

            if (target == java.sql.Date.class) {
                if (val instanceof LocalDate) return java.sql.Date.valueOf((LocalDate) val);
                if (val instanceof CharSequence) return java.sql.Date.valueOf(LocalDate.parse(val.toString().trim()));
            }

            if (target == Date.class) {
                if (val instanceof Instant) return Date.from((Instant) val);
                if (val instanceof CharSequence) return Date.from(Instant.parse(val.toString().trim()));
            }
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Cannot parse '" + val + "' as " + target.getSimpleName(), e);
        }

        throw mismatch(val, target);
    }

    /** Items of a collection or array, in iteration order; null for anything else. */
    public static List<Object> toItems(Object val) {
        if (val instanceof Collection) return new ArrayList<>((Collection<?>) val);
        if (val != null && val.getClass().isArray()) {
            int n = Array.getLength(val);
            List<Object> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) out.add(Array.get(val, i));
            return out;
        }
        return null;
    }

    public static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        return new BigDecimal(n.toString());
    }

    private static Object toNumber(Object val, Class<?> target) {
        BigDecimal bd;
        if (val instanceof Number) {
            bd = toBigDecimal((Number) val);
        } else if (val instanceof CharSequence) {
            bd = new BigDecimal(val.toString().trim());
        } else {
            throw mismatch(val, target);
        }

        try {
            if (target == Integer.class) return bd.intValueExact();
            if (target == Long.class) return bd.longValueExact();
            if (target == Short.class) return bd.shortValueExact();
            if (target == Byte.class) return bd.byteValueExact();
            if (target == BigInteger.class) return bd.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("'" + val + "' is not a whole " + target.getSimpleName(), e);
        }
        if (target == Double.class) return bd.doubleValue();
        if (target == Float.class) return bd.floatValue();
        if (target == BigDecimal.class) return bd;
        throw mismatch(val, target);
    }

    private static Boolean toBoolean(Object val) {
        if (val instanceof Number) {
            BigDecimal bd = toBigDecimal((Number) val);
            if (bd.compareTo(BigDecimal.ONE) == 0) return Boolean.TRUE;
            if (bd.signum() == 0) return Boolean.FALSE;
        }
        if (val instanceof CharSequence) {
            switch (val.toString().trim().toLowerCase(Locale.ROOT)) {
                case "1":
                case "on":
                case "t":
                case "true":
                case "y":
                case "yes":
                    return Boolean.TRUE;
                case "0":
                case "off":
                case "f":
                case "false":
                case "n":
                case "no":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw mismatch(val, Boolean.class);
    }

    private static IllegalArgumentException mismatch(Object val, Class<?> target) {
        return new IllegalArgumentException("Cannot convert " + val.getClass().getName() + " to " + target.getName());
    }
}
