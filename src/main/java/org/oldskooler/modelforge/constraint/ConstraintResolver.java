package org.oldskooler.modelforge.constraint;

import org.oldskooler.modelforge.ConstraintConflictException;
import org.oldskooler.modelforge.InvalidConstraintException;
import org.oldskooler.modelforge.util.ValueConverter;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Merges the constraints implied by a column definition with the ones declared in its
 * metadata bag, checking every vocabulary entry against the field kind.
 */
public final class ConstraintResolver {
    private ConstraintResolver() {}

    /**
     * @param field          property name, used in error messages
     * @param kind           primitive kind of the field
     * @param info           metadata bag of the column
     * @param declaredLength bounded-string length of the column type, or null
     * @throws ConstraintConflictException when {@code max_length} disagrees with the declared length
     * @throws InvalidConstraintException  when a vocabulary key does not apply to {@code kind} or has a bad value
     */
    public static FieldConstraints resolve(String field, FieldKind kind, Map<String, Object> info, Integer declaredLength) {
        FieldConstraints.Builder out = FieldConstraints.builder();
        NumericConstraints.Builder numeric = NumericConstraints.builder();
        StringConstraints.Builder string = StringConstraints.builder();
        Integer minItems = null;
        Integer maxItems = null;

        if (declaredLength != null) {
            string.maxLength(declaredLength);
        }

        for (Map.Entry<String, Object> e : info.entrySet()) {
            String k = e.getKey();
            Object v = e.getValue();
            Optional<ConstraintKey> known = ConstraintKey.byKey(k);
            if (!known.isPresent()) {
                out.extra(k, v);
                continue;
            }

            ConstraintKey key = known.get();
            if (!key.legalFor(kind)) {
                throw new InvalidConstraintException(field, k, "'" + k + "' does not apply to " + kind.label() + " fields");
            }

            switch (key) {
                case GE:
                    numeric.ge(number(field, k, v));
                    break;
                case GT:
                    numeric.gt(number(field, k, v));
                    break;
                case LE:
                    numeric.le(number(field, k, v));
                    break;
                case LT:
                    numeric.lt(number(field, k, v));
                    break;
                case MULTIPLE_OF: {
                    Number m = number(field, k, v);
                    if (ValueConverter.toBigDecimal(m).signum() <= 0) {
                        throw new InvalidConstraintException(field, k, "'" + k + "' must be greater than 0, got " + m);
                    }
                    numeric.multipleOf(m);
                    break;
                }
                case MIN_ITEMS:
                    minItems = count(field, k, v);
                    break;
                case MAX_ITEMS:
                    maxItems = count(field, k, v);
                    break;
                case MIN_LENGTH:
                    string.minLength(count(field, k, v));
                    break;
                case MAX_LENGTH: {
                    int maxLength = count(field, k, v);
                    if (declaredLength != null && maxLength != declaredLength) {
                        throw new ConstraintConflictException(field, k, maxLength, declaredLength);
                    }
                    string.maxLength(maxLength);
                    break;
                }
                case REGEX:
                    string.regex(pattern(field, k, v));
                    break;
                case ALIAS:
                    out.alias(text(field, k, v));
                    break;
                case TITLE:
                    out.title(text(field, k, v));
                    break;
                case DESCRIPTION:
                    out.description(text(field, k, v));
                    break;
                case CONST:
                    out.constant(flag(field, k, v));
                    break;
                case EXAMPLE:
                    out.example(v);
                    break;
                case ALLOW_MUTATION:
                    out.allowMutation(flag(field, k, v));
                    break;
                default:
                    throw new IllegalStateException("Unhandled constraint key: " + key);
            }
        }

        return out.numeric(numeric.build())
                .string(string.build())
                .sequence(SequenceConstraints.of(minItems, maxItems))
                .build();
    }

    private static Number number(String field, String key, Object v) {
        if (v instanceof Number) {
            try {
                ValueConverter.toBigDecimal((Number) v);
                return (Number) v;
            } catch (NumberFormatException e) {
                throw new InvalidConstraintException(field, key, "'" + key + "' must be a finite number, got " + v, e);
            }
        }
        throw new InvalidConstraintException(field, key, "'" + key + "' must be a number, got " + describe(v));
    }

    private static int count(String field, String key, Object v) {
        if (v instanceof Number) {
            try {
                int n = ValueConverter.toBigDecimal((Number) v).intValueExact();
                if (n >= 0) return n;
            } catch (ArithmeticException | NumberFormatException e) {
                throw new InvalidConstraintException(field, key, "'" + key + "' must be a non-negative integer, got " + v, e);
            }
        }
        throw new InvalidConstraintException(field, key, "'" + key + "' must be a non-negative integer, got " + describe(v));
    }

    private static Pattern pattern(String field, String key, Object v) {
        String regex = text(field, key, v);
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidConstraintException(field, key, "'" + key + "' is not a valid pattern: " + regex, e);
        }
    }

    private static String text(String field, String key, Object v) {
        if (v instanceof String) return (String) v;
        throw new InvalidConstraintException(field, key, "'" + key + "' must be a string, got " + describe(v));
    }

    private static boolean flag(String field, String key, Object v) {
        if (v instanceof Boolean) return (Boolean) v;
        throw new InvalidConstraintException(field, key, "'" + key + "' must be a boolean, got " + describe(v));
    }

    private static String describe(Object v) {
        return v == null ? "null" : v.getClass().getSimpleName() + " " + v;
    }
}
