package org.oldskooler.modelforge.annotations;

import java.lang.annotation.*;

/**
 * Free-form metadata attached to a column, written as a JSON object literal.
 * <p>
 * Keys of the constraint vocabulary ({@code ge}, {@code max_length}, {@code alias}, ...)
 * become field constraints; any other key is carried over verbatim into the field's
 * schema entry.
 * </p>
 * <pre>
 * &#64;Info("{\"ge\": 0, \"title\": \"Age in years\"}")
 * private Integer age;
 * </pre>
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Info {
    String value();
}
