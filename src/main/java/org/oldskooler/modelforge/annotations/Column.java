package org.oldskooler.modelforge.annotations;

import java.lang.annotation.*;
import java.util.function.Supplier;

@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    String DEFAULT_NONE = "\u0000";   // sentinel

    /** Whether the column accepts NULL. Ignored for primitive fields. */
    boolean nullable() default true;

    /** Declared length of a bounded string column (VARCHAR(n)). -1 means unbounded. */
    int length() default -1;

    /**
     * Static default value, in its textual form. Converted to the field type at synthesis time;
     * enum defaults name the member value, sequence defaults are JSON arrays.
     */
    String defaultValue() default DEFAULT_NONE;

    /** Default computed on every construction. Needs a no-arg constructor. */
    Class<? extends Supplier<?>> defaultFactory() default NoFactory.class;

    /** Column documentation, used as the field description when the metadata has none. */
    String doc() default "";

    /** Placeholder for "no default factory declared". */
    final class NoFactory implements Supplier<Object> {
        private NoFactory() {}

        @Override
        public Object get() {
            throw new UnsupportedOperationException("NoFactory is a marker");
        }
    }
}
