package org.oldskooler.modelforge.annotations;

import java.lang.annotation.*;

/**
 * Marks the primary key column. Primary key fields are always required on the
 * synthesized model, whatever default the column declares.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Id {
}
